package com.phillippitts.audiogen.service.synthesis;

import org.junit.jupiter.api.Test;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.polly.model.PollyException;

import static org.assertj.core.api.Assertions.assertThat;

class CredentialExpiryTest {

    @Test
    void expiredTokenServiceErrorsAreCredentialExpiry() {
        for (String code : new String[]{"ExpiredTokenException", "ExpiredToken", "UnrecognizedClientException",
                "InvalidClientTokenId", "RequestExpired"}) {
            assertThat(CredentialExpiry.isCredentialExpiry(serviceError(code))).as(code).isTrue();
        }
    }

    @Test
    void otherServiceErrorsAreNot() {
        assertThat(CredentialExpiry.isCredentialExpiry(serviceError("TextLengthExceededException"))).isFalse();
        assertThat(CredentialExpiry.isCredentialExpiry(serviceError("ThrottlingException"))).isFalse();
    }

    @Test
    void ssoTokenResolutionFailuresAreCredentialExpiry() {
        SdkClientException e = SdkClientException.create(
                "Unable to load credentials: The SSO session associated with this profile has expired or is "
                        + "otherwise invalid. To refresh this SSO session run aws sso login. Token has expired");

        assertThat(CredentialExpiry.isCredentialExpiry(e)).isTrue();
    }

    @Test
    void plainClientErrorsAreNot() {
        assertThat(CredentialExpiry.isCredentialExpiry(SdkClientException.create("Unable to execute HTTP request")))
                .isFalse();
    }

    private static PollyException serviceError(String code) {
        return (PollyException) PollyException.builder()
                .awsErrorDetails(AwsErrorDetails.builder().errorCode(code).errorMessage(code).build())
                .message(code)
                .build();
    }
}
