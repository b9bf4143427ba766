package com.phillippitts.audiogen.service.synthesis;

import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;

import java.util.Locale;
import java.util.Set;

/**
 * Classifies SDK failures that mean "the session's credentials are no longer valid".
 * Those trigger a session refresh; every other failure is a plain transport error.
 */
final class CredentialExpiry {

    private static final Set<String> EXPIRED_ERROR_CODES = Set.of(
            "ExpiredToken",
            "ExpiredTokenException",
            "UnrecognizedClientException",
            "InvalidClientTokenId",
            "RequestExpired");

    private CredentialExpiry() {}

    static boolean isCredentialExpiry(SdkException e) {
        if (e instanceof AwsServiceException ase) {
            AwsErrorDetails details = ase.awsErrorDetails();
            return details != null && EXPIRED_ERROR_CODES.contains(details.errorCode());
        }
        if (e instanceof SdkClientException) {
            String msg = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
            // SSO token resolution failures are reported as client-side errors
            return msg.contains("token") && (msg.contains("expired") || msg.contains("refresh")
                    || msg.contains("retriev") || msg.contains("sso"));
        }
        return false;
    }
}
