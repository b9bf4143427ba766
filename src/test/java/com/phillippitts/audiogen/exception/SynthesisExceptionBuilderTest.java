package com.phillippitts.audiogen.exception;

import com.phillippitts.audiogen.service.synthesis.BackendStatus;
import com.phillippitts.audiogen.util.LogContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SynthesisExceptionBuilderTest {

    @AfterEach
    void clearContext() {
        LogContext.clearRequest();
    }

    @Test
    void rejectsEmptyMessage() {
        assertThatThrownBy(() -> SynthesisExceptionBuilder.create(""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SynthesisExceptionBuilder.create(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void plainMessageWhenNoDetails() {
        assertThat(SynthesisExceptionBuilder.create("boom").detailedMessage()).isEqualTo("boom");
    }

    @Test
    void detailsAppearInFixedOrder() {
        TransportException ex = SynthesisExceptionBuilder.create("Backend returned HTTP 502")
                .backend("http")
                .metadata("body", "Bad gateway")
                .durationMs(120)
                .httpStatus(502)
                .chunkIndex(3)
                .requestId("r1")
                .transport();

        assertThat(ex.getMessage()).isEqualTo(
                "Backend returned HTTP 502 (requestId=r1, chunk=3, httpStatus=502, durationMs=120, body=Bad gateway)"
                        + " (backend: http)");
        assertThat(ex.getHttpStatus()).isEqualTo(502);
    }

    @Test
    void nullMetadataIsSkipped() {
        String message = SynthesisExceptionBuilder.create("m")
                .metadata("a", null)
                .metadata(null, "b")
                .metadata("c", 1)
                .detailedMessage();

        assertThat(message).isEqualTo("m (c=1)");
    }

    @Test
    void logContextFillsMissingIdentifiers() {
        LogContext.putRequest("req-5", "Joanna");
        LogContext.putChunk(8);

        DecodeException ex = SynthesisExceptionBuilder.create("Response is not valid JSON")
                .backend("http")
                .withLogContext()
                .decode();

        assertThat(ex.getRequestId()).isEqualTo("req-5");
        assertThat(ex.getChunkIndex()).isEqualTo(8);
    }

    @Test
    void explicitIdentifiersWinOverLogContext() {
        LogContext.putRequest("req-5", "Joanna");
        LogContext.putChunk(8);

        DecodeException ex = SynthesisExceptionBuilder.create("m")
                .requestId("explicit")
                .chunkIndex(1)
                .withLogContext()
                .decode();

        assertThat(ex.getRequestId()).isEqualTo("explicit");
        assertThat(ex.getChunkIndex()).isEqualTo(1);
    }

    @Test
    void statusCarriesRawCode() {
        BackendStatusException ex = SynthesisExceptionBuilder.create(BackendStatus.describe(2))
                .backend("http")
                .status(2);

        assertThat(ex.getStatus()).isEqualTo(BackendStatus.TEXT_TOO_LONG);
        assertThat(ex.getStatusCode()).isEqualTo(2);
        assertThat(ex.getMessage()).contains("statusCode=2").contains("(code 2)");
    }

    @Test
    void missingBackendIsReportedAsUnknown() {
        IOException cause = new IOException("reset");
        TransportException ex = SynthesisExceptionBuilder.create("m").cause(cause).transport();

        assertThat(ex.getBackend()).isEqualTo("unknown");
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.getHttpStatus()).isNull();
    }
}
