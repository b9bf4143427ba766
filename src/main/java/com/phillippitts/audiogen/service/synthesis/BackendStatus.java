package com.phillippitts.audiogen.service.synthesis;

/**
 * Status codes reported in the HTTP backend's response body, with their diagnostics.
 * Only {@link #SUCCESS} carries audio; every other status fails the request.
 */
public enum BackendStatus {
    SUCCESS(0, "Success"),
    INVALID_ACCOUNT(1, "Invalid account or missing parameters"),
    TEXT_TOO_LONG(2, "Text exceeds the backend character limit"),
    FAILED(3, "Synthesis failed for an unspecified reason"),
    INVALID_SPEAKER(4, "Invalid speaker id"),
    UNKNOWN(-1, "Unknown status code");

    private final int code;
    private final String description;

    BackendStatus(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public int code() {
        return code;
    }

    public String description() {
        return description;
    }

    public boolean isSuccess() {
        return this == SUCCESS;
    }

    /**
     * @return matching status, or {@link #UNKNOWN} for any code outside 0..4
     */
    public static BackendStatus fromCode(int code) {
        for (BackendStatus status : values()) {
            if (status != UNKNOWN && status.code == code) {
                return status;
            }
        }
        return UNKNOWN;
    }

    /**
     * Human-readable diagnostic including the raw code, e.g. {@code "Invalid speaker id (code 4)"}.
     */
    public static String describe(int code) {
        return fromCode(code).description + " (code " + code + ")";
    }
}
