package com.phillippitts.audiogen.service.pipeline;

import java.util.List;

/**
 * Outcomes of a completed run, in request order.
 */
public record BatchReport(List<RequestOutcome> outcomes) {

    /** Every request produced an artifact. */
    public static final int EXIT_OK = 0;
    /** Run aborted by a fatal error (authentication exhausted, invalid configuration). */
    public static final int EXIT_FATAL = 1;
    /** Run completed but at least one request failed. */
    public static final int EXIT_PARTIAL = 2;

    public BatchReport {
        outcomes = List.copyOf(outcomes);
    }

    public long succeeded() {
        return outcomes.stream().filter(RequestOutcome::succeeded).count();
    }

    public long failed() {
        return outcomes.size() - succeeded();
    }

    public int exitCode() {
        return failed() == 0 ? EXIT_OK : EXIT_PARTIAL;
    }
}
