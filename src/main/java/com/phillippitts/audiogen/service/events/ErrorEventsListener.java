package com.phillippitts.audiogen.service.events;

import com.phillippitts.audiogen.service.synthesis.event.BackendFailureEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for backend failure events. Privacy-safe and throttled to avoid log spam
 * when a backend is down and every chunk of every request fails the same way.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onBackendFailure(BackendFailureEvent e) {
        String key = "backend-" + e.backend() + '-' + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Backend failure: backend={}, reason={}, context={}. {}",
                    e.backend(), e.reason(), e.context(), hint(e.reason()));
        }
    }

    private static String hint(String reason) {
        if (reason == null) {
            return "";
        }
        if (reason.equals("transport")) {
            return "Check network access and the backend URL.";
        }
        if (reason.equals("status-invalid_account")) {
            return "Check audiogen.http.account-id and audiogen.http.map-type.";
        }
        if (reason.equals("status-text_too_long")) {
            return "Lower audiogen.pipeline.max-chunk-length.";
        }
        if (reason.equals("status-invalid_speaker")) {
            return "Check the request's speaker id.";
        }
        return "";
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
