package com.phillippitts.audiogen.service.request;

import com.phillippitts.audiogen.domain.SynthesisRequest;

import java.util.List;

/**
 * Enumerates the requests of one run.
 */
public interface RequestSource {

    /**
     * @return requests in processing order
     * @throws com.phillippitts.audiogen.exception.InvalidConfigException if the catalog is unreadable
     */
    List<SynthesisRequest> load();

    /**
     * @return short description for logs
     */
    String describe();
}
