package com.phillippitts.audiogen.config;

import com.phillippitts.audiogen.config.properties.PipelineProperties;
import com.phillippitts.audiogen.service.request.JsonFileRequestSource;
import com.phillippitts.audiogen.service.request.RequestSource;
import com.phillippitts.audiogen.service.request.SampleRequestSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Selects where requests come from: the configured JSON catalog, or the built-in sample.
 */
@Configuration
public class PipelineConfig {

    @Bean
    @ConditionalOnMissingBean(RequestSource.class)
    public RequestSource requestSource(PipelineProperties props) {
        String file = props.requestsFile();
        if (file == null || file.isBlank()) {
            return new SampleRequestSource();
        }
        return new JsonFileRequestSource(Path.of(file));
    }
}
