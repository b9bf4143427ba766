package com.phillippitts.audiogen;

import com.phillippitts.audiogen.config.properties.HttpBackendProperties;
import com.phillippitts.audiogen.config.properties.PipelineProperties;
import com.phillippitts.audiogen.config.properties.PollyProperties;
import com.phillippitts.audiogen.config.properties.ThreadPoolProperties;
import com.phillippitts.audiogen.config.properties.VoiceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        PipelineProperties.class,
        VoiceProperties.class,
        PollyProperties.class,
        HttpBackendProperties.class,
        ThreadPoolProperties.class
})
public class AudioGenApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(AudioGenApplication.class, args)));
    }

}
