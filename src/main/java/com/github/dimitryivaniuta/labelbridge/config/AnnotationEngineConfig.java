package com.github.dimitryivaniuta.labelbridge.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class AnnotationEngineConfig {

    @Bean
    public RestTemplate annotationEngineRestTemplate(RestTemplateBuilder builder, LabelBridgeProperties props) {
        LabelBridgeProperties.Engine engine = props.getEngine();
        return builder
                .setConnectTimeout(engine.getConnectTimeout())
                .setReadTimeout(engine.getReadTimeout())
                .build();
    }
}
