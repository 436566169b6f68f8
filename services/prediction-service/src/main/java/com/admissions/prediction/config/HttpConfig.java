package com.admissions.prediction.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client for the out-of-process model runner. Only created in remote mode.
 */
@Configuration
@ConditionalOnProperty(prefix = "model", name = "mode", havingValue = "remote")
public class HttpConfig {

    @Bean
    public RestTemplate modelRestTemplate(RestTemplateBuilder builder, ModelProperties properties) {
        ModelProperties.Remote remote = properties.getRemote();
        return builder
                .rootUri(remote.getBaseUrl())
                .setConnectTimeout(remote.getConnectTimeout())
                .setReadTimeout(remote.getReadTimeout())
                .build();
    }
}
