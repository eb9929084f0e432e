package com.starscape.mediareaper.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HTTP client base for the downloader integrations, with bounded connect and read timeouts.
 * Each integration clones it and adds its own base URL and API key.
 */
@Configuration
public class IntegrationClientConfig {
    
    @Bean
    public RestClient.Builder integrationRestClientBuilder(IntegrationProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.getReadTimeout().toMillis());
        return RestClient.builder().requestFactory(requestFactory);
    }
}
