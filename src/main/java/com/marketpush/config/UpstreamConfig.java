package com.marketpush.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP clients for the two outbound integrations: the content upstream
 * ({@link RestClient}) and the Telegram Bot API ({@link RestTemplate}).
 */
@Configuration
public class UpstreamConfig {

    private static final Logger log = LoggerFactory.getLogger(UpstreamConfig.class);

    private final PushProperties pushProperties;

    public UpstreamConfig(PushProperties pushProperties) {
        this.pushProperties = pushProperties;
    }

    @Bean
    public RestClient upstreamRestClient() {
        PushProperties.Upstream upstream = pushProperties.getUpstream();
        log.info("Creating upstream RestClient for {}", upstream.getBaseUrl());
        return RestClient.builder()
                .baseUrl(upstream.getBaseUrl())
                .requestFactory(requestFactory())
                .build();
    }

    @Bean
    public RestTemplate telegramRestTemplate() {
        return new RestTemplate(requestFactory());
    }

    private SimpleClientHttpRequestFactory requestFactory() {
        PushProperties.Upstream upstream = pushProperties.getUpstream();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(upstream.getConnectTimeout());
        requestFactory.setReadTimeout(upstream.getReadTimeout());
        return requestFactory;
    }
}
