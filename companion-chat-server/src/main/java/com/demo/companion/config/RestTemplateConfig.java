package com.demo.companion.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResponseErrorHandler;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * RestTemplate for the completion API.
 * Non-2xx responses are returned to the caller instead of thrown, so retry
 * classification can look at the status code.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate completionRestTemplate(
            @Value("${companion.completion.connect-timeout:10s}") Duration connectTimeout,
            @Value("${companion.completion.read-timeout:45s}") Duration readTimeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) connectTimeout.toMillis());
        requestFactory.setReadTimeout((int) readTimeout.toMillis());

        RestTemplate restTemplate = new RestTemplate(requestFactory);
        restTemplate.setErrorHandler(new PassThroughErrorHandler());
        return restTemplate;
    }

    static class PassThroughErrorHandler implements ResponseErrorHandler {

        @Override
        public boolean hasError(ClientHttpResponse response) {
            return false;
        }

        @Override
        public void handleError(ClientHttpResponse response) {
            // never called, hasError is always false
        }
    }
}
