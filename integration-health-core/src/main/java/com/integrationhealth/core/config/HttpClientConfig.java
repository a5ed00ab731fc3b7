package com.integrationhealth.core.config;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.ResponseErrorHandler;
import org.springframework.web.client.RestTemplate;

/**
 * Outbound client for the provider probes. Timeouts follow the probe timeout, and non-2xx responses are returned
 * instead of thrown so each prober classifies status codes itself.
 */
@Configuration(proxyBeanMethods = false)
public class HttpClientConfig {

    @Bean
    public RestTemplate integrationHealthRestTemplate(ObjectProvider<RestTemplateBuilder> builderProvider,
                                                      IntegrationHealthProperties properties) {
        RestTemplateBuilder builder = builderProvider.getIfAvailable(RestTemplateBuilder::new);
        return builder
            .setConnectTimeout(properties.probe().timeout())
            .setReadTimeout(properties.probe().timeout())
            .errorHandler(new PassThroughErrorHandler())
            .build();
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
