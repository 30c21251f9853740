package com.expenseflow.backend.global.config;

import com.expenseflow.backend.global.web.RequestIdFilter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.web.client.RestTemplate;

/**
 * Outbound HTTP client used for the HR roster. Propagates the inbound request id.
 */
@Configuration
public class HttpClientConfig {

    private static final Logger log = LoggerFactory.getLogger(HttpClientConfig.class);

    @Bean
    public RestTemplate directoryRestTemplate(RestTemplateBuilder builder, ExpenseFlowProperties properties) {
        ExpenseFlowProperties.Directory directory = properties.directory();
        log.info("Directory client configured with connect timeout {} and read timeout {}",
                directory.connectTimeout(), directory.readTimeout());
        return builder
                .setConnectTimeout(directory.connectTimeout())
                .setReadTimeout(directory.readTimeout())
                .additionalInterceptors(requestIdInterceptor())
                .build();
    }

    private ClientHttpRequestInterceptor requestIdInterceptor() {
        return (request, body, execution) -> {
            RequestIdFilter.currentRequestId()
                    .filter(id -> !request.getHeaders().containsKey(RequestIdFilter.REQUEST_ID_HEADER))
                    .ifPresent(id -> request.getHeaders().add(RequestIdFilter.REQUEST_ID_HEADER, id));
            return execution.execute(request, body);
        };
    }
}
