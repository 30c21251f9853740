package com.expenseflow.backend.modules.directory.infrastructure;

import java.util.List;

import com.expenseflow.backend.global.config.ExpenseFlowProperties;
import com.expenseflow.backend.global.error.ProblemException;
import com.expenseflow.backend.modules.directory.domain.ExternalEmployeeRecord;
import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

@Component
public class HttpExternalDirectoryClient implements ExternalDirectoryClient {

    private static final Logger log = LoggerFactory.getLogger(HttpExternalDirectoryClient.class);

    static final String TOKEN_HEADER = "token";

    private final RestTemplate directoryRestTemplate;
    private final ExternalRosterMapper rosterMapper;
    private final ExpenseFlowProperties properties;

    public HttpExternalDirectoryClient(
            RestTemplate directoryRestTemplate,
            ExternalRosterMapper rosterMapper,
            ExpenseFlowProperties properties
    ) {
        this.directoryRestTemplate = directoryRestTemplate;
        this.rosterMapper = rosterMapper;
        this.properties = properties;
    }

    @Override
    public List<ExternalEmployeeRecord> fetchRoster() {
        ExpenseFlowProperties.Directory directory = properties.directory();
        if (!directory.isConfigured()) {
            throw new ProblemException(
                    HttpStatus.SERVICE_UNAVAILABLE,
                    "DirectoryNotConfigured",
                    "External directory URL and token must be configured"
            );
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(TOKEN_HEADER, directory.token());

        ResponseEntity<JsonNode> response;
        try {
            response = directoryRestTemplate.exchange(
                    directory.baseUrl(),
                    HttpMethod.GET,
                    new HttpEntity<>(headers),
                    JsonNode.class
            );
        } catch (RestClientException ex) {
            log.error("External directory request failed: {}", ex.getMessage(), ex);
            throw new ProblemException(
                    HttpStatus.BAD_GATEWAY,
                    "DirectoryUnavailable",
                    "External directory request failed"
            );
        }

        List<ExternalEmployeeRecord> records = rosterMapper.map(response.getBody());
        log.info("Fetched {} roster records from external directory", records.size());
        return records;
    }
}
