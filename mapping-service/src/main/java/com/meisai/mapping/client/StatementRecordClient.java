package com.meisai.mapping.client;

import com.meisai.common.error.MeisaiException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/** Reads statement records from ingest-service. */
@Slf4j
@Component
@RequiredArgsConstructor
public class StatementRecordClient {

    private final RestTemplate ingestRestTemplate;

    /**
     * @throws MeisaiException STATEMENT_NOT_FOUND when ingest-service has no such record,
     *                         STORAGE_ERROR when it cannot be reached
     */
    public StatementRecordView get(Long id) {
        try {
            StatementRecordView view = ingestRestTemplate.getForObject("/statements/{id}", StatementRecordView.class, id);
            if (view == null) {
                throw MeisaiException.statementNotFound("id", id);
            }
            return view;
        } catch (HttpClientErrorException.NotFound e) {
            throw MeisaiException.statementNotFound("id", id);
        } catch (RestClientException e) {
            log.error("Statement lookup id={} failed: {}", id, e.getMessage());
            throw MeisaiException.storage("ingest-service unavailable", e);
        }
    }
}
