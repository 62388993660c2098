package com.meisai.ingest.kafka;

import com.meisai.common.model.MappingActivatedEvent;
import com.meisai.ingest.storage.StatementStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/** Copies the external entity id of a newly active mapping onto the statement record. */
@Slf4j
@Component
@RequiredArgsConstructor
public class MappingActivatedListener {

    private final StatementStore statementStore;

    @KafkaListener(
            topics = "${meisai.topics.mapping-activated:meisai.mapping.activated}",
            containerFactory = "mappingActivatedListenerFactory"
    )
    public void onMappingActivated(MappingActivatedEvent event) {
        log.info("Mapping {} activated: statement {} -> {} {}", event.getMappingId(),
                event.getStatementRecordId(), event.getExternalEntityType(), event.getExternalEntityId());
        statementStore.setExternalReference(event.getStatementRecordId(), event.getExternalEntityId());
    }
}
