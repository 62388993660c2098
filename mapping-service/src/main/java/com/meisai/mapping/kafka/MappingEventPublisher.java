package com.meisai.mapping.kafka;

import com.meisai.common.model.MappingActivatedEvent;
import com.meisai.mapping.entity.MappingRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Instant;

@Slf4j
@Component
@RequiredArgsConstructor
public class MappingEventPublisher {

    private final KafkaTemplate<String, MappingActivatedEvent> mappingEventKafkaTemplate;

    @Value("${meisai.topics.mapping-activated:meisai.mapping.activated}")
    private String topic;

    @Value("${meisai.kafka.mapping-events.enabled:true}")
    private boolean enabled;

    /** Sends after the activating transaction commits; a rolled back confirm publishes nothing. */
    public void publishActivatedAfterCommit(MappingRecord mapping) {
        if (!enabled) {
            return;
        }
        MappingActivatedEvent event = MappingActivatedEvent.builder()
                .mappingId(mapping.getId())
                .statementRecordId(mapping.getStatementRecordId())
                .externalEntityId(mapping.getExternalEntityId())
                .externalEntityType(mapping.getExternalEntityType().wireName())
                .timestamp(Instant.now())
                .build();
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    send(event);
                }
            });
        } else {
            send(event);
        }
    }

    private void send(MappingActivatedEvent event) {
        mappingEventKafkaTemplate.send(topic, String.valueOf(event.getStatementRecordId()), event)
                .whenComplete((result, ex) -> {
                    if (ex == null) {
                        log.debug("Published mapping-activated mappingId={}", event.getMappingId());
                    } else {
                        log.error("Failed to publish mapping-activated mappingId={} due to {}",
                                event.getMappingId(), ex.getMessage());
                    }
                });
    }
}
