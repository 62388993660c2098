package com.meisai.ingest.kafka;

import com.meisai.common.model.StatementRecordEvent;
import com.meisai.ingest.entity.StatementRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

@Slf4j
@Component
@RequiredArgsConstructor
public class StatementEventPublisher {

    private final KafkaTemplate<String, StatementRecordEvent> statementEventKafkaTemplate;

    @Value("${meisai.topics.statement-created:meisai.statement.created}")
    private String topic;

    @Value("${meisai.kafka.statement-events.enabled:true}")
    private boolean enabled;

    /**
     * Publishes once the surrounding transaction has committed, so consumers never see a record
     * that was rolled back. Without a transaction the event goes out immediately.
     */
    public void publishAfterCommit(StatementRecord record) {
        if (!enabled) {
            return;
        }
        StatementRecordEvent event = toEvent(record);
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

    private void send(StatementRecordEvent event) {
        statementEventKafkaTemplate.send(topic, String.valueOf(event.getRecordId()), event)
                .whenComplete((result, ex) -> {
                    if (ex == null) {
                        log.debug("Published statement-created recordId={} hash={}", event.getRecordId(), event.getContentHash());
                    } else {
                        log.error("Failed to publish statement-created recordId={} due to {}", event.getRecordId(), ex.getMessage());
                    }
                });
    }

    static StatementRecordEvent toEvent(StatementRecord record) {
        return StatementRecordEvent.builder()
                .recordId(record.getId())
                .contentHash(record.getContentHash())
                .date(record.getDate())
                .time(record.getTime())
                .entryPoint(record.getEntryPoint())
                .exitPoint(record.getExitPoint())
                .tollAmount(record.getTollAmount())
                .vehicleNumber(record.getVehicleNumber())
                .cardNumber(record.getCardNumber())
                .accountType(record.getAccountType())
                .accountId(record.getAccountId())
                .importSessionId(record.getImportSessionId())
                .build();
    }
}
