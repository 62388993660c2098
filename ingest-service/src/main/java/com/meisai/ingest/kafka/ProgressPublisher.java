package com.meisai.ingest.kafka;

import com.meisai.common.model.ImportProgress;
import com.meisai.ingest.session.ProgressListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/** Forwards every progress snapshot to Kafka, keyed by session so a session's snapshots stay ordered. */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProgressPublisher implements ProgressListener {

    private final KafkaTemplate<String, ImportProgress> progressKafkaTemplate;

    @Value("${meisai.topics.progress:meisai.import.progress}")
    private String topic;

    @Value("${meisai.kafka.progress.enabled:true}")
    private boolean enabled;

    @Override
    public void onProgress(ImportProgress progress) {
        if (!enabled) {
            return;
        }
        progressKafkaTemplate.send(topic, progress.getSessionId(), progress)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.warn("Failed to publish progress of session {}: {}", progress.getSessionId(), ex.getMessage());
                    } else if (progress.isTerminal()) {
                        log.info("Published final progress of session {} status={}",
                                progress.getSessionId(), progress.getStatus());
                    }
                });
    }
}
