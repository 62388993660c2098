package com.meisai.ingest.kafka;

import com.meisai.common.model.ImportChunk;
import com.meisai.common.model.ImportProgress;
import com.meisai.ingest.service.StreamingImportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Streamed uploads over Kafka. The record key is the session id; a payload naming another
 * session is handed to the keyed session and treated per the mismatched-session policy.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImportChunkListener {

    private final StreamingImportService streamingImportService;

    @KafkaListener(
            topics = "${meisai.topics.chunk:meisai.import.chunk}",
            containerFactory = "chunkListenerFactory"
    )
    public void consume(ConsumerRecord<String, ImportChunk> record) {
        ImportChunk chunk = record.value();
        String sessionId = record.key() != null ? record.key() : chunk.getSessionId();
        log.debug("Received chunk {} for session {} (last={})", chunk.getChunkNumber(), sessionId, chunk.isLast());

        List<ImportProgress> produced = streamingImportService.acceptChunk(sessionId, chunk);
        if (!produced.isEmpty()) {
            ImportProgress latest = produced.get(produced.size() - 1);
            log.debug("Session {} at {} rows ({}%)", sessionId, latest.getProcessedRows(), latest.getProgressPercentage());
        }
    }
}
