package com.meisai.ingest.service;

import com.meisai.common.error.MeisaiException;
import com.meisai.ingest.config.ImportProperties;
import com.meisai.ingest.entity.ImportMode;
import com.meisai.ingest.session.ActiveImport;
import com.meisai.ingest.session.ImportSessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Deadline for streamed uploads: a session that has not seen a chunk within the idle timeout is cancelled.
 * Also fails sessions a previous process left open.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaleSessionReaper {

    private final ImportSessionRegistry registry;
    private final ImportSessionService sessionService;
    private final ImportProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void failOrphans() {
        int failed = sessionService.failOrphans();
        if (failed > 0) {
            log.warn("Marked {} sessions from a previous run as failed", failed);
        }
    }

    @Scheduled(fixedDelayString = "${meisai.import.stream.reaper-interval-ms:60000}")
    public void reapIdleStreams() {
        reapIdleStreams(Instant.now());
    }

    int reapIdleStreams(Instant now) {
        Duration idleTimeout = properties.getStream().getIdleTimeout();
        Instant cutoff = now.minus(idleTimeout);
        int reaped = 0;
        for (ActiveImport active : registry.all()) {
            if (active.getSession().getMode() != ImportMode.STREAM || !active.getLastActivity().isBefore(cutoff)) {
                continue;
            }
            log.warn("Session {} idle since {}, cancelling", active.getSessionId(), active.getLastActivity());
            try {
                sessionService.cancel(active.getSessionId(), "no chunk received for " + idleTimeout);
                reaped++;
            } catch (MeisaiException e) {
                log.error("Could not cancel idle session {}: {}", active.getSessionId(), e.getMessage());
            }
        }
        return reaped;
    }
}
