package com.meisai.ingest.session;

import com.meisai.common.error.MeisaiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** In-memory table of sessions that are still accepting input. Terminal sessions are removed. */
@Slf4j
@Component
public class ImportSessionRegistry {

    private final Map<String, ActiveImport> active = new ConcurrentHashMap<>();

    public ActiveImport register(ActiveImport activeImport) {
        ActiveImport existing = active.putIfAbsent(activeImport.getSessionId(), activeImport);
        if (existing != null) {
            throw MeisaiException.stream(activeImport.getSessionId(), "session is already active");
        }
        log.debug("Registered active session {}", activeImport.getSessionId());
        return activeImport;
    }

    /** Returns the registered instance, registering the candidate when none exists yet. */
    public ActiveImport registerIfAbsent(ActiveImport candidate) {
        ActiveImport existing = active.putIfAbsent(candidate.getSessionId(), candidate);
        return existing != null ? existing : candidate;
    }

    public Optional<ActiveImport> find(String sessionId) {
        return Optional.ofNullable(active.get(sessionId));
    }

    public void remove(ActiveImport activeImport) {
        active.remove(activeImport.getSessionId(), activeImport);
    }

    public Collection<ActiveImport> all() {
        return List.copyOf(active.values());
    }

    public int size() {
        return active.size();
    }
}
