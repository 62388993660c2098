package com.meisai.ingest.service;

import com.meisai.common.error.MeisaiException;
import com.meisai.ingest.config.ImportProperties;
import com.meisai.ingest.dto.ImportSessionSummary;
import com.meisai.ingest.dto.PageResponse;
import com.meisai.ingest.entity.AccountType;
import com.meisai.ingest.entity.ImportMode;
import com.meisai.ingest.entity.ImportSession;
import com.meisai.ingest.entity.ImportStatus;
import com.meisai.ingest.pipeline.ImportOptions;
import com.meisai.ingest.pipeline.IngestionPipeline;
import com.meisai.ingest.repository.ImportSessionRepository;
import com.meisai.ingest.repository.ImportSessionSpecifications;
import com.meisai.ingest.session.ActiveImport;
import com.meisai.ingest.session.ImportSessionRegistry;
import com.meisai.ingest.stream.ChunkReassembler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.nio.charset.Charset;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Session lifecycle shared by whole-file, streamed and hash imports: opening, lookup, listing, cancel.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImportSessionService {

    static final int DEFAULT_PAGE_SIZE = 50;
    static final int MAX_PAGE_SIZE = 1000;

    private final ImportSessionRepository repository;
    private final ImportSessionRegistry registry;
    private final IngestionPipeline pipeline;
    private final ImportProperties properties;

    /**
     * Creates a pending session, registers it as active and stores it.
     *
     * @param sessionId requested id, or null for a generated one
     */
    public ActiveImport open(String sessionId, ImportMode mode, AccountType accountType, String accountId,
                             String fileName, Long fileSize, String createdBy, ImportOptions options) {
        ImportSession session = ImportSession.open(sessionId, mode, accountType, accountId, fileName, fileSize, createdBy);
        ActiveImport active = registry.register(newActive(session, options));
        try {
            save(session);
        } catch (MeisaiException e) {
            registry.remove(active);
            throw e;
        }
        log.info("Opened {} session {} for {} {} file={}", mode.wireName(), session.getSessionId(),
                accountType == null ? "-" : accountType.wireName(), accountId, fileName);
        return active;
    }

    /**
     * Like {@link #open} for a session announced only by its first chunk. When two first chunks race,
     * both callers get the same instance.
     */
    public ActiveImport openImplicit(String sessionId, AccountType accountType, String accountId, String fileName) {
        ImportSession session = ImportSession.open(sessionId, ImportMode.STREAM, accountType, accountId,
                fileName, null, null);
        ActiveImport candidate = newActive(session, ImportOptions.defaults());
        ActiveImport winner = registry.registerIfAbsent(candidate);
        if (winner == candidate) {
            try {
                save(session);
            } catch (MeisaiException e) {
                registry.remove(candidate);
                throw e;
            }
            log.info("Session {} opened implicitly by its first chunk", sessionId);
        }
        return winner;
    }

    public ImportSessionSummary get(String sessionId) {
        return ImportSessionSummary.from(load(sessionId));
    }

    public ImportSession load(String sessionId) {
        return repository.findById(sessionId).orElseThrow(() -> MeisaiException.sessionNotFound(sessionId));
    }

    public Optional<ImportSession> findStored(String sessionId) {
        return repository.findById(sessionId);
    }

    public PageResponse<ImportSessionSummary> list(String accountType, String accountId, String status,
                                                   String createdBy, Integer page, Integer pageSize) {
        int pageNumber = page == null ? 1 : page;
        int size = pageSize == null ? DEFAULT_PAGE_SIZE : pageSize;
        if (pageNumber < 1) {
            throw MeisaiException.validation("page", "page must be 1 or greater");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw MeisaiException.validation("pageSize", "pageSize must be between 1 and " + MAX_PAGE_SIZE);
        }

        Specification<ImportSession> spec = Specification
                .where(ImportSessionSpecifications.hasAccountType(
                        StringUtils.hasText(accountType) ? AccountType.fromWire(accountType) : null))
                .and(ImportSessionSpecifications.hasAccountId(StringUtils.hasText(accountId) ? accountId : null))
                .and(ImportSessionSpecifications.hasStatus(parseStatus(status)))
                .and(ImportSessionSpecifications.createdBy(StringUtils.hasText(createdBy) ? createdBy : null));

        Page<ImportSession> result = repository.findAll(spec,
                PageRequest.of(pageNumber - 1, size, Sort.by(Sort.Direction.DESC, "createdAt")));
        return PageResponse.of(result, ImportSessionSummary::from);
    }

    public ImportSessionSummary cancel(String sessionId) {
        return cancel(sessionId, "cancelled");
    }

    /**
     * The row in flight finishes, no further row starts, buffered input is released and the session fails.
     * Cancelling a terminal session changes nothing.
     */
    public ImportSessionSummary cancel(String sessionId, String reason) {
        Optional<ActiveImport> found = registry.find(sessionId);
        if (found.isPresent()) {
            ActiveImport active = found.get();
            active.cancel();
            active.getLock().lock();
            try {
                if (!active.getSession().isTerminal()) {
                    pipeline.fail(active, reason);
                }
            } finally {
                active.getLock().unlock();
            }
            return ImportSessionSummary.from(active.getSession());
        }

        ImportSession session = load(sessionId);
        if (!session.isTerminal()) {
            // left over from a previous run, nothing is consuming it any more
            session.fail(reason);
            save(session);
        }
        return ImportSessionSummary.from(session);
    }

    /** Fails sessions a previous process left pending or processing. */
    public int failOrphans() {
        int failed = 0;
        for (ImportSession session : repository.findByStatusIn(
                List.of(ImportStatus.PENDING, ImportStatus.PROCESSING))) {
            if (registry.find(session.getSessionId()).isEmpty()) {
                session.fail("interrupted by service restart");
                save(session);
                failed++;
            }
        }
        return failed;
    }

    static void requireCsvFileName(String fileName) {
        if (!StringUtils.hasText(fileName)) {
            throw MeisaiException.validation("fileName", "fileName is required");
        }
        if (!fileName.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            throw MeisaiException.validation("fileName", "only .csv files can be imported: " + fileName);
        }
    }

    private ActiveImport newActive(ImportSession session, ImportOptions options) {
        ImportProperties.Stream stream = properties.getStream();
        ChunkReassembler reassembler = new ChunkReassembler(session.getSessionId(), stream.getMaxRowBytes(),
                stream.getMismatchedSessionPolicy(), fixedCharset());
        return new ActiveImport(session, options == null ? ImportOptions.defaults() : options, reassembler,
                properties.getProgressQueueCapacity());
    }

    private Charset fixedCharset() {
        return StringUtils.hasText(properties.getCharset()) ? Charset.forName(properties.getCharset()) : null;
    }

    private static ImportStatus parseStatus(String status) {
        if (!StringUtils.hasText(status)) {
            return null;
        }
        try {
            return ImportStatus.fromWire(status);
        } catch (IllegalArgumentException e) {
            throw MeisaiException.validation("status", "unknown session status: " + status);
        }
    }

    private void save(ImportSession session) {
        try {
            repository.save(session);
        } catch (DataAccessException e) {
            throw MeisaiException.storage("could not save import session " + session.getSessionId(), e);
        }
    }
}
