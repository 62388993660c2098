package com.meisai.mapping.service;

import com.meisai.common.error.ErrorKind;
import com.meisai.common.error.MeisaiException;
import com.meisai.mapping.client.StatementRecordClient;
import com.meisai.mapping.client.StatementRecordView;
import com.meisai.mapping.dto.CreateMappingRequest;
import com.meisai.mapping.dto.MappingView;
import com.meisai.mapping.dto.PageResponse;
import com.meisai.mapping.dto.ProposeRequest;
import com.meisai.mapping.dto.ProposeResponse;
import com.meisai.mapping.dto.UpdateMappingRequest;
import com.meisai.mapping.entity.ExternalCandidate;
import com.meisai.mapping.entity.ExternalEntityType;
import com.meisai.mapping.entity.MappingRecord;
import com.meisai.mapping.entity.MappingStatus;
import com.meisai.mapping.entity.MatchType;
import com.meisai.mapping.kafka.MappingEventPublisher;
import com.meisai.mapping.matching.MatchEngine;
import com.meisai.mapping.matching.MatchFields;
import com.meisai.mapping.matching.ScoredMatch;
import com.meisai.mapping.repository.MappingRecordRepository;
import com.meisai.mapping.repository.MappingRecordSpecifications;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mapping administration and the mapping state machine.
 * A (statement record, entity type) pair has at most one active mapping; every path that
 * activates a mapping checks the slot first and the unique {@code active_slot} column backs
 * the check against concurrent confirms.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MappingService {

    private final MappingRecordRepository repository;
    private final StatementRecordClient statementClient;
    private final CandidateService candidateService;
    private final MatchEngine matchEngine;
    private final MappingEventPublisher eventPublisher;

    @Value("${meisai.mapping.verify-statements:true}")
    private boolean verifyStatements;

    /**
     * Creates a mapping. Engine match types start pending; manual mappings start active unless
     * {@code status=pending} is asked for. Nothing is stored when any check fails.
     */
    @Transactional
    public MappingView create(CreateMappingRequest request) {
        if (request.getStatementRecordId() == null) {
            throw MeisaiException.validation("statementRecordId", "statementRecordId is required");
        }
        if (!StringUtils.hasText(request.getExternalEntityId())) {
            throw MeisaiException.validation("externalEntityId", "externalEntityId is required");
        }
        ExternalEntityType entityType = WireValues.entityType(request.getExternalEntityType());
        if (entityType == null) {
            throw MeisaiException.validation("externalEntityType", "externalEntityType is required");
        }
        MatchType matchType = WireValues.matchType(request.getMatchType());
        if (matchType == null) {
            matchType = MatchType.MANUAL;
        }
        Double confidence = normalizeConfidence(request.getConfidence(), matchType);
        MappingStatus status = initialStatus(WireValues.status(request.getStatus()), matchType);
        String entityId = request.getExternalEntityId().trim();

        if (verifyStatements) {
            statementClient.get(request.getStatementRecordId());
        }
        if (repository.existsByStatementRecordIdAndExternalEntityTypeAndExternalEntityId(
                request.getStatementRecordId(), entityType, entityId)) {
            throw new MeisaiException(ErrorKind.MAPPING_CONFLICT,
                    "A mapping between these records already exists",
                    pairContext(request.getStatementRecordId(), entityType, entityId));
        }

        MappingRecord mapping = MappingRecord.builder()
                .statementRecordId(request.getStatementRecordId())
                .externalEntityId(entityId)
                .externalEntityType(entityType)
                .confidence(confidence)
                .matchType(matchType)
                .status(MappingStatus.PENDING)
                .notes(request.getNotes())
                .createdBy(request.getCreatedBy())
                .build();
        if (status == MappingStatus.ACTIVE) {
            requireFreeSlot(mapping);
        }
        mapping.moveTo(status);
        mapping = saveAndFlush(mapping);
        log.info("Created {} mapping {}: statement {} -> {} {} ({})", matchType.wireName(), mapping.getId(),
                mapping.getStatementRecordId(), entityType.wireName(), entityId, status.wireName());
        if (status == MappingStatus.ACTIVE) {
            eventPublisher.publishActivatedAfterCommit(mapping);
        }
        return MappingView.of(mapping);
    }

    @Transactional(readOnly = true)
    public MappingView get(Long id) {
        return MappingView.of(load(id));
    }

    @Transactional(readOnly = true)
    public PageResponse<MappingView> list(Long statementRecordId, String matchType, String status,
                                          String entityType, Integer page, Integer pageSize) {
        Specification<MappingRecord> spec = Specification
                .where(MappingRecordSpecifications.forStatement(statementRecordId))
                .and(MappingRecordSpecifications.hasMatchType(WireValues.matchType(matchType)))
                .and(MappingRecordSpecifications.hasStatus(WireValues.status(status)))
                .and(MappingRecordSpecifications.hasEntityType(WireValues.entityType(entityType)));
        return PageResponse.of(
                repository.findAll(spec, Pages.of(page, pageSize, Sort.by(Sort.Direction.DESC, "createdAt"))),
                MappingView::of);
    }

    /**
     * Partial update. A status change goes through the same transitions as the dedicated
     * confirm, deactivate and reject operations.
     */
    @Transactional
    public MappingView update(Long id, UpdateMappingRequest request) {
        MappingRecord mapping = load(id);
        MappingStatus target = WireValues.status(request.getStatus());

        if (request.getRejectionReason() != null && target != MappingStatus.REJECTED) {
            throw MeisaiException.validation("rejectionReason", "rejectionReason is only accepted with status rejected");
        }
        if (mapping.getStatus().isTerminal()
                && (request.getConfidence() != null || (target != null && target != mapping.getStatus()))) {
            throw MeisaiException.validation("status", "rejected mappings can only have their notes changed");
        }
        if (request.getConfidence() != null) {
            mapping.setConfidence(normalizeConfidence(request.getConfidence(), mapping.getMatchType()));
        }
        if (request.getNotes() != null) {
            mapping.setNotes(request.getNotes());
        }

        boolean activated = false;
        if (target != null && target != mapping.getStatus()) {
            switch (target) {
                case ACTIVE -> {
                    activate(mapping);
                    activated = true;
                }
                case INACTIVE -> transition(mapping, MappingStatus.INACTIVE);
                case REJECTED -> rejectInPlace(mapping, request.getRejectionReason());
                case PENDING -> throw invalidTransition(mapping, target);
            }
        }
        mapping = saveAndFlush(mapping);
        if (activated) {
            eventPublisher.publishActivatedAfterCommit(mapping);
        }
        return MappingView.of(mapping);
    }

    @Transactional
    public void delete(Long id) {
        MappingRecord mapping = load(id);
        repository.delete(mapping);
        log.info("Deleted mapping {} ({})", id, mapping.getStatus().wireName());
    }

    /**
     * pending or inactive → active.
     *
     * @throws MeisaiException MAPPING_CONFLICT when another mapping of the same record and entity
     *                         type is active; neither mapping is changed
     */
    @Transactional
    public MappingView confirm(Long id) {
        MappingRecord mapping = load(id);
        activate(mapping);
        mapping = saveAndFlush(mapping);
        log.info("Confirmed mapping {} for statement {}", id, mapping.getStatementRecordId());
        eventPublisher.publishActivatedAfterCommit(mapping);
        return MappingView.of(mapping);
    }

    /** active → inactive. */
    @Transactional
    public MappingView deactivate(Long id) {
        MappingRecord mapping = load(id);
        transition(mapping, MappingStatus.INACTIVE);
        mapping = saveAndFlush(mapping);
        log.info("Deactivated mapping {}", id);
        return MappingView.of(mapping);
    }

    /** Any non-terminal state → rejected. The reason is required. */
    @Transactional
    public MappingView reject(Long id, String reason) {
        MappingRecord mapping = load(id);
        rejectInPlace(mapping, reason);
        mapping = saveAndFlush(mapping);
        log.info("Rejected mapping {}: {}", id, mapping.getRejectionReason());
        return MappingView.of(mapping);
    }

    /**
     * Scores candidates against a stored statement record. With {@code persist} the proposals
     * become pending mappings; pairs that already have a mapping are skipped.
     */
    @Transactional
    public ProposeResponse propose(ProposeRequest request) {
        if (request.getStatementRecordId() == null) {
            throw MeisaiException.validation("statementRecordId", "statementRecordId is required");
        }
        StatementRecordView record = statementClient.get(request.getStatementRecordId());
        List<ExternalCandidate> candidates = request.getCandidates() == null || request.getCandidates().isEmpty()
                ? candidateService.around(record.getDate())
                : request.getCandidates().stream().map(CandidateService::toCandidate).toList();

        List<ScoredMatch> matches = matchEngine.propose(MatchFields.of(record), candidates);
        List<MappingView> created = request.isPersist()
                ? createProposed(request.getStatementRecordId(), matches, request.getCreatedBy())
                : List.of();
        return ProposeResponse.builder()
                .statementRecordId(request.getStatementRecordId())
                .matches(matches)
                .created(created)
                .build();
    }

    /** Stores engine proposals as pending mappings, skipping pairs that already have one. */
    @Transactional
    public List<MappingView> createProposed(Long statementRecordId, List<ScoredMatch> matches, String createdBy) {
        List<MappingView> created = new ArrayList<>();
        for (ScoredMatch match : matches) {
            if (repository.existsByStatementRecordIdAndExternalEntityTypeAndExternalEntityId(
                    statementRecordId, match.getEntityType(), match.getCandidateId())) {
                log.debug("Statement {} already mapped to {} {}", statementRecordId,
                        match.getEntityType().wireName(), match.getCandidateId());
                continue;
            }
            MappingRecord mapping = MappingRecord.builder()
                    .statementRecordId(statementRecordId)
                    .externalEntityId(match.getCandidateId())
                    .externalEntityType(match.getEntityType())
                    .confidence(match.getConfidence())
                    .matchType(match.getMatchType())
                    .status(MappingStatus.PENDING)
                    .createdBy(createdBy)
                    .build();
            created.add(MappingView.of(saveAndFlush(mapping)));
        }
        if (!created.isEmpty()) {
            log.info("Proposed {} mapping(s) for statement {}", created.size(), statementRecordId);
        }
        return created;
    }

    /**
     * Brings a confidence into [0,1]. Values in (1,100] are read as percentages.
     * Manual mappings without a confidence get 1.0; every other match type needs one.
     */
    static Double normalizeConfidence(Double confidence, MatchType matchType) {
        if (confidence == null) {
            if (matchType == MatchType.MANUAL) {
                return 1.0;
            }
            throw MeisaiException.validation("confidence", "confidence is required for " + matchType.wireName() + " mappings");
        }
        if (confidence.isNaN() || confidence < 0 || confidence > 100) {
            throw MeisaiException.validation("confidence", "confidence must be within [0,1] or [0,100]: " + confidence);
        }
        return confidence > 1 ? confidence / 100.0 : confidence;
    }

    private static MappingStatus initialStatus(MappingStatus requested, MatchType matchType) {
        if (matchType != MatchType.MANUAL) {
            if (requested != null && requested != MappingStatus.PENDING) {
                throw MeisaiException.validation("status", matchType.wireName() + " mappings start pending; confirm them afterwards");
            }
            return MappingStatus.PENDING;
        }
        if (requested == null) {
            return MappingStatus.ACTIVE;
        }
        if (requested != MappingStatus.PENDING && requested != MappingStatus.ACTIVE) {
            throw MeisaiException.validation("status", "a new mapping is pending or active, not " + requested.wireName());
        }
        return requested;
    }

    private MappingRecord load(Long id) {
        return repository.findById(id).orElseThrow(() -> MeisaiException.mappingNotFound(id));
    }

    private void activate(MappingRecord mapping) {
        if (!mapping.getStatus().canTransitionTo(MappingStatus.ACTIVE)) {
            throw invalidTransition(mapping, MappingStatus.ACTIVE);
        }
        requireFreeSlot(mapping);
        mapping.moveTo(MappingStatus.ACTIVE);
    }

    private void transition(MappingRecord mapping, MappingStatus target) {
        if (!mapping.getStatus().canTransitionTo(target)) {
            throw invalidTransition(mapping, target);
        }
        mapping.moveTo(target);
    }

    private void rejectInPlace(MappingRecord mapping, String reason) {
        if (!StringUtils.hasText(reason)) {
            throw MeisaiException.validation("rejectionReason", "a rejection reason is required");
        }
        transition(mapping, MappingStatus.REJECTED);
        mapping.setRejectionReason(reason.trim());
    }

    private void requireFreeSlot(MappingRecord mapping) {
        repository.findByActiveSlot(mapping.slot())
                .filter(active -> !active.getId().equals(mapping.getId()))
                .ifPresent(active -> {
                    Map<String, Object> context = pairContext(mapping.getStatementRecordId(),
                            mapping.getExternalEntityType(), mapping.getExternalEntityId());
                    context.put("activeMappingId", active.getId());
                    throw new MeisaiException(ErrorKind.MAPPING_CONFLICT,
                            "Statement record " + mapping.getStatementRecordId() + " already has an active "
                                    + mapping.getExternalEntityType().wireName() + " mapping", context);
                });
    }

    private MappingRecord saveAndFlush(MappingRecord mapping) {
        try {
            return repository.saveAndFlush(mapping);
        } catch (DataIntegrityViolationException | ObjectOptimisticLockingFailureException e) {
            throw new MeisaiException(ErrorKind.MAPPING_CONFLICT, "Mapping was changed concurrently",
                    pairContext(mapping.getStatementRecordId(), mapping.getExternalEntityType(),
                            mapping.getExternalEntityId()), e);
        }
    }

    private static MeisaiException invalidTransition(MappingRecord mapping, MappingStatus target) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("mappingId", mapping.getId());
        context.put("from", mapping.getStatus().wireName());
        context.put("to", target.wireName());
        return new MeisaiException(ErrorKind.VALIDATION_ERROR,
                "Cannot move mapping from " + mapping.getStatus().wireName() + " to " + target.wireName(), context);
    }

    private static Map<String, Object> pairContext(Long statementRecordId, ExternalEntityType type, String entityId) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("statementRecordId", statementRecordId);
        context.put("externalEntityType", type.wireName());
        context.put("externalEntityId", entityId);
        return context;
    }
}
