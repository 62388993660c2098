package com.meisai.mapping.service;

import com.meisai.common.error.MeisaiException;
import com.meisai.mapping.config.MatchingProperties;
import com.meisai.mapping.dto.CandidateRequest;
import com.meisai.mapping.dto.CandidateView;
import com.meisai.mapping.dto.PageResponse;
import com.meisai.mapping.entity.ExternalCandidate;
import com.meisai.mapping.entity.ExternalEntityType;
import com.meisai.mapping.repository.ExternalCandidateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.util.List;

/** Registry of external accounting records the engine matches against. */
@Slf4j
@Service
@RequiredArgsConstructor
public class CandidateService {

    private final ExternalCandidateRepository repository;
    private final MatchingProperties properties;

    /** Registers a candidate, replacing the fields of an already registered (type, id). */
    @Transactional
    public CandidateView register(CandidateRequest request) {
        ExternalCandidate incoming = toCandidate(request);
        ExternalCandidate stored = repository
                .findByEntityTypeAndEntityId(incoming.getEntityType(), incoming.getEntityId())
                .map(existing -> {
                    existing.setDate(incoming.getDate());
                    existing.setTime(incoming.getTime());
                    existing.setEntryPoint(incoming.getEntryPoint());
                    existing.setExitPoint(incoming.getExitPoint());
                    existing.setAmount(incoming.getAmount());
                    existing.setVehicleNumber(incoming.getVehicleNumber());
                    return existing;
                })
                .orElse(incoming);
        boolean created = stored.getId() == null;
        stored = repository.save(stored);
        log.debug("{} candidate {} {}", created ? "Registered" : "Updated",
                stored.getEntityType().wireName(), stored.getEntityId());
        return CandidateView.of(stored);
    }

    public PageResponse<CandidateView> list(String entityType, Integer page, Integer pageSize) {
        ExternalEntityType type = WireValues.entityType(entityType);
        PageRequest pageable = Pages.of(page, pageSize, Sort.by(Sort.Direction.DESC, "date"));
        Page<ExternalCandidate> result = type == null
                ? repository.findAll(pageable)
                : repository.findByEntityType(type, pageable);
        return PageResponse.of(result, CandidateView::of);
    }

    /** Candidates dated within the configured window around {@code date}. */
    public List<ExternalCandidate> around(LocalDate date) {
        if (date == null) {
            return List.of();
        }
        int window = Math.max(properties.getCandidateDateWindowDays(), 0);
        return repository.findByDateBetween(date.minusDays(window), date.plusDays(window));
    }

    /** Builds an unsaved candidate, also used for the ad-hoc candidates of a propose call. */
    public static ExternalCandidate toCandidate(CandidateRequest request) {
        if (request == null || !StringUtils.hasText(request.getEntityId())) {
            throw MeisaiException.validation("entityId", "entityId is required");
        }
        ExternalEntityType type = WireValues.entityType(request.getEntityType());
        if (type == null) {
            throw MeisaiException.validation("entityType", "entityType is required");
        }
        if (request.getDate() == null) {
            throw MeisaiException.validation("date", "date is required");
        }
        return ExternalCandidate.builder()
                .entityId(request.getEntityId().trim())
                .entityType(type)
                .date(request.getDate())
                .time(request.getTime())
                .entryPoint(request.getEntryPoint())
                .exitPoint(request.getExitPoint())
                .amount(request.getAmount())
                .vehicleNumber(request.getVehicleNumber())
                .build();
    }
}
