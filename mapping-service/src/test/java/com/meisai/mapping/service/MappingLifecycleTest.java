package com.meisai.mapping.service;

import com.meisai.common.error.ErrorKind;
import com.meisai.common.error.MeisaiException;
import com.meisai.common.model.StatementRecordEvent;
import com.meisai.mapping.client.StatementRecordClient;
import com.meisai.mapping.config.MatchingProperties;
import com.meisai.mapping.dto.CandidateRequest;
import com.meisai.mapping.dto.CreateMappingRequest;
import com.meisai.mapping.dto.MappingView;
import com.meisai.mapping.dto.PageResponse;
import com.meisai.mapping.entity.MappingRecord;
import com.meisai.mapping.entity.MappingStatus;
import com.meisai.mapping.kafka.MappingEventPublisher;
import com.meisai.mapping.matching.MatchEngine;
import com.meisai.mapping.repository.MappingRecordRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/** Mapping state machine against a real database, including the single-active-mapping rule. */
@DataJpaTest
@Import({MappingService.class, CandidateService.class, AutoProposalService.class, MatchEngine.class})
@EnableConfigurationProperties(MatchingProperties.class)
@DisplayName("Mapping Lifecycle Integration Tests")
class MappingLifecycleTest {

    private static final LocalDate DATE = LocalDate.of(2024, 1, 15);

    @Autowired
    private MappingService mappingService;

    @Autowired
    private CandidateService candidateService;

    @Autowired
    private AutoProposalService autoProposalService;

    @Autowired
    private MappingRecordRepository repository;

    @Autowired
    private TestEntityManager entityManager;

    @MockBean
    private StatementRecordClient statementClient;

    @MockBean
    private MappingEventPublisher eventPublisher;

    private MappingView pending(long statementId, String type, String entityId) {
        return mappingService.create(CreateMappingRequest.builder()
                .statementRecordId(statementId)
                .externalEntityType(type)
                .externalEntityId(entityId)
                .matchType("fuzzy")
                .confidence(0.8)
                .build());
    }

    private MappingRecord reload(Long id) {
        entityManager.flush();
        entityManager.clear();
        return repository.findById(id).orElseThrow();
    }

    @Test
    @DisplayName("Confirming a second mapping for the same record and type fails and changes neither")
    void exclusivity() {
        // Given
        MappingView first = pending(1L, "expense_record", "EXP-1");
        MappingView second = pending(1L, "expense_record", "EXP-2");
        mappingService.confirm(first.getId());

        // When / Then
        assertThatThrownBy(() -> mappingService.confirm(second.getId()))
                .isInstanceOfSatisfying(MeisaiException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.MAPPING_CONFLICT);
                    assertThat(e.getContext()).containsEntry("activeMappingId", first.getId());
                });
        assertThat(reload(first.getId()).getStatus()).isEqualTo(MappingStatus.ACTIVE);
        MappingRecord untouched = reload(second.getId());
        assertThat(untouched.getStatus()).isEqualTo(MappingStatus.PENDING);
        assertThat(untouched.getActiveSlot()).isNull();
        verify(eventPublisher, times(1)).publishActivatedAfterCommit(any());
    }

    @Test
    @DisplayName("Different entity types of one record can be active at the same time")
    void oneActivePerEntityType() {
        MappingView expense = pending(1L, "expense_record", "EXP-1");
        MappingView invoice = pending(1L, "invoice_record", "INV-1");
        MappingView otherRecord = pending(2L, "expense_record", "EXP-1");

        mappingService.confirm(expense.getId());
        mappingService.confirm(invoice.getId());
        mappingService.confirm(otherRecord.getId());

        assertThat(repository.findByStatementRecordId(1L))
                .extracting(MappingRecord::getStatus)
                .containsOnly(MappingStatus.ACTIVE);
    }

    @Test
    @DisplayName("Deactivating frees the slot for another mapping; the first then cannot come back")
    void deactivateThenSwitch() {
        // Given
        MappingView first = pending(1L, "dtako_record", "DT-1");
        MappingView second = pending(1L, "dtako_record", "DT-2");
        mappingService.confirm(first.getId());

        // When
        mappingService.deactivate(first.getId());
        MappingView switched = mappingService.confirm(second.getId());

        // Then
        assertThat(switched.getStatus()).isEqualTo("active");
        assertThat(reload(first.getId()).getStatus()).isEqualTo(MappingStatus.INACTIVE);
        assertThatThrownBy(() -> mappingService.confirm(first.getId()))
                .extracting("kind").isEqualTo(ErrorKind.MAPPING_CONFLICT);
    }

    @Test
    @DisplayName("Rejecting the active mapping frees its slot, the rejected one stays rejected")
    void rejectFreesSlot() {
        MappingView first = pending(1L, "expense_record", "EXP-1");
        MappingView second = pending(1L, "expense_record", "EXP-2");
        mappingService.confirm(first.getId());

        MappingView rejected = mappingService.reject(first.getId(), "wrong vehicle");
        mappingService.confirm(second.getId());

        assertThat(rejected.getRejectionReason()).isEqualTo("wrong vehicle");
        assertThatThrownBy(() -> mappingService.confirm(first.getId()))
                .extracting("kind").isEqualTo(ErrorKind.VALIDATION_ERROR);
        assertThat(reload(first.getId()).getStatus()).isEqualTo(MappingStatus.REJECTED);
    }

    @Test
    @DisplayName("A manual active mapping is refused while the slot is taken and nothing is stored")
    void manualActiveConflict() {
        MappingView first = pending(1L, "expense_record", "EXP-1");
        mappingService.confirm(first.getId());
        long before = repository.count();

        assertThatThrownBy(() -> mappingService.create(CreateMappingRequest.builder()
                .statementRecordId(1L).externalEntityType("expense_record").externalEntityId("EXP-3").build()))
                .extracting("kind").isEqualTo(ErrorKind.MAPPING_CONFLICT);
        assertThat(repository.count()).isEqualTo(before);
    }

    @Test
    @DisplayName("Listing filters by record, status and entity type and pages from 1")
    void listFilters() {
        MappingView a = pending(1L, "expense_record", "EXP-1");
        pending(1L, "expense_record", "EXP-2");
        pending(1L, "invoice_record", "INV-1");
        pending(2L, "expense_record", "EXP-1");
        mappingService.confirm(a.getId());

        PageResponse<MappingView> active = mappingService.list(1L, null, "active", null, null, null);
        PageResponse<MappingView> expenses = mappingService.list(1L, "fuzzy", null, "expense_record", 1, 1);

        assertThat(active.getItems()).extracting(MappingView::getId).containsExactly(a.getId());
        assertThat(expenses.getTotalItems()).isEqualTo(2);
        assertThat(expenses.getItems()).hasSize(1);
        assertThat(expenses.getTotalPages()).isEqualTo(2);
        assertThat(expenses.getPage()).isEqualTo(1);
        assertThatThrownBy(() -> mappingService.list(null, null, null, null, 0, null))
                .extracting("kind").isEqualTo(ErrorKind.VALIDATION_ERROR);
        assertThatThrownBy(() -> mappingService.list(null, null, null, null, 1, 1001))
                .extracting("kind").isEqualTo(ErrorKind.VALIDATION_ERROR);
    }

    @Test
    @DisplayName("A deleted mapping is gone")
    void delete() {
        MappingView view = pending(1L, "expense_record", "EXP-1");

        mappingService.delete(view.getId());

        assertThatThrownBy(() -> mappingService.get(view.getId()))
                .extracting("kind").isEqualTo(ErrorKind.MAPPING_NOT_FOUND);
    }

    @Test
    @DisplayName("Automatic proposal stores pending mappings once per pair")
    void autoProposal() {
        // Given
        candidateService.register(CandidateRequest.builder()
                .entityId("EXP-9").entityType("expense_record").date(DATE).time(LocalTime.of(8, 30))
                .entryPoint("Tokyo-Kita").exitPoint("Yokohama").amount(1250).build());
        candidateService.register(CandidateRequest.builder()
                .entityId("EXP-10").entityType("expense_record").date(DATE.plusDays(5)).time(LocalTime.of(8, 30))
                .entryPoint("Tokyo-Kita").exitPoint("Yokohama").amount(1200).build());
        StatementRecordEvent event = StatementRecordEvent.builder()
                .recordId(42L).date(DATE).time(LocalTime.of(8, 30))
                .entryPoint("Tokyo-Kita").exitPoint("Yokohama").tollAmount(1200).build();

        // When
        List<MappingView> first = autoProposalService.proposeFor(event);
        List<MappingView> again = autoProposalService.proposeFor(event);

        // Then
        assertThat(first).singleElement().satisfies(v -> {
            assertThat(v.getExternalEntityId()).isEqualTo("EXP-9");
            assertThat(v.getMatchType()).isEqualTo("amount");
            assertThat(v.getStatus()).isEqualTo("pending");
            assertThat(v.getCreatedBy()).isEqualTo("auto-proposal");
        });
        assertThat(again).isEmpty();
        assertThat(repository.findByStatementRecordId(42L)).hasSize(1);
    }
}
