package com.meisai.mapping.service;

import com.meisai.common.error.ErrorKind;
import com.meisai.common.error.MeisaiException;
import com.meisai.mapping.client.StatementRecordClient;
import com.meisai.mapping.client.StatementRecordView;
import com.meisai.mapping.config.MatchingProperties;
import com.meisai.mapping.dto.CandidateRequest;
import com.meisai.mapping.dto.CreateMappingRequest;
import com.meisai.mapping.dto.MappingView;
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
import com.meisai.mapping.repository.MappingRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("MappingService Unit Tests")
class MappingServiceTest {

    private static final LocalDate DATE = LocalDate.of(2024, 1, 15);

    @Mock
    private MappingRecordRepository repository;

    @Mock
    private StatementRecordClient statementClient;

    @Mock
    private CandidateService candidateService;

    @Mock
    private MappingEventPublisher eventPublisher;

    @Captor
    private ArgumentCaptor<MappingRecord> mappingCaptor;

    private MappingService service;
    private final AtomicLong ids = new AtomicLong(100);

    @BeforeEach
    void setUp() {
        service = new MappingService(repository, statementClient, candidateService,
                new MatchEngine(new MatchingProperties()), eventPublisher);
        lenient().when(repository.saveAndFlush(any(MappingRecord.class))).thenAnswer(inv -> {
            MappingRecord m = inv.getArgument(0);
            if (m.getId() == null) {
                m.setId(ids.incrementAndGet());
            }
            return m;
        });
    }

    private static CreateMappingRequest.CreateMappingRequestBuilder request() {
        return CreateMappingRequest.builder()
                .statementRecordId(7L)
                .externalEntityId("EXP-1")
                .externalEntityType("expense_record")
                .createdBy("alice");
    }

    private static MappingRecord stored(long id, MappingStatus status) {
        MappingRecord m = MappingRecord.builder()
                .id(id)
                .statementRecordId(7L)
                .externalEntityId("EXP-" + id)
                .externalEntityType(ExternalEntityType.EXPENSE_RECORD)
                .confidence(0.9)
                .matchType(MatchType.TIME)
                .status(MappingStatus.PENDING)
                .build();
        m.moveTo(status);
        if (status == MappingStatus.REJECTED) {
            m.setRejectionReason("wrong trip");
        }
        return m;
    }

    private static StatementRecordView statement() {
        return StatementRecordView.builder()
                .id(7L)
                .date(DATE)
                .time(LocalTime.of(8, 30))
                .entryPoint("Tokyo-Kita")
                .exitPoint("Yokohama")
                .tollAmount(1200)
                .build();
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("A manual mapping without confidence is active with confidence 1.0 and announced")
        void manualDefaults() {
            // Given
            when(repository.findByActiveSlot("7:EXPENSE_RECORD")).thenReturn(Optional.empty());

            // When
            MappingView view = service.create(request().build());

            // Then
            assertThat(view.getStatus()).isEqualTo("active");
            assertThat(view.getMatchType()).isEqualTo("manual");
            assertThat(view.getConfidence()).isEqualTo(1.0);
            verify(repository).saveAndFlush(mappingCaptor.capture());
            assertThat(mappingCaptor.getValue().getActiveSlot()).isEqualTo("7:EXPENSE_RECORD");
            verify(eventPublisher).publishActivatedAfterCommit(mappingCaptor.getValue());
        }

        @Test
        @DisplayName("A manual mapping may be created pending and is then not announced")
        void manualPending() {
            MappingView view = service.create(request().status("pending").build());

            assertThat(view.getStatus()).isEqualTo("pending");
            verify(repository, never()).findByActiveSlot(anyString());
            verifyNoInteractions(eventPublisher);
        }

        @Test
        @DisplayName("Engine match types require a confidence")
        void engineTypeNeedsConfidence() {
            assertThatThrownBy(() -> service.create(request().matchType("fuzzy").build()))
                    .isInstanceOf(MeisaiException.class)
                    .extracting("kind").isEqualTo(ErrorKind.VALIDATION_ERROR);
            verify(repository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("Engine match types always start pending")
        void engineTypeCannotStartActive() {
            assertThatThrownBy(() -> service.create(request().matchType("amount").confidence(0.8).status("active").build()))
                    .isInstanceOf(MeisaiException.class)
                    .extracting("kind").isEqualTo(ErrorKind.VALIDATION_ERROR);
        }

        @ParameterizedTest(name = "confidence {0} -> {1}")
        @CsvSource({
                "0.0,  0.0",
                "0.42, 0.42",
                "1.0,  1.0",
                "85,   0.85",
                "100,  1.0"
        })
        void confidenceIsNormalized(double given, double expected) {
            MappingView view = service.create(request().matchType("time").confidence(given).build());

            assertThat(view.getConfidence()).isEqualTo(expected);
            assertThat(view.getStatus()).isEqualTo("pending");
        }

        @ParameterizedTest
        @CsvSource({"-0.1", "100.5", "NaN"})
        void confidenceOutOfRange(double given) {
            assertThatThrownBy(() -> service.create(request().matchType("exact").confidence(given).build()))
                    .isInstanceOf(MeisaiException.class)
                    .extracting("kind").isEqualTo(ErrorKind.VALIDATION_ERROR);
            verify(repository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("Missing fields and unknown enum names are validation errors")
        void missingFields() {
            assertThatThrownBy(() -> service.create(request().statementRecordId(null).build()))
                    .extracting("kind").isEqualTo(ErrorKind.VALIDATION_ERROR);
            assertThatThrownBy(() -> service.create(request().externalEntityId(" ").build()))
                    .extracting("kind").isEqualTo(ErrorKind.VALIDATION_ERROR);
            assertThatThrownBy(() -> service.create(request().externalEntityType(null).build()))
                    .extracting("kind").isEqualTo(ErrorKind.VALIDATION_ERROR);
            assertThatThrownBy(() -> service.create(request().externalEntityType("ledger").build()))
                    .extracting("kind").isEqualTo(ErrorKind.VALIDATION_ERROR);
            assertThatThrownBy(() -> service.create(request().matchType("guess").build()))
                    .extracting("kind").isEqualTo(ErrorKind.VALIDATION_ERROR);
            verifyNoInteractions(statementClient);
        }

        @Test
        @DisplayName("An unknown statement record is reported when verification is on")
        void unknownStatement() {
            // Given
            ReflectionTestUtils.setField(service, "verifyStatements", true);
            when(statementClient.get(7L)).thenThrow(MeisaiException.statementNotFound("id", 7L));

            // When / Then
            assertThatThrownBy(() -> service.create(request().build()))
                    .isInstanceOf(MeisaiException.class)
                    .extracting("kind").isEqualTo(ErrorKind.STATEMENT_NOT_FOUND);
            verify(repository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("A second mapping for the same pair is a conflict")
        void duplicatePair() {
            when(repository.existsByStatementRecordIdAndExternalEntityTypeAndExternalEntityId(
                    7L, ExternalEntityType.EXPENSE_RECORD, "EXP-1")).thenReturn(true);

            assertThatThrownBy(() -> service.create(request().build()))
                    .isInstanceOf(MeisaiException.class)
                    .extracting("kind").isEqualTo(ErrorKind.MAPPING_CONFLICT);
            verify(repository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("An active manual mapping is refused when the slot is taken")
        void activeSlotTaken() {
            // Given
            when(repository.findByActiveSlot("7:EXPENSE_RECORD")).thenReturn(Optional.of(stored(1L, MappingStatus.ACTIVE)));

            // When / Then
            assertThatThrownBy(() -> service.create(request().build()))
                    .isInstanceOfSatisfying(MeisaiException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(ErrorKind.MAPPING_CONFLICT);
                        assertThat(e.getContext()).containsEntry("activeMappingId", 1L);
                    });
            verify(repository, never()).saveAndFlush(any());
            verifyNoInteractions(eventPublisher);
        }

        @Test
        @DisplayName("A unique constraint violation on flush surfaces as a conflict")
        void constraintViolation() {
            when(repository.findByActiveSlot(anyString())).thenReturn(Optional.empty());
            doThrow(new DataIntegrityViolationException("uk_mapping_active_slot"))
                    .when(repository).saveAndFlush(any(MappingRecord.class));

            assertThatThrownBy(() -> service.create(request().build()))
                    .isInstanceOf(MeisaiException.class)
                    .extracting("kind").isEqualTo(ErrorKind.MAPPING_CONFLICT);
            verifyNoInteractions(eventPublisher);
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Unknown ids are MAPPING_NOT_FOUND")
        void notFound() {
            when(repository.findById(9L)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.confirm(9L))
                    .isInstanceOf(MeisaiException.class)
                    .extracting("kind").isEqualTo(ErrorKind.MAPPING_NOT_FOUND);
        }

        @Test
        @DisplayName("Confirming a pending mapping activates it and publishes the activation")
        void confirmPending() {
            // Given
            MappingRecord pending = stored(1L, MappingStatus.PENDING);
            when(repository.findById(1L)).thenReturn(Optional.of(pending));
            when(repository.findByActiveSlot("7:EXPENSE_RECORD")).thenReturn(Optional.empty());

            // When
            MappingView view = service.confirm(1L);

            // Then
            assertThat(view.getStatus()).isEqualTo("active");
            verify(eventPublisher).publishActivatedAfterCommit(pending);
        }

        @Test
        @DisplayName("Confirming while another mapping is active fails and leaves the mapping pending")
        void confirmConflict() {
            // Given
            MappingRecord pending = stored(2L, MappingStatus.PENDING);
            MappingRecord active = stored(1L, MappingStatus.ACTIVE);
            when(repository.findById(2L)).thenReturn(Optional.of(pending));
            when(repository.findByActiveSlot("7:EXPENSE_RECORD")).thenReturn(Optional.of(active));

            // When / Then
            assertThatThrownBy(() -> service.confirm(2L))
                    .isInstanceOf(MeisaiException.class)
                    .extracting("kind").isEqualTo(ErrorKind.MAPPING_CONFLICT);
            assertThat(pending.getStatus()).isEqualTo(MappingStatus.PENDING);
            assertThat(pending.getActiveSlot()).isNull();
            assertThat(active.getStatus()).isEqualTo(MappingStatus.ACTIVE);
            verify(repository, never()).saveAndFlush(any());
            verifyNoInteractions(eventPublisher);
        }

        @Test
        @DisplayName("Confirming an already active mapping is an invalid transition")
        void confirmActiveIsInvalidTransition() {
            MappingRecord active = stored(1L, MappingStatus.ACTIVE);
            when(repository.findById(1L)).thenReturn(Optional.of(active));

            assertThatThrownBy(() -> service.confirm(1L))
                    .isInstanceOfSatisfying(MeisaiException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
                        assertThat(e.getContext()).containsEntry("from", "active").containsEntry("to", "active");
                    });
        }

        @Test
        @DisplayName("Deactivating a pending mapping is not a valid transition")
        void deactivatePending() {
            when(repository.findById(1L)).thenReturn(Optional.of(stored(1L, MappingStatus.PENDING)));

            assertThatThrownBy(() -> service.deactivate(1L))
                    .extracting("kind").isEqualTo(ErrorKind.VALIDATION_ERROR);
        }

        @Test
        @DisplayName("Rejecting needs a reason and is final")
        void reject() {
            MappingRecord active = stored(1L, MappingStatus.ACTIVE);
            when(repository.findById(1L)).thenReturn(Optional.of(active));

            assertThatThrownBy(() -> service.reject(1L, "  "))
                    .extracting("kind").isEqualTo(ErrorKind.VALIDATION_ERROR);

            MappingView view = service.reject(1L, " wrong vehicle ");
            assertThat(view.getStatus()).isEqualTo("rejected");
            assertThat(view.getRejectionReason()).isEqualTo("wrong vehicle");
            assertThat(active.getActiveSlot()).isNull();

            assertThatThrownBy(() -> service.reject(1L, "again"))
                    .extracting("kind").isEqualTo(ErrorKind.VALIDATION_ERROR);
        }

        @Test
        @DisplayName("Deleting removes the stored mapping")
        void delete() {
            MappingRecord pending = stored(1L, MappingStatus.PENDING);
            when(repository.findById(1L)).thenReturn(Optional.of(pending));

            service.delete(1L);

            verify(repository).delete(pending);
        }
    }

    @Nested
    @DisplayName("update")
    class Update {

        @Test
        @DisplayName("Confidence and notes are patched, the confidence normalized")
        void patchConfidenceAndNotes() {
            when(repository.findById(1L)).thenReturn(Optional.of(stored(1L, MappingStatus.PENDING)));

            MappingView view = service.update(1L, UpdateMappingRequest.builder().confidence(90.0).notes("checked").build());

            assertThat(view.getConfidence()).isEqualTo(0.9);
            assertThat(view.getNotes()).isEqualTo("checked");
            assertThat(view.getStatus()).isEqualTo("pending");
        }

        @Test
        @DisplayName("A status patch to active goes through the slot check and publishes")
        void patchToActive() {
            MappingRecord inactive = stored(1L, MappingStatus.INACTIVE);
            when(repository.findById(1L)).thenReturn(Optional.of(inactive));
            when(repository.findByActiveSlot("7:EXPENSE_RECORD")).thenReturn(Optional.empty());

            MappingView view = service.update(1L, UpdateMappingRequest.builder().status("active").build());

            assertThat(view.getStatus()).isEqualTo("active");
            verify(eventPublisher).publishActivatedAfterCommit(inactive);
        }

        @Test
        @DisplayName("A status patch to rejected carries the reason")
        void patchToRejected() {
            when(repository.findById(1L)).thenReturn(Optional.of(stored(1L, MappingStatus.PENDING)));

            MappingView view = service.update(1L,
                    UpdateMappingRequest.builder().status("rejected").rejectionReason("duplicate").build());

            assertThat(view.getStatus()).isEqualTo("rejected");
            assertThat(view.getRejectionReason()).isEqualTo("duplicate");
        }

        @Test
        @DisplayName("Invalid patches are refused")
        void invalidPatches() {
            when(repository.findById(1L)).thenReturn(Optional.of(stored(1L, MappingStatus.ACTIVE)));
            when(repository.findById(2L)).thenReturn(Optional.of(stored(2L, MappingStatus.REJECTED)));

            // a reason without rejecting
            assertThatThrownBy(() -> service.update(1L, UpdateMappingRequest.builder().rejectionReason("x").build()))
                    .extracting("kind").isEqualTo(ErrorKind.VALIDATION_ERROR);
            // rejecting without a reason
            assertThatThrownBy(() -> service.update(1L, UpdateMappingRequest.builder().status("rejected").build()))
                    .extracting("kind").isEqualTo(ErrorKind.VALIDATION_ERROR);
            // back to pending
            assertThatThrownBy(() -> service.update(1L, UpdateMappingRequest.builder().status("pending").build()))
                    .extracting("kind").isEqualTo(ErrorKind.VALIDATION_ERROR);
            // touching a rejected mapping
            assertThatThrownBy(() -> service.update(2L, UpdateMappingRequest.builder().confidence(0.5).build()))
                    .extracting("kind").isEqualTo(ErrorKind.VALIDATION_ERROR);
            verify(repository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("Notes of a rejected mapping can still be edited")
        void notesOnRejected() {
            when(repository.findById(2L)).thenReturn(Optional.of(stored(2L, MappingStatus.REJECTED)));

            MappingView view = service.update(2L, UpdateMappingRequest.builder().notes("kept for audit").build());

            assertThat(view.getNotes()).isEqualTo("kept for audit");
            assertThat(view.getStatus()).isEqualTo("rejected");
        }
    }

    @Nested
    @DisplayName("propose")
    class Propose {

        @Test
        @DisplayName("Scenario D through the service: one amount proposal, nothing stored without persist")
        void proposeWithoutPersist() {
            // Given
            when(statementClient.get(7L)).thenReturn(statement());
            CandidateRequest candidate = CandidateRequest.builder()
                    .entityId("EXP-9").entityType("expense_record")
                    .date(DATE).time(LocalTime.of(8, 30))
                    .entryPoint("Tokyo-Kita").exitPoint("Yokohama").amount(1250)
                    .build();

            // When
            ProposeResponse response = service.propose(ProposeRequest.builder()
                    .statementRecordId(7L).candidates(List.of(candidate)).build());

            // Then
            assertThat(response.getMatches()).singleElement().satisfies(m -> {
                assertThat(m.getMatchType()).isEqualTo(MatchType.AMOUNT);
                assertThat(m.getConfidence()).isBetween(0.0, 1.0).isNotEqualTo(1.0);
            });
            assertThat(response.getCreated()).isEmpty();
            verify(repository, never()).saveAndFlush(any());
            verifyNoInteractions(candidateService);
        }

        @Test
        @DisplayName("Without candidates the registered ones around the record date are used and persisted")
        void proposeRegisteredAndPersist() {
            // Given
            when(statementClient.get(7L)).thenReturn(statement());
            when(candidateService.around(DATE)).thenReturn(List.of(
                    ExternalCandidate.builder().entityId("DT-1").entityType(ExternalEntityType.DTAKO_RECORD)
                            .date(DATE).time(LocalTime.of(8, 40)).entryPoint("Tokyo-Kita").exitPoint("Yokohama")
                            .amount(1200).build(),
                    ExternalCandidate.builder().entityId("DT-2").entityType(ExternalEntityType.DTAKO_RECORD)
                            .date(DATE).time(LocalTime.of(8, 30)).entryPoint("Tokyo-Kita").exitPoint("Yokohama")
                            .amount(1200).build()));
            when(repository.existsByStatementRecordIdAndExternalEntityTypeAndExternalEntityId(
                    eq(7L), eq(ExternalEntityType.DTAKO_RECORD), anyString()))
                    .thenAnswer(inv -> "DT-2".equals(inv.getArgument(2)));

            // When
            ProposeResponse response = service.propose(ProposeRequest.builder()
                    .statementRecordId(7L).persist(true).createdBy("bob").build());

            // Then
            assertThat(response.getMatches()).extracting(m -> m.getCandidateId()).containsExactly("DT-2", "DT-1");
            assertThat(response.getCreated()).singleElement().satisfies(v -> {
                assertThat(v.getExternalEntityId()).isEqualTo("DT-1");
                assertThat(v.getMatchType()).isEqualTo("time");
                assertThat(v.getStatus()).isEqualTo("pending");
                assertThat(v.getCreatedBy()).isEqualTo("bob");
            });
            verify(repository, times(1)).saveAndFlush(any());
            verifyNoInteractions(eventPublisher);
        }

        @Test
        @DisplayName("Proposing for an unknown record fails before any scoring")
        void unknownRecord() {
            when(statementClient.get(anyLong())).thenThrow(MeisaiException.statementNotFound("id", 8L));

            assertThatThrownBy(() -> service.propose(ProposeRequest.builder().statementRecordId(8L).build()))
                    .extracting("kind").isEqualTo(ErrorKind.STATEMENT_NOT_FOUND);
            verifyNoInteractions(candidateService);
        }

        @Test
        @DisplayName("An ad-hoc candidate without entity type is a validation error")
        void invalidCandidate() {
            when(statementClient.get(7L)).thenReturn(statement());

            assertThatThrownBy(() -> service.propose(ProposeRequest.builder()
                    .statementRecordId(7L)
                    .candidates(List.of(CandidateRequest.builder().entityId("X").date(DATE).build()))
                    .build()))
                    .extracting("kind").isEqualTo(ErrorKind.VALIDATION_ERROR);
        }
    }
}
