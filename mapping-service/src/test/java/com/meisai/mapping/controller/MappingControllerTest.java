package com.meisai.mapping.controller;

import com.meisai.common.error.ErrorKind;
import com.meisai.common.error.MeisaiException;
import com.meisai.mapping.dto.CandidateRequest;
import com.meisai.mapping.dto.CandidateView;
import com.meisai.mapping.dto.CreateMappingRequest;
import com.meisai.mapping.dto.MappingView;
import com.meisai.mapping.dto.PageResponse;
import com.meisai.mapping.dto.ProposeRequest;
import com.meisai.mapping.dto.ProposeResponse;
import com.meisai.mapping.dto.UpdateMappingRequest;
import com.meisai.mapping.entity.ExternalEntityType;
import com.meisai.mapping.entity.MatchType;
import com.meisai.mapping.matching.ScoredMatch;
import com.meisai.mapping.service.CandidateService;
import com.meisai.mapping.service.MappingService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest({MappingController.class, CandidateController.class})
@DisplayName("Mapping REST API Tests")
class MappingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MappingService mappingService;

    @MockBean
    private CandidateService candidateService;

    private static MappingView view(long id, String status) {
        return MappingView.builder()
                .id(id)
                .statementRecordId(7L)
                .externalEntityId("EXP-1")
                .externalEntityType("expense_record")
                .confidence(1.0)
                .matchType("manual")
                .status(status)
                .build();
    }

    @Test
    @DisplayName("POST /mappings creates and answers 201")
    void create() throws Exception {
        when(mappingService.create(any(CreateMappingRequest.class))).thenReturn(view(1L, "active"));

        mockMvc.perform(post("/mappings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"statementRecordId":7,"externalEntityId":"EXP-1","externalEntityType":"expense_record","confidence":85}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(1))
                .andExpect(jsonPath("$.status").value("active"));

        ArgumentCaptor<CreateMappingRequest> captor = ArgumentCaptor.forClass(CreateMappingRequest.class);
        verify(mappingService).create(captor.capture());
        assertThat(captor.getValue().getConfidence()).isEqualTo(85.0);
        assertThat(captor.getValue().getExternalEntityType()).isEqualTo("expense_record");
    }

    @Test
    @DisplayName("Unknown mapping ids answer 404 with the error kind")
    void notFound() throws Exception {
        when(mappingService.get(9L)).thenThrow(MeisaiException.mappingNotFound(9L));

        mockMvc.perform(get("/mappings/9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("MAPPING_NOT_FOUND"))
                .andExpect(jsonPath("$.context.mappingId").value(9));
    }

    @Test
    @DisplayName("A confirm conflict answers 409")
    void confirmConflict() throws Exception {
        when(mappingService.confirm(2L)).thenThrow(new MeisaiException(ErrorKind.MAPPING_CONFLICT,
                "already active", Map.of("activeMappingId", 1L)));

        mockMvc.perform(post("/mappings/2/confirm"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("MAPPING_CONFLICT"))
                .andExpect(jsonPath("$.context.activeMappingId").value(1))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    @DisplayName("Deactivate and reject delegate to the service")
    void deactivateAndReject() throws Exception {
        when(mappingService.deactivate(1L)).thenReturn(view(1L, "inactive"));
        when(mappingService.reject(1L, "wrong trip")).thenReturn(view(1L, "rejected"));

        mockMvc.perform(post("/mappings/1/deactivate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("inactive"));
        mockMvc.perform(post("/mappings/1/reject")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"wrong trip\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("rejected"));
    }

    @Test
    @DisplayName("Validation failures answer 400")
    void validation() throws Exception {
        when(mappingService.reject(1L, null)).thenThrow(MeisaiException.validation("rejectionReason", "required"));

        mockMvc.perform(post("/mappings/1/reject")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.context.field").value("rejectionReason"));
        mockMvc.perform(get("/mappings/abc"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("PATCH and DELETE")
    void patchAndDelete() throws Exception {
        when(mappingService.update(eq(1L), any(UpdateMappingRequest.class))).thenReturn(view(1L, "pending"));

        mockMvc.perform(patch("/mappings/1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"confidence\":0.7,\"notes\":\"checked\"}"))
                .andExpect(status().isOk());
        mockMvc.perform(delete("/mappings/1"))
                .andExpect(status().isNoContent());

        verify(mappingService).delete(1L);
    }

    @Test
    @DisplayName("GET /mappings passes the filters through")
    void list() throws Exception {
        when(mappingService.list(7L, "amount", "pending", "invoice_record", 2, 10))
                .thenReturn(PageResponse.<MappingView>builder()
                        .items(List.of(view(3L, "pending"))).page(2).pageSize(10).totalItems(11).totalPages(2).build());

        mockMvc.perform(get("/mappings")
                        .param("statementRecordId", "7")
                        .param("matchType", "amount")
                        .param("status", "pending")
                        .param("entityType", "invoice_record")
                        .param("page", "2")
                        .param("pageSize", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].id").value(3))
                .andExpect(jsonPath("$.totalItems").value(11));
    }

    @Test
    @DisplayName("POST /mappings/propose returns wire names for types")
    void propose() throws Exception {
        when(mappingService.propose(any(ProposeRequest.class))).thenReturn(ProposeResponse.builder()
                .statementRecordId(7L)
                .matches(List.of(new ScoredMatch("EXP-9", ExternalEntityType.EXPENSE_RECORD, 0.775, MatchType.AMOUNT)))
                .created(List.of())
                .build());

        mockMvc.perform(post("/mappings/propose")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"statementRecordId\":7,\"persist\":false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.matches[0].candidateId").value("EXP-9"))
                .andExpect(jsonPath("$.matches[0].entityType").value("expense_record"))
                .andExpect(jsonPath("$.matches[0].matchType").value("amount"))
                .andExpect(jsonPath("$.matches[0].confidence").value(0.775));
    }

    @Test
    @DisplayName("Candidates can be registered and listed")
    void candidates() throws Exception {
        CandidateView registered = CandidateView.builder()
                .id(1L).entityId("DT-1").entityType("dtako_record").date(LocalDate.of(2024, 1, 15)).amount(1200).build();
        when(candidateService.register(any(CandidateRequest.class))).thenReturn(registered);
        when(candidateService.list("dtako_record", null, null)).thenReturn(PageResponse.<CandidateView>builder()
                .items(List.of(registered)).page(1).pageSize(50).totalItems(1).totalPages(1).build());

        mockMvc.perform(post("/candidates")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"entityId":"DT-1","entityType":"dtako_record","date":"2024-01-15","time":"08:30","amount":1200}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.date").value("2024-01-15"));
        mockMvc.perform(get("/candidates").param("entityType", "dtako_record"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].entityId").value("DT-1"));
    }
}
