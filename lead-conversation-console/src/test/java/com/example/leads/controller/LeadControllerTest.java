package com.example.leads.controller;

import static com.example.leads.support.TestRecords.ORG;
import static com.example.leads.support.TestRecords.T0;
import static com.example.leads.support.TestRecords.lead;
import static com.example.leads.support.TestRecords.session;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.leads.domain.ConversationStatusFilter;
import com.example.leads.domain.LeadFilters;
import com.example.leads.domain.LeadStatus;
import com.example.leads.domain.MergedLeadView;
import com.example.leads.service.CascadeDeleteOrchestrator;
import com.example.leads.service.DeletionResult;
import com.example.leads.service.LeadViewService;
import com.example.leads.service.exception.ErrorCode;
import com.example.leads.service.exception.ServiceException;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class LeadControllerTest {

    @Mock
    private LeadViewService leadViewService;

    @Mock
    private CascadeDeleteOrchestrator deleteOrchestrator;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new LeadController(leadViewService, deleteOrchestrator))
                .setControllerAdvice(new RestExceptionHandler())
                .build();
    }

    @Test
    void listsMergedViewWithParsedFilters() throws Exception {
        MergedLeadView real = MergedLeadView.real(lead("L1", "+15550001", T0), session("S1", "+15550001", T0));
        MergedLeadView virtual = MergedLeadView.virtual(session("S2", "+15550002", T0));
        when(leadViewService.getMergedView(eq(ORG), any(LeadFilters.class))).thenReturn(List.of(real, virtual));

        mockMvc.perform(get("/api/organizations/{org}/leads", ORG)
                        .param("status", "qualified")
                        .param("conversationStatus", "agent"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("L1"))
                .andExpect(jsonPath("$[0].virtual").value(false))
                .andExpect(jsonPath("$[1].id").value("virtual-S2"))
                .andExpect(jsonPath("$[1].virtual").value(true));

        ArgumentCaptor<LeadFilters> filters = ArgumentCaptor.forClass(LeadFilters.class);
        verify(leadViewService).getMergedView(eq(ORG), filters.capture());
        assertEquals(LeadStatus.QUALIFIED, filters.getValue().getStatus());
        assertEquals(ConversationStatusFilter.AGENT, filters.getValue().getConversationStatus());
        assertNull(filters.getValue().getQualificationScore());
    }

    @Test
    void unknownFilterValueIsRejected() throws Exception {
        mockMvc.perform(get("/api/organizations/{org}/leads", ORG).param("status", "archived"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));

        verifyNoInteractions(leadViewService);
    }

    @Test
    void deletingAnUnknownLeadIsNotFound() throws Exception {
        when(leadViewService.findView(ORG, "missing")).thenReturn(Optional.empty());

        mockMvc.perform(delete("/api/organizations/{org}/leads/{id}", ORG, "missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));

        verifyNoInteractions(deleteOrchestrator);
    }

    @Test
    void blockedDeleteReportsConflictWithWarnings() throws Exception {
        MergedLeadView real = MergedLeadView.real(lead("L1", "+15550001", T0), null);
        when(leadViewService.findView(ORG, "L1")).thenReturn(Optional.of(real));
        when(deleteOrchestrator.deleteLead(ORG, real)).thenReturn(DeletionResult.builder()
                .leadId("L1")
                .leadDeleted(false)
                .warning(DeletionResult.SESSION_DELETE_FAILED)
                .failure(new ServiceException(ErrorCode.BLOCKED_DELETION, "Lead deletion was blocked - no rows affected"))
                .build());

        mockMvc.perform(delete("/api/organizations/{org}/leads/{id}", ORG, "L1"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.leadDeleted").value(false))
                .andExpect(jsonPath("$.failureCode").value("BLOCKED_DELETION"))
                .andExpect(jsonPath("$.warnings[0]").value(DeletionResult.SESSION_DELETE_FAILED));
    }

    @Test
    void successfulDeleteReturnsResult() throws Exception {
        MergedLeadView virtual = MergedLeadView.virtual(session("S2", "+15550002", T0));
        when(leadViewService.findView(ORG, "virtual-S2")).thenReturn(Optional.of(virtual));
        when(deleteOrchestrator.deleteLead(ORG, virtual)).thenReturn(DeletionResult.builder()
                .leadId("virtual-S2")
                .leadDeleted(true)
                .build());

        mockMvc.perform(delete("/api/organizations/{org}/leads/{id}", ORG, "virtual-S2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.leadId").value("virtual-S2"))
                .andExpect(jsonPath("$.leadDeleted").value(true));
    }
}
