package com.example.leads.controller;

import com.example.leads.domain.ConversationStatusFilter;
import com.example.leads.domain.LeadFilters;
import com.example.leads.domain.LeadStatus;
import com.example.leads.domain.MergedLeadView;
import com.example.leads.domain.QualificationScore;
import com.example.leads.service.CascadeDeleteOrchestrator;
import com.example.leads.service.DeletionResult;
import com.example.leads.service.LeadViewService;
import com.example.leads.service.exception.ServiceException;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/organizations/{organizationId}/leads")
public class LeadController {

    private final LeadViewService leadViewService;
    private final CascadeDeleteOrchestrator deleteOrchestrator;

    public LeadController(LeadViewService leadViewService, CascadeDeleteOrchestrator deleteOrchestrator) {
        this.leadViewService = leadViewService;
        this.deleteOrchestrator = deleteOrchestrator;
    }

    @GetMapping
    public ResponseEntity<List<MergedLeadView>> listLeads(
            @PathVariable String organizationId,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String qualificationScore,
            @RequestParam(required = false) String conversationStatus,
            @RequestParam(required = false) String search) {
        LeadFilters filters = LeadFilters.builder()
                .status(LeadStatus.fromValue(status))
                .qualificationScore(QualificationScore.fromValue(qualificationScore))
                .conversationStatus(ConversationStatusFilter.fromValue(conversationStatus))
                .search(search)
                .build();
        return ResponseEntity.ok(leadViewService.getMergedView(organizationId, filters));
    }

    /**
     * Accepts real and virtual lead ids. A blocked or failed lead delete is reported with its error
     * status; failures of dependent records only appear as warnings.
     */
    @DeleteMapping("/{leadId}")
    public ResponseEntity<DeletionResult> deleteLead(@PathVariable String organizationId, @PathVariable String leadId) {
        MergedLeadView view = leadViewService.findView(organizationId, leadId)
                .orElseThrow(() -> ServiceException.notFound("Lead " + leadId + " not found"));
        DeletionResult result = deleteOrchestrator.deleteLead(organizationId, view);
        if (result.isFailed()) {
            return ResponseEntity.status(result.getFailure().getStatus()).body(result);
        }
        return ResponseEntity.ok(result);
    }
}
