package com.example.leads.service;

import com.example.leads.domain.ConversationSession;
import com.example.leads.domain.Lead;
import com.example.leads.domain.LeadFilters;
import com.example.leads.domain.MergedLeadView;
import com.example.leads.service.exception.ErrorCode;
import com.example.leads.service.exception.ServiceException;
import com.example.leads.store.RecordStoreClient;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Slf4j
@Service
@RequiredArgsConstructor
public class LeadViewService {

    private final RecordStoreClient recordStore;
    private final LeadMergeEngine mergeEngine;

    public List<MergedLeadView> mergePass(String organizationId, LeadFilters filters) {
        if (!StringUtils.hasText(organizationId)) {
            throw new ServiceException(ErrorCode.BAD_REQUEST, "Organization id is required");
        }
        List<ConversationSession> sessions = recordStore.listSessions(organizationId);
        List<Lead> leads = recordStore.listLeads(organizationId, filters);
        List<MergedLeadView> merged = mergeEngine.merge(leads, sessions, filters);
        log.debug("Merged {} lead(s) and {} session(s) of organization {} into {} entries",
                leads.size(), sessions.size(), organizationId, merged.size());
        return merged;
    }

    public List<MergedLeadView> getMergedView(String organizationId, LeadFilters filters) {
        return mergeEngine.applyViewFilters(mergePass(organizationId, filters), filters);
    }

    public Optional<MergedLeadView> findView(String organizationId, String leadId) {
        return mergePass(organizationId, LeadFilters.none()).stream()
                .filter(view -> view.getId().equals(leadId))
                .findFirst();
    }
}
