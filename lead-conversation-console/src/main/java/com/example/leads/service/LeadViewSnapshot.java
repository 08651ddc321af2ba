package com.example.leads.service;

import com.example.leads.domain.LeadFilters;
import com.example.leads.domain.MergedLeadView;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeadViewSnapshot {

    private String organizationId;
    private LeadFilters filters;
    private List<MergedLeadView> leads;
    private boolean stale;
    private String selectedLeadId;
    private Instant generatedAt;
}
