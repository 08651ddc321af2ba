package com.example.leads.dto;

import com.example.leads.domain.LeadFilters;
import lombok.Data;

/**
 * Organization scope a console subscribes to, with its initial filters.
 */
@Data
public class LeadScopePayload {

    private String organizationId;
    private LeadFilters filters;
}
