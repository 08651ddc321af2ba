package com.example.leads.domain;

import java.io.Serializable;
import java.util.Objects;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Filters of the unified lead list. {@code status} and {@code qualificationScore} are pushed down
 * to the store; {@code conversationStatus} and {@code search} depend on the merged shape and are
 * applied after the merge.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LeadFilters implements Serializable {

    private LeadStatus status;
    private QualificationScore qualificationScore;
    private ConversationStatusFilter conversationStatus;
    private String search;

    public static LeadFilters none() {
        return new LeadFilters();
    }

    /**
     * Virtual leads carry a synthetic status and score, so they are only listed when neither
     * predicate is active.
     */
    public boolean hasLeadPredicates() {
        return status != null || qualificationScore != null;
    }

    public boolean sameStorePredicates(LeadFilters other) {
        if (other == null) {
            return !hasLeadPredicates();
        }
        return status == other.status && qualificationScore == other.qualificationScore;
    }

    public boolean hasSearch() {
        return search != null && !search.isBlank();
    }

    public static LeadFilters orNone(LeadFilters filters) {
        return Objects.requireNonNullElseGet(filters, LeadFilters::none);
    }
}
