package com.example.leads.domain;

import java.io.Serializable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Copy of the correlated lead's identity that the agent writes onto a session when it updates it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeadSummary implements Serializable {

    private String leadId;
    private String contactName;
    private String companyName;
    private QualificationScore qualificationScore;
    private LeadStatus status;
}
