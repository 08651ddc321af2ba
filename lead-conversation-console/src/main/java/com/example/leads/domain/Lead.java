package com.example.leads.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Lead implements Serializable {

    private String id;
    private String organizationId;
    private String phone;
    private String contactName;
    private String companyName;
    private String useCase;
    private String currentStack;
    private String expectedVolume;
    private String timeline;
    private QualificationScore qualificationScore;
    private LeadStatus status;
    private String notes;
    private String assignedRepId;
    private Instant createdAt;
    private Instant updatedAt;
}
