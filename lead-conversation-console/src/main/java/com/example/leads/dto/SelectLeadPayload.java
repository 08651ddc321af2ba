package com.example.leads.dto;

import lombok.Data;

@Data
public class SelectLeadPayload {

    // null clears the selection
    private String leadId;
}
