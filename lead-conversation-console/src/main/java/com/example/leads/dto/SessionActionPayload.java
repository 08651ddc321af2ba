package com.example.leads.dto;

import lombok.Data;

@Data
public class SessionActionPayload {

    private String sessionId;
    private String reason;
}
