package com.example.leads.event;

public enum LeadEventType {
    ESCALATED,
    RELEASED,
    PROLONGED,
    AUTO_RELEASED,
    LEAD_DELETED
}
