package com.example.leads.service;

import com.example.leads.service.exception.ErrorCode;
import com.example.leads.service.exception.ServiceException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

@Getter
@Builder
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeletionResult {

    public static final String SESSION_DELETE_FAILED = "session delete failed";
    public static final String AGENT_SESSION_DELETE_FAILED = "agent session delete failed";
    public static final String MESSAGE_DELETE_FAILED = "message delete failed";

    private final String leadId;
    private final boolean leadDeleted;
    @Singular
    private final List<String> warnings;
    @JsonIgnore
    private final ServiceException failure;

    public boolean isFailed() {
        return failure != null;
    }

    public ErrorCode getFailureCode() {
        return failure != null ? failure.getErrorCode() : null;
    }

    public String getFailureMessage() {
        return failure != null ? failure.getMessage() : null;
    }
}
