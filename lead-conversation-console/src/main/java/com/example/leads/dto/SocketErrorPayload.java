package com.example.leads.dto;

import com.example.leads.service.exception.ErrorCode;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SocketErrorPayload {
    ErrorCode code;
    String message;
}
