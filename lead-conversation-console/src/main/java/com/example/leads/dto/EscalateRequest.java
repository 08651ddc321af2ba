package com.example.leads.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class EscalateRequest {

    @Size(max = 500)
    private String reason;
}
