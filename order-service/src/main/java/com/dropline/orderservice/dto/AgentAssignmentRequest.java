package com.dropline.orderservice.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AgentAssignmentRequest {
    @NotNull(message = "Agent ID cannot be null")
    private UUID agentId;
}
