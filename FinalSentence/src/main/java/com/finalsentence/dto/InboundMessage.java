package com.finalsentence.dto;

import jakarta.validation.constraints.NotBlank;
import java.util.Map;

/** Room-scoped client message as it arrives on the wire. */
public record InboundMessage(
    @NotBlank String type, @NotBlank String playerId, Map<String, Object> payload) {}
