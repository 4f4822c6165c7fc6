package com.finalsentence.dto;

import jakarta.validation.constraints.NotBlank;

public record JoinRoomRequest(
    @NotBlank String code,
    @NotBlank String playerId,
    @NotBlank String displayName,
    String avatar) {}
