package com.finalsentence.dto;

import com.finalsentence.domain.RoomKind;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

public record CreateRoomRequest(
    @NotBlank String hostId,
    @NotBlank String hostName,
    RoomKind kind,
    @Min(2) Integer maxPlayers) {}
