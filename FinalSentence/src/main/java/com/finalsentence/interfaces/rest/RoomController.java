package com.finalsentence.interfaces.rest;

import com.finalsentence.application.GameService;
import com.finalsentence.domain.PlayerStats;
import com.finalsentence.dto.CreateRoomRequest;
import com.finalsentence.dto.JoinRoomRequest;
import com.finalsentence.dto.RoomStateMessage;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RoomController {
  private final GameService game;

  public RoomController(GameService game) {
    this.game = game;
  }

  @PostMapping("/rooms")
  @ResponseStatus(HttpStatus.CREATED)
  public RoomStateMessage create(@Valid @RequestBody CreateRoomRequest req) {
    return RoomStateMessage.of(
        game.createRoom(req.hostId(), req.hostName(), req.kind(), req.maxPlayers()));
  }

  @PostMapping("/rooms/join")
  public RoomStateMessage join(@Valid @RequestBody JoinRoomRequest req) {
    return RoomStateMessage.of(
        game.joinByCode(req.code(), req.playerId(), req.displayName(), req.avatar()));
  }

  @GetMapping("/rooms/{roomId}")
  public RoomStateMessage room(@PathVariable String roomId) {
    return RoomStateMessage.of(game.snapshot(roomId));
  }

  @GetMapping("/players/{playerId}/stats")
  public PlayerStats stats(@PathVariable String playerId) {
    return game.stats(playerId);
  }
}
