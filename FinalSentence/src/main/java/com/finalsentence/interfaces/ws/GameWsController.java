package com.finalsentence.interfaces.ws;

import com.finalsentence.application.GameService;
import com.finalsentence.application.RoomCommand;
import com.finalsentence.dto.ErrorMessage;
import com.finalsentence.dto.InboundMessage;
import com.finalsentence.infrastructure.StompSessionChannel;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/**
 * STOMP entry point. Clients send to {@code /app/rooms/{roomId}}, receive room traffic on
 * {@code /user/queue/room} and errors on {@code /user/queue/reply}.
 */
@Validated
@Controller
public class GameWsController {
  private static final Logger log = LoggerFactory.getLogger(GameWsController.class);

  private final GameService game;
  private final SimpMessagingTemplate ws;

  public GameWsController(GameService game, SimpMessagingTemplate ws) {
    this.game = game;
    this.ws = ws;
  }

  @MessageMapping("/rooms/{roomId}")
  public void onMessage(
      @DestinationVariable String roomId,
      @Valid @Payload InboundMessage msg,
      @Header("simpSessionId") String sid) {
    RoomCommand cmd = RoomCommand.parse(msg.type(), msg.playerId(), msg.payload());
    game.handle(roomId, new StompSessionChannel(sid, ws), cmd);
  }

  @MessageExceptionHandler(Exception.class)
  @SendToUser(destinations = "/queue/reply", broadcast = false)
  public ErrorMessage onError(Exception e) {
    log.debug("Rejected client message: {}", e.getMessage());
    return new ErrorMessage(e.getMessage());
  }

  @EventListener
  public void onDisconnect(SessionDisconnectEvent e) {
    game.disconnect(e.getSessionId());
  }
}
