package com.finalsentence.infrastructure;

import com.finalsentence.application.port.OutboundChannel;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;

/**
 * Outbound channel for one STOMP session. Messages go to {@code /user/queue/room} of that
 * session only, so each connection can be dropped on its own.
 */
public record StompSessionChannel(String id, SimpMessagingTemplate ws) implements OutboundChannel {
  public static final String DESTINATION = "/queue/room";

  @Override
  public boolean send(Object message) {
    try {
      ws.convertAndSendToUser(id, DESTINATION, message, headers(id));
      return true;
    } catch (MessagingException e) {
      return false;
    }
  }

  private static MessageHeaders headers(String sessionId) {
    SimpMessageHeaderAccessor a = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
    a.setSessionId(sessionId);
    a.setLeaveMutable(true);
    return a.getMessageHeaders();
  }
}
