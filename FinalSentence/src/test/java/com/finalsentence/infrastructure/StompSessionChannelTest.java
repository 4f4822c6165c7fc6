package com.finalsentence.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.finalsentence.dto.PlayerLeftMessage;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessagingTemplate;

class StompSessionChannelTest {
  private final SimpMessagingTemplate ws = mock(SimpMessagingTemplate.class);

  @Test
  void sendsToTheSessionsRoomQueue() {
    StompSessionChannel ch = new StompSessionChannel("s1", ws);
    PlayerLeftMessage msg = new PlayerLeftMessage("p1");

    assertThat(ch.send(msg)).isTrue();

    ArgumentCaptor<MessageHeaders> headers = ArgumentCaptor.forClass(MessageHeaders.class);
    verify(ws).convertAndSendToUser(eq("s1"), eq("/queue/room"), eq(msg), headers.capture());
    assertThat(SimpMessageHeaderAccessor.getSessionId(headers.getValue())).isEqualTo("s1");
  }

  @Test
  void deliveryFailureReportsDeadChannel() {
    doThrow(new MessageDeliveryException("session closed"))
        .when(ws)
        .convertAndSendToUser(anyString(), anyString(), any(), any(MessageHeaders.class));

    assertThat(new StompSessionChannel("s1", ws).send(new PlayerLeftMessage("p1"))).isFalse();
  }
}
