package com.finalsentence.infrastructure;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketTransportRegistration;

/**
 * STOMP over SockJS at {@code /ws}. Room traffic is per session under {@code /user/queue}; the
 * broker heartbeats let a silent client be detected and handed to the grace window.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

  @Value("${finalsentence.allowed-origins:*}")
  private String allowedOrigins;

  @Value("${finalsentence.heartbeat-millis:10000}")
  private long heartbeatMillis;

  private TaskScheduler heartbeats;

  // The broker's own scheduler; started and stopped with the context.
  @Autowired
  public void setMessageBrokerTaskScheduler(
      @Lazy @Qualifier("messageBrokerTaskScheduler") TaskScheduler scheduler) {
    this.heartbeats = scheduler;
  }

  @Override
  public void configureMessageBroker(MessageBrokerRegistry r) {
    r.enableSimpleBroker("/queue")
        .setHeartbeatValue(new long[] {heartbeatMillis, heartbeatMillis})
        .setTaskScheduler(heartbeats);
    r.setApplicationDestinationPrefixes("/app");
    r.setUserDestinationPrefix("/user");
  }

  @Override
  public void configureWebSocketTransport(WebSocketTransportRegistration t) {
    t.setMessageSizeLimit(16 * 1024);
    t.setSendBufferSizeLimit(512 * 1024);
    t.setSendTimeLimit(10_000);
  }

  @Override
  public void registerStompEndpoints(StompEndpointRegistry r) {
    String[] origins = allowedOrigins.trim().split("\\s*,\\s*");
    r.addEndpoint("/ws")
      .setAllowedOriginPatterns(origins)
      .withSockJS();
  }
}
