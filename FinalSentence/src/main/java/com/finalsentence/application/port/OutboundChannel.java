package com.finalsentence.application.port;

/** One client's live outbound connection. */
public interface OutboundChannel {
  String id();

  /**
   * Deliver a message to the client.
   *
   * @return false if the channel is dead and should be dropped
   */
  boolean send(Object message);
}
