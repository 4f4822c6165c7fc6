package com.finalsentence.dto;

/** Server-to-client message; {@code type} is the wire discriminant. */
public interface OutboundMessage {
  String type();
}
