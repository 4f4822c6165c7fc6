package com.finalsentence.dto;

public record ErrorMessage(String type, String message) implements OutboundMessage {
  public ErrorMessage(String message) {
    this("error", message);
  }
}
