package com.finalsentence.dto;

public record HostChangedMessage(String type, String previousHostId, String hostId)
    implements OutboundMessage {
  public HostChangedMessage(String previousHostId, String hostId) {
    this("host_changed", previousHostId, hostId);
  }
}
