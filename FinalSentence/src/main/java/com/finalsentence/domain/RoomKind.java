package com.finalsentence.domain;

public enum RoomKind {
  PUBLIC,
  PRIVATE
}
