package com.finalsentence.domain;

public enum RoomStatus {
  WAITING,
  PLAYING,
  FINISHED
}
