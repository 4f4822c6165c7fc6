package com.finalsentence.domain;

public enum EliminationReason {
  ERRORS,
  TIMEOUT
}
