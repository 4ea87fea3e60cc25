package com.crosslend.core.domain;

public enum SystemState {
  ACTIVE,
  PAUSED
}
