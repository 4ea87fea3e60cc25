package com.crosslend.core.events;

public interface LendingEventPublisher {

  void publish(String type, Object payload);

  static LendingEventPublisher noop() {
    return (type, payload) -> {
    };
  }
}
