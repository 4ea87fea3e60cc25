package com.crosslend.core.events;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;

/**
 * Fans lending records out as Spring application events. Listener failures are logged and never
 * propagate into the ledger operation that emitted them.
 */
@RequiredArgsConstructor
@Slf4j
public class SpringLendingEventPublisher implements LendingEventPublisher {

  private final @NonNull ApplicationEventPublisher delegate;
  private final @NonNull Clock clock;

  @Override
  public void publish(String type, Object payload) {
    LendingEvent event = new LendingEvent(type, clock.instant(), payload);
    try {
      delegate.publishEvent(event);
      log.debug("event published type={} payload={}", type, payload);
    } catch (Exception e) {
      log.warn("event listener failed type={} err={}", type, e.toString());
    }
  }
}
