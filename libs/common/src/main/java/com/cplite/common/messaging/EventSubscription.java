package com.cplite.common.messaging;

import java.time.Duration;

public interface EventSubscription {

  boolean isActive();

  int inFlight();

  /**
   * Stops taking new deliveries and waits up to {@code drainTimeout} for handler calls already
   * running. Deliveries that arrive after closing started are never acknowledged. Safe to call
   * more than once.
   */
  void close(Duration drainTimeout);
}
