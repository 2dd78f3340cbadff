/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.websocket;

import static org.idenap2p.relay.metrics.MetricsUtil.name;

import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import org.idenap2p.relay.storage.ManagedPeriodicWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Closes and unregisters authenticated connections that have not sent a frame within the heartbeat timeout.
 */
public class HeartbeatMonitor extends ManagedPeriodicWork {

  private static final Logger logger = LoggerFactory.getLogger(HeartbeatMonitor.class);

  private static final Counter STALE_CONNECTIONS_COUNTER = Metrics.counter(name(HeartbeatMonitor.class, "stale"));

  @VisibleForTesting
  static final int STALE_CONNECTION_CLOSE_CODE = 1000;

  private final ConnectionRegistry connectionRegistry;
  private final Duration timeout;
  private final Clock clock;

  public HeartbeatMonitor(final ConnectionRegistry connectionRegistry,
      final Duration interval,
      final Duration timeout,
      final Clock clock,
      final ScheduledExecutorService scheduledExecutorService) {

    super(interval, scheduledExecutorService);

    this.connectionRegistry = connectionRegistry;
    this.timeout = timeout;
    this.clock = clock;
  }

  @Override
  protected void doPeriodicWork() {
    closeStaleConnections();
  }

  @VisibleForTesting
  int closeStaleConnections() {
    final long now = clock.millis();
    int closed = 0;

    for (final RelayConnection connection : connectionRegistry.getConnections()) {
      if (now - connection.getLastActivity() > timeout.toMillis()) {
        final String address = connection.getAddress();
        logger.warn("Closing stale connection for {}", address);

        if (address != null) {
          connectionRegistry.unregister(address, connection);
        }

        connection.close(STALE_CONNECTION_CLOSE_CODE, "Heartbeat timeout");

        STALE_CONNECTIONS_COUNTER.increment();
        closed++;
      }
    }

    return closed;
  }
}
