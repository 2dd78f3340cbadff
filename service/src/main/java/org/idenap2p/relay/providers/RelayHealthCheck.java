/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.providers;

import com.codahale.metrics.health.HealthCheck;
import org.idenap2p.relay.storage.MessageQueue;
import org.idenap2p.relay.websocket.ConnectionRegistry;

/**
 * Admin health check reporting relay load. The relay keeps all state in memory, so it is healthy whenever it can
 * answer.
 */
public class RelayHealthCheck extends HealthCheck {

  private final ConnectionRegistry connectionRegistry;
  private final MessageQueue messageQueue;

  public RelayHealthCheck(final ConnectionRegistry connectionRegistry, final MessageQueue messageQueue) {
    this.connectionRegistry = connectionRegistry;
    this.messageQueue = messageQueue;
  }

  @Override
  protected Result check() {
    return Result.healthy("%d connections, %d queued messages",
        connectionRegistry.getConnectionCount(), messageQueue.getTotalQueueSize());
  }
}
