/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.controllers;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.time.Clock;
import java.time.Instant;
import org.idenap2p.relay.entities.HealthResponse;
import org.idenap2p.relay.storage.MessageQueue;
import org.idenap2p.relay.websocket.ConnectionRegistry;

/**
 * Liveness probe for load balancers and orchestration.
 */
@Path("/health")
@Produces(MediaType.APPLICATION_JSON)
public class HealthController {

  private final ConnectionRegistry connectionRegistry;
  private final MessageQueue messageQueue;
  private final Clock clock;
  private final Instant startTime;

  public HealthController(final ConnectionRegistry connectionRegistry, final MessageQueue messageQueue,
      final Clock clock) {

    this.connectionRegistry = connectionRegistry;
    this.messageQueue = messageQueue;
    this.clock = clock;
    this.startTime = clock.instant();
  }

  @GET
  public HealthResponse getHealth() {
    final Instant now = clock.instant();

    return new HealthResponse("ok",
        now.toString(),
        (now.toEpochMilli() - startTime.toEpochMilli()) / 1000.0,
        connectionRegistry.getConnectionCount(),
        messageQueue.getTotalQueueSize());
  }
}
