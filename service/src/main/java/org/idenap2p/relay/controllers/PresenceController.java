/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.controllers;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;
import org.idenap2p.relay.entities.BatchAddressesRequest;
import org.idenap2p.relay.entities.OnlineAddressesResponse;
import org.idenap2p.relay.entities.PresenceBatchResponse;
import org.idenap2p.relay.entities.PresenceResponse;
import org.idenap2p.relay.util.Addresses;
import org.idenap2p.relay.websocket.ConnectionRegistry;

/**
 * Reports whether addresses currently have an open relay connection.
 */
@Path("/api/status")
@Produces(MediaType.APPLICATION_JSON)
public class PresenceController {

  private final ConnectionRegistry connectionRegistry;
  private final Clock clock;

  public PresenceController(final ConnectionRegistry connectionRegistry, final Clock clock) {
    this.connectionRegistry = connectionRegistry;
    this.clock = clock;
  }

  @GET
  @Path("/{address}")
  public PresenceResponse getPresence(@PathParam("address") final String address) {
    final String normalizedAddress = Addresses.requireValid(address);

    return new PresenceResponse(normalizedAddress, connectionRegistry.isOnline(normalizedAddress), clock.millis());
  }

  @POST
  @Path("/batch")
  @Consumes(MediaType.APPLICATION_JSON)
  public PresenceBatchResponse getPresences(@Nullable final BatchAddressesRequest request) {
    final Map<String, Boolean> statuses = new LinkedHashMap<>();

    for (final String address : BatchAddresses.requireValid(request)) {
      statuses.put(address, connectionRegistry.isOnline(address));
    }

    return new PresenceBatchResponse(clock.millis(), statuses);
  }

  @GET
  @Path("/online/all")
  public OnlineAddressesResponse getOnlineAddresses() {
    return new OnlineAddressesResponse(connectionRegistry.getOnlineAddresses(), clock.millis());
  }
}
