/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.controllers;

import jakarta.validation.constraints.Min;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import java.util.List;
import javax.annotation.Nullable;
import org.idenap2p.relay.entities.ClearQueueResponse;
import org.idenap2p.relay.entities.QueueSizeResponse;
import org.idenap2p.relay.entities.QueuedMessagesResponse;
import org.idenap2p.relay.storage.MessageQueue;
import org.idenap2p.relay.storage.MessageQueueStats;
import org.idenap2p.relay.storage.QueuedMessage;
import org.idenap2p.relay.util.Addresses;

/**
 * Lets a client fetch its offline messages over HTTP instead of, or as a fallback to, live socket delivery.
 */
@Path("/api/messages")
@Produces(MediaType.APPLICATION_JSON)
public class MessageController {

  private final MessageQueue messageQueue;

  public MessageController(final MessageQueue messageQueue) {
    this.messageQueue = messageQueue;
  }

  /**
   * Returns queued messages for an address. Without {@code limit} the queue is drained; with it, up to {@code limit}
   * of the oldest messages are returned and left in place.
   */
  @GET
  @Path("/{address}")
  public QueuedMessagesResponse getMessages(@PathParam("address") final String address,
      @QueryParam("limit") @Min(0) @Nullable final Integer limit) {

    final String normalizedAddress = Addresses.requireValid(address);

    final List<QueuedMessage> messages = limit != null
        ? messageQueue.peek(normalizedAddress, limit)
        : messageQueue.dequeue(normalizedAddress);

    return new QueuedMessagesResponse(normalizedAddress, messages);
  }

  @GET
  @Path("/{address}/queue-size")
  public QueueSizeResponse getQueueSize(@PathParam("address") final String address) {
    final String normalizedAddress = Addresses.requireValid(address);

    return new QueueSizeResponse(normalizedAddress, messageQueue.getQueueSize(normalizedAddress));
  }

  @DELETE
  @Path("/{address}")
  public ClearQueueResponse clearQueue(@PathParam("address") final String address) {
    final String normalizedAddress = Addresses.requireValid(address);

    return ClearQueueResponse.forResult(normalizedAddress, messageQueue.clear(normalizedAddress));
  }

  @GET
  @Path("/stats/all")
  public MessageQueueStats getStats() {
    return messageQueue.getStats();
  }
}
