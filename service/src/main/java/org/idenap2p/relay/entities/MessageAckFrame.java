/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.entities;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tells a sender what became of its message: {@code delivered} to a connected recipient, or {@code queued} for later.
 */
public record MessageAckFrame(String type, String messageId, @JsonProperty("to") String recipient, long timestamp)
    implements OutboundFrame {

  public static MessageAckFrame delivered(final String messageId, final String recipient, final long timestamp) {
    return new MessageAckFrame("delivered", messageId, recipient, timestamp);
  }

  public static MessageAckFrame queued(final String messageId, final String recipient, final long timestamp) {
    return new MessageAckFrame("queued", messageId, recipient, timestamp);
  }
}
