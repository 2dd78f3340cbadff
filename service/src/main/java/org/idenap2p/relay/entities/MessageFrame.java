/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.entities;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import javax.annotation.Nullable;

/**
 * A message delivered to its recipient, either live or, with {@code queued} set, drained from the offline queue.
 */
public record MessageFrame(String type,
                           @JsonProperty("from") String sender,
                           String content,
                           String messageId,
                           long timestamp,
                           @JsonInclude(JsonInclude.Include.NON_NULL) @Nullable Boolean queued) implements OutboundFrame {

  public static MessageFrame live(final String sender, final String content, final String messageId,
      final long timestamp) {

    return new MessageFrame("message", sender, content, messageId, timestamp, null);
  }

  public static MessageFrame queued(final String sender, final String content, final String messageId,
      final long timestamp) {

    return new MessageFrame("message", sender, content, messageId, timestamp, true);
  }
}
