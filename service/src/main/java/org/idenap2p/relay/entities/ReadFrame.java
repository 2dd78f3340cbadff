/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.entities;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ReadFrame(String type, @JsonProperty("from") String sender, String messageId, long timestamp)
    implements OutboundFrame {

  public ReadFrame(final String sender, final String messageId, final long timestamp) {
    this("read", sender, messageId, timestamp);
  }
}
