/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.entities;

import com.fasterxml.jackson.annotation.JsonProperty;
import javax.annotation.Nullable;

public record TypingNotificationFrame(String type, @JsonProperty("from") String sender, @Nullable Boolean isTyping)
    implements OutboundFrame {

  public TypingNotificationFrame(final String sender, @Nullable final Boolean isTyping) {
    this("typing", sender, isTyping);
  }
}
