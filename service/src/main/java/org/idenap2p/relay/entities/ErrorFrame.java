/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.entities;

import com.fasterxml.jackson.annotation.JsonInclude;
import javax.annotation.Nullable;

public record ErrorFrame(String type,
                         String message,
                         @JsonInclude(JsonInclude.Include.NON_NULL) @Nullable String messageId) implements OutboundFrame {

  public static final String AUTHENTICATION_REQUIRED = "Authentication required";
  public static final String INVALID_MESSAGE_FORMAT = "Invalid message format";
  public static final String FAILED_TO_PROCESS = "Failed to process message";

  public ErrorFrame(final String message, @Nullable final String messageId) {
    this("error", message, messageId);
  }

  public ErrorFrame(final String message) {
    this(message, null);
  }
}
