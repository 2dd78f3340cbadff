/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.entities;

import java.util.List;
import org.idenap2p.relay.storage.QueuedMessage;

public record QueuedMessagesResponse(String address, int count, List<QueuedMessage> messages) {

  public QueuedMessagesResponse(final String address, final List<QueuedMessage> messages) {
    this(address, messages.size(), messages);
  }
}
