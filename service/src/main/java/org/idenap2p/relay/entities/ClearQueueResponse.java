/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.entities;

public record ClearQueueResponse(String address, boolean cleared, String message) {

  public static ClearQueueResponse forResult(final String address, final boolean cleared) {
    return new ClearQueueResponse(address, cleared, cleared ? "Queue cleared" : "No messages to clear");
  }
}
