/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.entities;

public record AuthSuccessFrame(String type, String address, long timestamp) implements OutboundFrame {

  public AuthSuccessFrame(final String address, final long timestamp) {
    this("auth_success", address, timestamp);
  }
}
