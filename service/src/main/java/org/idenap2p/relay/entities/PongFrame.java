/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.entities;

public record PongFrame(String type, long timestamp) implements OutboundFrame {

  public PongFrame(final long timestamp) {
    this("pong", timestamp);
  }
}
