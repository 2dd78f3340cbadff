/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.websocket;

/**
 * Lifecycle of a relay socket. A connection only ever moves forward; {@link #CLOSED} is terminal.
 */
public enum ConnectionState {
  UNAUTHENTICATED,
  AUTHENTICATED,
  CLOSED
}
