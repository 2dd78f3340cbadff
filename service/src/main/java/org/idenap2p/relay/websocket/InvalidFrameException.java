/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.websocket;

/**
 * Indicates that a text frame could not be decoded into a relay frame.
 */
public class InvalidFrameException extends Exception {

  public InvalidFrameException(final String message) {
    super(message);
  }

  public InvalidFrameException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
