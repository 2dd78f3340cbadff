/*
 * Copyright 2013 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.controllers;

/**
 * Thrown when a request parameter or body fails validation. Mapped to a 400 response with an {@code error} body.
 */
public class InvalidRequestException extends RuntimeException {

  public InvalidRequestException(String message) {
    super(message, null, true, false);
  }
}
