/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.entities;

public record DeletePublicKeyResponse(boolean success, String message) {

  public static DeletePublicKeyResponse forResult(final boolean deleted) {
    return new DeletePublicKeyResponse(deleted, deleted ? "Public key deleted" : "Public key not found");
  }
}
