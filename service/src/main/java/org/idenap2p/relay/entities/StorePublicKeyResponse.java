/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.entities;

public record StorePublicKeyResponse(boolean success, String address, long updatedAt) {
}
