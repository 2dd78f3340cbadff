/*
 * Copyright 2013 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.storage;

/**
 * A published public key. Timestamps are epoch milliseconds; {@code createdAt} is fixed at the first store for an
 * address.
 */
public record PublicKeyRecord(String address, String publicKey, long createdAt, long updatedAt) {
}
