/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.entities;

import java.util.Map;
import org.idenap2p.relay.storage.PublicKeyRecord;

public record PublicKeyBatchResponse(int count, Map<String, PublicKeyRecord> keys) {

  public PublicKeyBatchResponse(final Map<String, PublicKeyRecord> keys) {
    this(keys.size(), keys);
  }
}
