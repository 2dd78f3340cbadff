/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.entities;

import java.util.List;

public record OnlineAddressesResponse(int count, List<String> users, long timestamp) {

  public OnlineAddressesResponse(final List<String> users, final long timestamp) {
    this(users.size(), users, timestamp);
  }
}
