/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.controllers;

import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;
import org.idenap2p.relay.entities.BatchAddressesRequest;
import org.idenap2p.relay.util.Addresses;

class BatchAddresses {

  private BatchAddresses() {
  }

  /**
   * Returns the normalized addresses of a batch request, in request order.
   *
   * @throws InvalidRequestException if the batch is missing or empty, or if any address is malformed
   */
  static List<String> requireValid(@Nullable final BatchAddressesRequest request) {
    if (request == null || request.addresses() == null || request.addresses().isEmpty()) {
      throw new InvalidRequestException("addresses must be a non-empty array");
    }

    final List<String> normalized = new ArrayList<>(request.addresses().size());

    for (final String address : request.addresses()) {
      if (!Addresses.isValid(address)) {
        throw new InvalidRequestException("Invalid address format: " + address);
      }

      normalized.add(Addresses.normalize(address));
    }

    return normalized;
  }
}
