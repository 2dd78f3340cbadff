/*
 * Copyright 2013 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.storage;

import static org.idenap2p.relay.metrics.MetricsUtil.name;

import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Tags;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.commons.lang3.StringUtils;
import org.idenap2p.relay.util.Addresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory directory of public keys published by addresses, used by clients to discover each other's keys.
 */
public class PublicKeyDirectory {

  private static final Logger logger = LoggerFactory.getLogger(PublicKeyDirectory.class);

  private final Map<String, PublicKeyRecord> records = new ConcurrentHashMap<>();

  private final Clock clock;

  public PublicKeyDirectory(final Clock clock) {
    this.clock = clock;

    Metrics.gaugeMapSize(name(PublicKeyDirectory.class, "keys"), Tags.empty(), records);
  }

  /**
   * Stores or replaces the public key for an address. The original creation time survives replacement.
   *
   * @throws IllegalArgumentException if the key is null or empty
   */
  public PublicKeyRecord store(final String address, final String publicKey) {
    if (StringUtils.isEmpty(publicKey)) {
      throw new IllegalArgumentException("Invalid public key");
    }

    final String normalizedAddress = Addresses.normalize(address);
    final long now = clock.millis();

    final PublicKeyRecord stored = records.compute(normalizedAddress, (ignored, existing) ->
        new PublicKeyRecord(normalizedAddress, publicKey, existing != null ? existing.createdAt() : now, now));

    logger.debug("Stored public key for {}", normalizedAddress);
    return stored;
  }

  public Optional<PublicKeyRecord> get(final String address) {
    return Optional.ofNullable(records.get(Addresses.normalize(address)));
  }

  /**
   * Looks up several addresses at once. Addresses without a key are left out of the result.
   */
  public Map<String, PublicKeyRecord> getMultiple(final Collection<String> addresses) {
    final Map<String, PublicKeyRecord> found = new LinkedHashMap<>();

    for (final String address : addresses) {
      get(address).ifPresent(publicKeyRecord -> found.put(publicKeyRecord.address(), publicKeyRecord));
    }

    return found;
  }

  public boolean exists(final String address) {
    return records.containsKey(Addresses.normalize(address));
  }

  public boolean delete(final String address) {
    final boolean deleted = records.remove(Addresses.normalize(address)) != null;

    if (deleted) {
      logger.info("Deleted public key for {}", Addresses.normalize(address));
    }

    return deleted;
  }

  public int getCount() {
    return records.size();
  }

  public PublicKeyDirectoryStats getStats() {
    return new PublicKeyDirectoryStats(records.size(), new ArrayList<>(records.keySet()));
  }
}
