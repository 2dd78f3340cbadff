/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.idenap2p.relay.util.TestClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;

class PublicKeyDirectoryTest {

  private static final String ADDRESS = "0xabcdefabcdef0123456789abcdefabcdef012345";
  private static final String OTHER_ADDRESS = "0x1111111111111111111111111111111111111111";

  private TestClock clock;
  private PublicKeyDirectory publicKeyDirectory;

  @BeforeEach
  void setUp() {
    clock = TestClock.pinned(Instant.ofEpochMilli(1_700_000_000_000L));
    publicKeyDirectory = new PublicKeyDirectory(clock);
  }

  @Test
  void storeAndGet() {
    final PublicKeyRecord stored = publicKeyDirectory.store(ADDRESS.toUpperCase().replace("0X", "0x"), "key-1");

    assertThat(stored).isEqualTo(new PublicKeyRecord(ADDRESS, "key-1", clock.millis(), clock.millis()));
    assertThat(publicKeyDirectory.get(ADDRESS)).contains(stored);
    assertThat(publicKeyDirectory.exists(ADDRESS)).isTrue();
    assertThat(publicKeyDirectory.get(OTHER_ADDRESS)).isEmpty();
  }

  @Test
  void updatePreservesCreatedAt() {
    final long createdAt = publicKeyDirectory.store(ADDRESS, "key-1").createdAt();

    clock.advance(Duration.ofMinutes(5));
    final PublicKeyRecord updated = publicKeyDirectory.store(ADDRESS, "key-2");

    assertThat(updated.publicKey()).isEqualTo("key-2");
    assertThat(updated.createdAt()).isEqualTo(createdAt);
    assertThat(updated.updatedAt()).isEqualTo(createdAt + Duration.ofMinutes(5).toMillis());
    assertThat(publicKeyDirectory.getCount()).isEqualTo(1);
  }

  @ParameterizedTest
  @NullAndEmptySource
  void storeRejectsEmptyKey(final String publicKey) {
    assertThatThrownBy(() -> publicKeyDirectory.store(ADDRESS, publicKey))
        .isInstanceOf(IllegalArgumentException.class);

    assertThat(publicKeyDirectory.exists(ADDRESS)).isFalse();
  }

  @Test
  void getMultipleOmitsMissing() {
    publicKeyDirectory.store(ADDRESS, "key-1");

    assertThat(publicKeyDirectory.getMultiple(List.of(ADDRESS, OTHER_ADDRESS)))
        .containsOnlyKeys(ADDRESS);
  }

  @Test
  void delete() {
    publicKeyDirectory.store(ADDRESS, "key-1");

    assertThat(publicKeyDirectory.delete(ADDRESS)).isTrue();
    assertThat(publicKeyDirectory.delete(ADDRESS)).isFalse();
    assertThat(publicKeyDirectory.exists(ADDRESS)).isFalse();
  }

  @Test
  void stats() {
    publicKeyDirectory.store(ADDRESS, "key-1");
    publicKeyDirectory.store(OTHER_ADDRESS, "key-2");

    final PublicKeyDirectoryStats stats = publicKeyDirectory.getStats();
    assertThat(stats.totalKeys()).isEqualTo(2);
    assertThat(stats.addresses()).containsExactlyInAnyOrder(ADDRESS, OTHER_ADDRESS);
  }
}
