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
import java.util.stream.IntStream;
import org.idenap2p.relay.util.TestClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class MessageQueueTest {

  private static final String SENDER = "0x1111111111111111111111111111111111111111";
  private static final String RECIPIENT = "0xabcdef2222222222222222222222222222222222";
  private static final String OTHER_RECIPIENT = "0x3333333333333333333333333333333333333333";

  private static final int CAPACITY = 5;
  private static final Duration RETENTION = Duration.ofHours(168);

  private TestClock clock;
  private MessageQueue messageQueue;

  @BeforeEach
  void setUp() {
    clock = TestClock.pinned(Instant.ofEpochMilli(1_700_000_000_000L));
    messageQueue = new MessageQueue(CAPACITY, RETENTION, clock);
  }

  private QueuedMessage message(final String recipient, final int i) {
    return new QueuedMessage("m" + i, SENDER, recipient, "content-" + i, 1000L + i, clock.millis());
  }

  private static List<String> ids(final List<QueuedMessage> messages) {
    return messages.stream().map(QueuedMessage::messageId).toList();
  }

  @ParameterizedTest
  @ValueSource(ints = {0, 1, 3, CAPACITY})
  void enqueueUpToCapacity(final int count) {
    IntStream.range(0, count).forEach(i -> messageQueue.enqueue(RECIPIENT, message(RECIPIENT, i)));

    assertThat(messageQueue.getQueueSize(RECIPIENT)).isEqualTo(count);
    assertThat(ids(messageQueue.dequeue(RECIPIENT)))
        .containsExactlyElementsOf(IntStream.range(0, count).mapToObj(i -> "m" + i).toList());
  }

  @Test
  void enqueueBeyondCapacityEvictsOldest() {
    IntStream.range(0, CAPACITY + 3).forEach(i -> messageQueue.enqueue(RECIPIENT, message(RECIPIENT, i)));

    assertThat(messageQueue.getQueueSize(RECIPIENT)).isEqualTo(CAPACITY);
    assertThat(ids(messageQueue.dequeue(RECIPIENT))).containsExactly("m3", "m4", "m5", "m6", "m7");
  }

  @Test
  void addressesAreNormalized() {
    messageQueue.enqueue(RECIPIENT.toUpperCase().replace("0X", "0x"), message(RECIPIENT, 0));

    assertThat(messageQueue.getQueueSize(RECIPIENT)).isEqualTo(1);
    assertThat(messageQueue.dequeue(RECIPIENT)).hasSize(1);
  }

  @Test
  void dequeueIsDestructive() {
    messageQueue.enqueue(RECIPIENT, message(RECIPIENT, 0));
    messageQueue.enqueue(RECIPIENT, message(RECIPIENT, 1));

    assertThat(messageQueue.dequeue(RECIPIENT)).hasSize(2);
    assertThat(messageQueue.dequeue(RECIPIENT)).isEmpty();
    assertThat(messageQueue.getQueueSize(RECIPIENT)).isZero();
    assertThat(messageQueue.getStats().totalUsers()).isZero();
  }

  @Test
  void peekDoesNotRemove() {
    IntStream.range(0, 4).forEach(i -> messageQueue.enqueue(RECIPIENT, message(RECIPIENT, i)));

    assertThat(ids(messageQueue.peek(RECIPIENT, 2))).containsExactly("m0", "m1");
    assertThat(ids(messageQueue.peek(RECIPIENT, 10))).containsExactly("m0", "m1", "m2", "m3");
    assertThat(messageQueue.peek(RECIPIENT, 0)).isEmpty();
    assertThat(messageQueue.peek(OTHER_RECIPIENT, 10)).isEmpty();
    assertThat(messageQueue.getQueueSize(RECIPIENT)).isEqualTo(4);
  }

  @Test
  void clear() {
    messageQueue.enqueue(RECIPIENT, message(RECIPIENT, 0));

    assertThat(messageQueue.clear(RECIPIENT)).isTrue();
    assertThat(messageQueue.clear(RECIPIENT)).isFalse();
    assertThat(messageQueue.getQueueSize(RECIPIENT)).isZero();
  }

  @Test
  void stats() {
    messageQueue.enqueue(RECIPIENT, message(RECIPIENT, 0));
    messageQueue.enqueue(RECIPIENT, message(RECIPIENT, 1));
    messageQueue.enqueue(OTHER_RECIPIENT, message(OTHER_RECIPIENT, 2));

    assertThat(messageQueue.getTotalQueueSize()).isEqualTo(3);
    assertThat(messageQueue.getStats()).isEqualTo(new MessageQueueStats(2, 3, CAPACITY, 168));
  }

  @Test
  void cleanupRemovesOnlyExpiredMessages() {
    messageQueue.enqueue(RECIPIENT, message(RECIPIENT, 0));
    messageQueue.enqueue(OTHER_RECIPIENT, message(OTHER_RECIPIENT, 1));

    clock.advance(Duration.ofHours(100));
    messageQueue.enqueue(RECIPIENT, message(RECIPIENT, 2));

    clock.advance(Duration.ofHours(67));
    assertThat(messageQueue.cleanup()).isZero();

    // The first two messages are now exactly at the retention boundary
    clock.advance(Duration.ofHours(1));
    assertThat(messageQueue.cleanup()).isEqualTo(2);

    assertThat(ids(messageQueue.peek(RECIPIENT, 10))).containsExactly("m2");
    assertThat(messageQueue.getQueueSize(OTHER_RECIPIENT)).isZero();
    assertThat(messageQueue.getStats().totalUsers()).isEqualTo(1);
  }

  @Test
  void rejectsNonPositiveCapacity() {
    assertThatThrownBy(() -> new MessageQueue(0, RETENTION, clock))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
