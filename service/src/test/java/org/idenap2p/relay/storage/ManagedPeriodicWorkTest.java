/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.idenap2p.relay.util.TestClock;
import org.junit.jupiter.api.Test;

class ManagedPeriodicWorkTest {

  private static final String RECIPIENT = "0x1111111111111111111111111111111111111111";

  @Test
  void startSchedulesAtInterval() throws Exception {
    final ScheduledExecutorService executor = mock(ScheduledExecutorService.class);
    final ScheduledFuture<?> future = mock(ScheduledFuture.class);
    doReturn(future).when(executor).scheduleAtFixedRate(any(), anyLong(), anyLong(), any());

    final MessageQueueCleaner cleaner =
        new MessageQueueCleaner(mock(MessageQueue.class), Duration.ofMinutes(10), executor);

    cleaner.start();
    cleaner.start();

    verify(executor, times(1)).scheduleAtFixedRate(any(), eq(600_000L), eq(600_000L), eq(TimeUnit.MILLISECONDS));

    cleaner.stop();
    verify(future).cancel(false);
  }

  @Test
  void cleanerRemovesExpiredMessages() {
    final TestClock clock = TestClock.pinned(Instant.ofEpochMilli(1_700_000_000_000L));
    final MessageQueue messageQueue = new MessageQueue(10, Duration.ofHours(1), clock);

    messageQueue.enqueue(RECIPIENT,
        new QueuedMessage("m1", RECIPIENT, RECIPIENT, "content", clock.millis(), clock.millis()));

    final MessageQueueCleaner cleaner =
        new MessageQueueCleaner(messageQueue, Duration.ofMinutes(10), mock(ScheduledExecutorService.class));

    clock.advance(Duration.ofHours(2));
    cleaner.execute();

    assertThat(messageQueue.getQueueSize(RECIPIENT)).isZero();
  }

  @Test
  void failedWorkDoesNotEscape() {
    final MessageQueue messageQueue = mock(MessageQueue.class);
    when(messageQueue.cleanup()).thenThrow(new RuntimeException("OH NO"));

    final MessageQueueCleaner cleaner =
        new MessageQueueCleaner(messageQueue, Duration.ofMinutes(10), mock(ScheduledExecutorService.class));

    cleaner.execute();

    verify(messageQueue).cleanup();
  }
}
