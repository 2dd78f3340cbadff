/*
 * Copyright 2013 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.storage;

import static org.idenap2p.relay.metrics.MetricsUtil.name;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.idenap2p.relay.util.Addresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory store of messages waiting for offline recipients. Each address has its own FIFO sequence, bounded in
 * length; when a sequence is full the oldest entry is evicted to make room. Entries older than the retention window are
 * removed by {@link #cleanup()}.
 * <p>
 * All per-address mutations go through a single atomic {@link ConcurrentHashMap} operation, so concurrent enqueues
 * and dequeues for the same address never interleave.
 */
public class MessageQueue {

  private static final Logger logger = LoggerFactory.getLogger(MessageQueue.class);

  private static final Counter ENQUEUED_COUNTER = Metrics.counter(name(MessageQueue.class, "enqueued"));
  private static final Counter EVICTED_COUNTER = Metrics.counter(name(MessageQueue.class, "evicted"));
  private static final Counter EXPIRED_COUNTER = Metrics.counter(name(MessageQueue.class, "expired"));

  private final Map<String, Deque<QueuedMessage>> queues = new ConcurrentHashMap<>();

  private final int maxMessagesPerAddress;
  private final Duration retention;
  private final Clock clock;

  public MessageQueue(final int maxMessagesPerAddress, final Duration retention, final Clock clock) {
    if (maxMessagesPerAddress < 1) {
      throw new IllegalArgumentException("Queue capacity must be positive");
    }

    this.maxMessagesPerAddress = maxMessagesPerAddress;
    this.retention = retention;
    this.clock = clock;

    Metrics.gauge(name(MessageQueue.class, "size"), this, MessageQueue::getTotalQueueSize);
  }

  public void enqueue(final String address, final QueuedMessage message) {
    final String normalizedAddress = Addresses.normalize(address);

    queues.compute(normalizedAddress, (ignored, existing) -> {
      final Deque<QueuedMessage> q = existing != null ? existing : new ArrayDeque<>();

      if (q.size() >= maxMessagesPerAddress) {
        final QueuedMessage evicted = q.pollFirst();
        EVICTED_COUNTER.increment();

        logger.warn("Queue full for {} ({} messages); evicted oldest message {}", normalizedAddress, q.size() + 1,
            evicted != null ? evicted.messageId() : null);
      }

      q.addLast(message);
      return q;
    });

    ENQUEUED_COUNTER.increment();
    logger.debug("Queued message {} for {}", message.messageId(), normalizedAddress);
  }

  /**
   * Removes and returns every message queued for the given address, oldest first. Messages are gone from the queue
   * once this returns, whether or not the caller manages to deliver them.
   */
  public List<QueuedMessage> dequeue(final String address) {
    final String normalizedAddress = Addresses.normalize(address);
    final Deque<QueuedMessage> queue = queues.remove(normalizedAddress);

    if (queue == null) {
      return Collections.emptyList();
    }

    logger.debug("Dequeued {} messages for {}", queue.size(), normalizedAddress);
    return new ArrayList<>(queue);
  }

  /**
   * Returns up to {@code limit} of the oldest messages for the given address without removing them.
   */
  public List<QueuedMessage> peek(final String address, final int limit) {
    final List<QueuedMessage> messages = new ArrayList<>();

    queues.computeIfPresent(Addresses.normalize(address), (ignored, queue) -> {
      final Iterator<QueuedMessage> iterator = queue.iterator();

      while (iterator.hasNext() && messages.size() < limit) {
        messages.add(iterator.next());
      }

      return queue;
    });

    return messages;
  }

  public int getQueueSize(final String address) {
    final AtomicInteger size = new AtomicInteger();

    queues.computeIfPresent(Addresses.normalize(address), (ignored, queue) -> {
      size.set(queue.size());
      return queue;
    });

    return size.get();
  }

  /**
   * Drops every message queued for the given address.
   *
   * @return {@code true} if the address had a queue
   */
  public boolean clear(final String address) {
    final boolean cleared = queues.remove(Addresses.normalize(address)) != null;

    if (cleared) {
      logger.info("Cleared queue for {}", address);
    }

    return cleared;
  }

  public long getTotalQueueSize() {
    long total = 0;

    for (final String address : queues.keySet()) {
      total += getQueueSize(address);
    }

    return total;
  }

  public MessageQueueStats getStats() {
    return new MessageQueueStats(queues.size(), getTotalQueueSize(), maxMessagesPerAddress, retention.toHours());
  }

  /**
   * Removes every message whose age has reached the retention window, and drops queues left empty.
   *
   * @return the number of messages removed
   */
  public int cleanup() {
    final long cutoff = clock.millis() - retention.toMillis();
    final AtomicInteger removed = new AtomicInteger();

    for (final String address : queues.keySet()) {
      queues.computeIfPresent(address, (ignored, queue) -> {
        final int before = queue.size();
        queue.removeIf(message -> message.queuedAt() <= cutoff);
        removed.addAndGet(before - queue.size());

        return queue.isEmpty() ? null : queue;
      });
    }

    if (removed.get() > 0) {
      EXPIRED_COUNTER.increment(removed.get());
      logger.debug("Removed {} expired messages", removed.get());
    }

    return removed.get();
  }
}
