/*
 * Copyright 2013 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.storage;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically purges expired messages from a {@link MessageQueue}.
 */
public class MessageQueueCleaner extends ManagedPeriodicWork {

  private static final Logger logger = LoggerFactory.getLogger(MessageQueueCleaner.class);

  private final MessageQueue messageQueue;

  public MessageQueueCleaner(final MessageQueue messageQueue, final Duration cleanupInterval,
      final ScheduledExecutorService scheduledExecutorService) {

    super(cleanupInterval, scheduledExecutorService);
    this.messageQueue = messageQueue;
  }

  @Override
  protected void doPeriodicWork() {
    final int removed = messageQueue.cleanup();

    if (removed > 0) {
      logger.info("Message queue cleanup removed {} messages; {} remain", removed, messageQueue.getTotalQueueSize());
    }
  }
}
