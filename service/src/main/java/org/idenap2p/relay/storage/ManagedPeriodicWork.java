/*
 * Copyright 2013-2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.idenap2p.relay.storage;

import static org.idenap2p.relay.metrics.MetricsUtil.name;

import io.dropwizard.lifecycle.Managed;
import io.micrometer.core.instrument.Metrics;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@link #doPeriodicWork()} on a fixed schedule between {@link #start()} and {@link #stop()}. The first run
 * happens one interval after start.
 */
public abstract class ManagedPeriodicWork implements Managed {

  private final Logger logger = LoggerFactory.getLogger(getClass());

  private static final String FUTURE_DONE_GAUGE_NAME = "futureDone";

  private final Duration runInterval;
  private final ScheduledExecutorService executorService;

  @Nullable
  private ScheduledFuture<?> scheduledFuture;
  private final AtomicReference<CompletableFuture<Void>> activeExecutionFuture =
      new AtomicReference<>(CompletableFuture.completedFuture(null));

  public ManagedPeriodicWork(final Duration runInterval, final ScheduledExecutorService scheduledExecutorService) {
    this.runInterval = runInterval;
    this.executorService = scheduledExecutorService;
  }

  abstract protected void doPeriodicWork() throws Exception;

  @Override
  public synchronized void start() throws Exception {

    if (scheduledFuture != null) {
      return;
    }

    scheduledFuture = executorService.scheduleAtFixedRate(this::execute,
        runInterval.toMillis(), runInterval.toMillis(), TimeUnit.MILLISECONDS);

    Metrics.gauge(name(getClass(), FUTURE_DONE_GAUGE_NAME), scheduledFuture, future -> future.isDone() ? 1 : 0);
  }

  @Override
  public synchronized void stop() throws Exception {

    if (scheduledFuture != null) {

      scheduledFuture.cancel(false);
      scheduledFuture = null;

      try {
        activeExecutionFuture.get().join();
      } catch (final Exception e) {
        logger.warn("error while awaiting final execution", e);
      }
    }
  }

  // Exceptions must not escape, or the executor silently stops rescheduling
  void execute() {
    activeExecutionFuture.set(new CompletableFuture<>());

    try {
      logger.debug("Starting execution");
      doPeriodicWork();
      logger.debug("Execution complete");
    } catch (final Exception e) {
      logger.warn("Periodic work failed", e);
    } finally {
      activeExecutionFuture.get().complete(null);
    }
  }
}
