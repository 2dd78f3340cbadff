/*
 * Copyright 2013-2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.util.Duration;
import io.dropwizard.validation.MinDuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.util.concurrent.TimeUnit;

public class MessageQueueConfiguration {

  @JsonProperty
  @Min(1)
  private int maxMessagesPerAddress = 1000;

  @JsonProperty
  @NotNull
  @MinDuration(value = 1, unit = TimeUnit.SECONDS)
  private Duration retention = Duration.hours(168);

  @JsonProperty
  @NotNull
  @MinDuration(value = 1, unit = TimeUnit.SECONDS)
  private Duration cleanupInterval = Duration.hours(1);

  public MessageQueueConfiguration() {
  }

  public MessageQueueConfiguration(int maxMessagesPerAddress, Duration retention, Duration cleanupInterval) {
    this.maxMessagesPerAddress = maxMessagesPerAddress;
    this.retention = retention;
    this.cleanupInterval = cleanupInterval;
  }

  public int getMaxMessagesPerAddress() {
    return maxMessagesPerAddress;
  }

  public Duration getRetention() {
    return retention;
  }

  public Duration getCleanupInterval() {
    return cleanupInterval;
  }
}
