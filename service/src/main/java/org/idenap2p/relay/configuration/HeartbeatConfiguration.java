/*
 * Copyright 2013-2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.util.Duration;
import io.dropwizard.validation.MinDuration;
import jakarta.validation.constraints.NotNull;
import java.util.concurrent.TimeUnit;

public class HeartbeatConfiguration {

  /**
   * How often registered connections are checked for staleness.
   */
  @JsonProperty
  @NotNull
  @MinDuration(value = 1, unit = TimeUnit.SECONDS)
  private Duration interval = Duration.seconds(30);

  /**
   * A connection with no inbound frame for longer than this is closed and unregistered.
   */
  @JsonProperty
  @NotNull
  @MinDuration(value = 1, unit = TimeUnit.SECONDS)
  private Duration timeout = Duration.seconds(60);

  public Duration getInterval() {
    return interval;
  }

  public Duration getTimeout() {
    return timeout;
  }
}
