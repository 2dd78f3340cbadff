/*
 * Copyright 2013-2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.idenap2p.websocket.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.util.Duration;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public class WebSocketConfiguration {

  @Min(16 * 1024)        // 16 KB
  @Max(10 * 1024 * 1024) // 10 MB
  @JsonProperty
  private int maxTextMessageSize = 1024 * 1024;

  /**
   * Jetty closes a session after this much silence; it should be longer than the relay's own heartbeat timeout so that
   * the heartbeat sweep is what evicts idle clients.
   */
  @NotNull
  @JsonProperty
  private Duration idleTimeout = Duration.minutes(2);

  public int getMaxTextMessageSize() {
    return maxTextMessageSize;
  }

  public Duration getIdleTimeout() {
    return idleTimeout;
  }
}
