/*
 * Copyright 2013 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.idenap2p.relay;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.idenap2p.relay.configuration.HeartbeatConfiguration;
import org.idenap2p.relay.configuration.MessageQueueConfiguration;
import org.idenap2p.websocket.configuration.WebSocketConfiguration;

/**
 * Root configuration of the relay server.
 */
public class RelayServerConfiguration extends Configuration {

  @NotNull
  @Valid
  @JsonProperty
  private MessageQueueConfiguration messageQueue = new MessageQueueConfiguration();

  @NotNull
  @Valid
  @JsonProperty
  private HeartbeatConfiguration heartbeat = new HeartbeatConfiguration();

  @NotNull
  @Valid
  @JsonProperty
  private WebSocketConfiguration webSocket = new WebSocketConfiguration();

  @NotNull
  @Pattern(regexp = "^/[^*]*$")
  @JsonProperty
  private String webSocketPath = "/ws";

  public MessageQueueConfiguration getMessageQueueConfiguration() {
    return messageQueue;
  }

  public HeartbeatConfiguration getHeartbeatConfiguration() {
    return heartbeat;
  }

  public WebSocketConfiguration getWebSocketConfiguration() {
    return webSocket;
  }

  public String getWebSocketPath() {
    return webSocketPath;
  }
}
