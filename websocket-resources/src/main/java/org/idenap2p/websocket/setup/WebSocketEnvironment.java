/*
 * Copyright 2013-2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.idenap2p.websocket.setup;

import java.time.Duration;
import javax.annotation.Nullable;
import org.idenap2p.websocket.configuration.WebSocketConfiguration;

public class WebSocketEnvironment {

  private final Duration idleTimeout;

  private WebSocketConnectListener connectListener;

  public WebSocketEnvironment(WebSocketConfiguration configuration) {
    this(configuration.getIdleTimeout().toJavaDuration());
  }

  public WebSocketEnvironment(Duration idleTimeout) {
    this.idleTimeout = idleTimeout;
  }

  public Duration getIdleTimeout() {
    return idleTimeout;
  }

  @Nullable
  public WebSocketConnectListener getConnectListener() {
    return connectListener;
  }

  public void setConnectListener(WebSocketConnectListener connectListener) {
    this.connectListener = connectListener;
  }
}
