/*
 * Copyright 2013 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.idenap2p.websocket;

import static java.util.Optional.ofNullable;

import org.eclipse.jetty.websocket.server.JettyServerUpgradeRequest;
import org.eclipse.jetty.websocket.server.JettyServerUpgradeResponse;
import org.eclipse.jetty.websocket.server.JettyWebSocketCreator;
import org.eclipse.jetty.websocket.server.JettyWebSocketServlet;
import org.eclipse.jetty.websocket.server.JettyWebSocketServletFactory;
import org.idenap2p.websocket.configuration.WebSocketConfiguration;
import org.idenap2p.websocket.setup.WebSocketEnvironment;

public class WebSocketProviderFactory extends JettyWebSocketServlet implements JettyWebSocketCreator {

  private final WebSocketEnvironment environment;
  private final WebSocketConfiguration configuration;

  public WebSocketProviderFactory(WebSocketEnvironment environment, WebSocketConfiguration configuration) {
    this.environment = environment;
    this.configuration = configuration;
  }

  @Override
  public Object createWebSocket(final JettyServerUpgradeRequest request, final JettyServerUpgradeResponse response) {
    return new WebSocketProvider(getRemoteAddress(request),
        ofNullable(this.environment.getConnectListener()),
        this.environment.getIdleTimeout());
  }

  @Override
  public void configure(JettyWebSocketServletFactory factory) {
    factory.setCreator(this);
    factory.setMaxTextMessageSize(configuration.getMaxTextMessageSize());
    factory.setIdleTimeout(environment.getIdleTimeout());
  }

  private String getRemoteAddress(JettyServerUpgradeRequest request) {
    return request.getHttpServletRequest().getRemoteAddr();
  }
}
