/*
 * Copyright 2013-2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.idenap2p.websocket;

import java.time.Duration;
import java.util.Optional;
import org.eclipse.jetty.websocket.api.Session;
import org.eclipse.jetty.websocket.api.WebSocketListener;
import org.eclipse.jetty.websocket.api.exceptions.MessageTooLargeException;
import org.idenap2p.websocket.session.WebSocketSessionContext;
import org.idenap2p.websocket.setup.WebSocketConnectListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public class WebSocketProvider implements WebSocketListener {

  private static final Logger logger = LoggerFactory.getLogger(WebSocketProvider.class);

  private final String remoteAddress;
  private final Optional<WebSocketConnectListener> connectListener;
  private final Duration idleTimeout;

  private Session session;
  private WebSocketSessionContext context;

  public WebSocketProvider(String remoteAddress,
      Optional<WebSocketConnectListener> connectListener,
      Duration idleTimeout) {
    this.remoteAddress = remoteAddress;
    this.connectListener = connectListener;
    this.idleTimeout = idleTimeout;
  }

  @Override
  public void onWebSocketConnect(Session session) {
    this.session = session;
    this.context = new WebSocketSessionContext(new WebSocketClient(session, session.getRemote(), remoteAddress));
    this.session.setIdleTimeout(idleTimeout);

    logger.debug("New WebSocket connection from {}", remoteAddress);

    connectListener.ifPresent(listener -> listener.onWebSocketConnect(this.context));
  }

  @Override
  public void onWebSocketError(Throwable cause) {
    logger.debug("onWebSocketError", cause);

    final int closeCode;
    final String message;
    if (cause instanceof MessageTooLargeException) {
      closeCode = 1009;
      message = "Frame too large";
    } else {
      closeCode = 1011;
      message = "Server error";
    }

    if (session != null) {
      close(session, closeCode, message);
    }
  }

  @Override
  public void onWebSocketText(String message) {
    if (context != null) {
      context.notifyMessage(message);
    }
  }

  @Override
  public void onWebSocketBinary(byte[] payload, int offset, int length) {
    close(session, 1003, "Binary frames not supported");
  }

  @Override
  public void onWebSocketClose(int statusCode, String reason) {
    if (context != null) {
      context.notifyClosed(statusCode, reason);
    }
  }

  private void close(Session session, int status, String message) {
    session.close(status, message);
  }
}
