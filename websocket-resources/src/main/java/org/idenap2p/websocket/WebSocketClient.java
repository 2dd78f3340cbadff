/*
 * Copyright 2013-2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.idenap2p.websocket;

import java.util.concurrent.CompletableFuture;
import org.eclipse.jetty.websocket.api.RemoteEndpoint;
import org.eclipse.jetty.websocket.api.Session;
import org.eclipse.jetty.websocket.api.WriteCallback;
import org.eclipse.jetty.websocket.api.exceptions.WebSocketException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class WebSocketClient {

  private static final Logger logger = LoggerFactory.getLogger(WebSocketClient.class);

  private final Session session;
  private final RemoteEndpoint remoteEndpoint;
  private final String remoteAddress;

  public WebSocketClient(Session session, RemoteEndpoint remoteEndpoint, String remoteAddress) {
    this.session = session;
    this.remoteEndpoint = remoteEndpoint;
    this.remoteAddress = remoteAddress;
  }

  /**
   * Sends a single text frame. The returned future completes once Jetty has written the frame, or exceptionally if the
   * write fails or the session is already closed.
   */
  public CompletableFuture<Void> sendText(final String text) {
    final CompletableFuture<Void> future = new CompletableFuture<>();

    try {
      remoteEndpoint.sendString(text, new WriteCallback() {
        @Override
        public void writeFailed(Throwable x) {
          logger.debug("Write failed", x);
          future.completeExceptionally(x);
        }

        @Override
        public void writeSuccess() {
          future.complete(null);
        }
      });
    } catch (WebSocketException e) {
      logger.debug("Write", e);
      future.completeExceptionally(e);
    }

    return future;
  }

  public String getRemoteAddress() {
    return remoteAddress;
  }

  public boolean isOpen() {
    return session.isOpen();
  }

  public void close(final int code, final String message) {
    session.close(code, message, new WriteCallback() {
      @Override
      public void writeFailed(final Throwable throwable) {
        try {
          session.disconnect();
        } catch (final Exception e) {
          logger.warn("Failed to disconnect session", e);
        }
      }
    });
  }
}
