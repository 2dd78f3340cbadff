/*
 * Copyright 2013-2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.idenap2p.websocket.session;

import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nullable;
import org.idenap2p.websocket.WebSocketClient;

/**
 * Per-connection handle given to a {@link org.idenap2p.websocket.setup.WebSocketConnectListener}. Text frames arriving
 * on the socket are passed to the registered {@link WebSocketMessageListener} one at a time and in arrival order; close
 * listeners run exactly once, even if they are registered after the socket has already closed.
 */
public class WebSocketSessionContext {

  private final List<WebSocketEventListener> closeListeners = new LinkedList<>();

  private final ReentrantLock lock = new ReentrantLock();

  private final WebSocketClient webSocketClient;

  @Nullable
  private volatile WebSocketMessageListener messageListener;

  private boolean closed;

  public WebSocketSessionContext(WebSocketClient webSocketClient) {
    this.webSocketClient = webSocketClient;
  }

  public WebSocketClient getClient() {
    return webSocketClient;
  }

  public void setWebSocketMessageListener(WebSocketMessageListener listener) {
    this.messageListener = listener;
  }

  public void addWebsocketClosedListener(WebSocketEventListener listener) {
    lock.lock();
    try {
      if (!closed)
        this.closeListeners.add(listener);
      else
        listener.onWebSocketClose(this, 1000, "Closed");
    } finally {
      lock.unlock();
    }
  }

  public void notifyMessage(String message) {
    final WebSocketMessageListener listener = messageListener;

    if (listener != null) {
      listener.onWebSocketText(this, message);
    }
  }

  public void notifyClosed(int statusCode, String reason) {
    lock.lock();
    try {
      if (closed) {
        return;
      }

      for (WebSocketEventListener listener : closeListeners) {
        listener.onWebSocketClose(this, statusCode, reason);
      }

      closed = true;
    } finally {
      lock.unlock();
    }
  }

  public interface WebSocketEventListener {
    public void onWebSocketClose(WebSocketSessionContext context, int statusCode, String reason);
  }

  public interface WebSocketMessageListener {
    public void onWebSocketText(WebSocketSessionContext context, String message);
  }
}
