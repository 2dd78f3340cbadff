/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.websocket;

import java.time.Clock;
import org.idenap2p.relay.storage.MessageQueue;
import org.idenap2p.websocket.session.WebSocketSessionContext;
import org.idenap2p.websocket.setup.WebSocketConnectListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Attaches a {@link RelayConnection} to every newly opened socket.
 */
public class RelayConnectListener implements WebSocketConnectListener {

  private static final Logger logger = LoggerFactory.getLogger(RelayConnectListener.class);

  private final ConnectionRegistry connectionRegistry;
  private final MessageQueue messageQueue;
  private final RelayFrameCodec codec;
  private final Clock clock;

  public RelayConnectListener(final ConnectionRegistry connectionRegistry,
      final MessageQueue messageQueue,
      final RelayFrameCodec codec,
      final Clock clock) {

    this.connectionRegistry = connectionRegistry;
    this.messageQueue = messageQueue;
    this.codec = codec;
    this.clock = clock;
  }

  @Override
  public void onWebSocketConnect(final WebSocketSessionContext context) {
    final RelayConnection connection =
        new RelayConnection(context.getClient(), connectionRegistry, messageQueue, codec, clock);

    context.setWebSocketMessageListener((ignored, message) -> connection.onText(message));
    context.addWebsocketClosedListener((ignored, statusCode, reason) -> connection.onClosed(statusCode, reason));

    logger.info("New connection from {}", context.getClient().getRemoteAddress());
  }
}
