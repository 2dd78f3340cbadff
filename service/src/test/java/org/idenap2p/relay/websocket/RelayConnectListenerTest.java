/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.websocket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import org.idenap2p.relay.storage.MessageQueue;
import org.idenap2p.relay.util.SystemMapper;
import org.idenap2p.relay.util.TestClock;
import org.idenap2p.websocket.WebSocketClient;
import org.idenap2p.websocket.session.WebSocketSessionContext;
import org.junit.jupiter.api.Test;

class RelayConnectListenerTest {

  private static final String ADDRESS = "0xabcdefabcdef0123456789abcdefabcdef012345";

  @Test
  void connectionFollowsSessionLifecycle() {
    final TestClock clock = TestClock.pinned(Instant.ofEpochMilli(1_700_000_000_000L));
    final ConnectionRegistry connectionRegistry = new ConnectionRegistry();
    final MessageQueue messageQueue = new MessageQueue(1000, Duration.ofHours(168), clock);

    final RelayConnectListener listener = new RelayConnectListener(connectionRegistry, messageQueue,
        new RelayFrameCodec(SystemMapper.jsonMapper()), clock);

    final WebSocketClient client = mock(WebSocketClient.class);
    when(client.isOpen()).thenReturn(true);
    when(client.sendText(anyString())).thenReturn(CompletableFuture.completedFuture(null));

    final WebSocketSessionContext context = new WebSocketSessionContext(client);
    listener.onWebSocketConnect(context);

    context.notifyMessage("{\"type\":\"auth\",\"address\":\"" + ADDRESS + "\"}");
    assertThat(connectionRegistry.isOnline(ADDRESS)).isTrue();

    context.notifyClosed(1000, "Closed");
    assertThat(connectionRegistry.isOnline(ADDRESS)).isFalse();
    assertThat(connectionRegistry.getConnectionCount()).isZero();
  }
}
