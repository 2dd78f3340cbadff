/*
 * Copyright 2013-2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.idenap2p.websocket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.any;
import static org.mockito.Mockito.anyInt;
import static org.mockito.Mockito.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.eclipse.jetty.websocket.api.CloseStatus;
import org.eclipse.jetty.websocket.api.RemoteEndpoint;
import org.eclipse.jetty.websocket.api.Session;
import org.eclipse.jetty.websocket.api.UpgradeRequest;
import org.eclipse.jetty.websocket.api.exceptions.MessageTooLargeException;
import org.idenap2p.websocket.session.WebSocketSessionContext;
import org.idenap2p.websocket.setup.WebSocketConnectListener;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class WebSocketProviderTest {

  private static final Duration IDLE_TIMEOUT = Duration.ofSeconds(30);

  @Test
  void testOnConnect() {
    WebSocketConnectListener connectListener = mock(WebSocketConnectListener.class);
    WebSocketProvider provider = new WebSocketProvider("127.0.0.1", Optional.of(connectListener), IDLE_TIMEOUT);

    Session session = mock(Session.class);
    UpgradeRequest request = mock(UpgradeRequest.class);

    when(session.getUpgradeRequest()).thenReturn(request);
    when(session.getRemote()).thenReturn(mock(RemoteEndpoint.class));

    provider.onWebSocketConnect(session);

    verify(session, never()).close(anyInt(), anyString());
    verify(session, never()).close();
    verify(session, never()).close(any(CloseStatus.class));
    verify(session).setIdleTimeout(IDLE_TIMEOUT);

    ArgumentCaptor<WebSocketSessionContext> contextArgumentCaptor = ArgumentCaptor.forClass(
        WebSocketSessionContext.class);
    verify(connectListener).onWebSocketConnect(contextArgumentCaptor.capture());

    assertThat(contextArgumentCaptor.getValue().getClient().getRemoteAddress()).isEqualTo("127.0.0.1");
  }

  @Test
  void testTextFramesReachMessageListenerInOrder() {
    final List<String> received = new ArrayList<>();

    WebSocketProvider provider = new WebSocketProvider("127.0.0.1",
        Optional.of(context -> context.setWebSocketMessageListener((ignored, message) -> received.add(message))),
        IDLE_TIMEOUT);

    Session session = mock(Session.class);
    when(session.getRemote()).thenReturn(mock(RemoteEndpoint.class));

    provider.onWebSocketConnect(session);
    provider.onWebSocketText("first");
    provider.onWebSocketText("second");

    assertThat(received).containsExactly("first", "second");
  }

  @Test
  void testCloseNotifiesListeners() {
    final List<Integer> closeCodes = new ArrayList<>();

    WebSocketProvider provider = new WebSocketProvider("127.0.0.1",
        Optional.of(context -> context.addWebsocketClosedListener(
            (ignored, statusCode, reason) -> closeCodes.add(statusCode))),
        IDLE_TIMEOUT);

    Session session = mock(Session.class);
    when(session.getRemote()).thenReturn(mock(RemoteEndpoint.class));

    provider.onWebSocketConnect(session);
    provider.onWebSocketClose(1001, "Going away");

    assertThat(closeCodes).containsExactly(1001);
  }

  @Test
  void testBinaryFramesCloseSession() {
    WebSocketProvider provider = new WebSocketProvider("127.0.0.1", Optional.empty(), IDLE_TIMEOUT);

    Session session = mock(Session.class);
    when(session.getRemote()).thenReturn(mock(RemoteEndpoint.class));

    provider.onWebSocketConnect(session);
    provider.onWebSocketBinary(new byte[]{1, 2, 3}, 0, 3);

    verify(session).close(eq(1003), anyString());
  }

  @Test
  void testErrorClosesSession() {
    WebSocketProvider provider = new WebSocketProvider("127.0.0.1", Optional.empty(), IDLE_TIMEOUT);

    Session session = mock(Session.class);
    when(session.getRemote()).thenReturn(mock(RemoteEndpoint.class));

    provider.onWebSocketConnect(session);
    provider.onWebSocketError(new MessageTooLargeException("too big"));

    verify(session).close(1009, "Frame too large");

    provider.onWebSocketError(new RuntimeException("oops"));

    verify(session).close(1011, "Server error");
  }
}
