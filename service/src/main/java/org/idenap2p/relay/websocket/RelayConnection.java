/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.websocket;

import static org.idenap2p.relay.metrics.MetricsUtil.name;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import javax.annotation.Nullable;
import org.apache.commons.lang3.StringUtils;
import org.idenap2p.relay.entities.AuthFrame;
import org.idenap2p.relay.entities.AuthSuccessFrame;
import org.idenap2p.relay.entities.ErrorFrame;
import org.idenap2p.relay.entities.InboundFrame;
import org.idenap2p.relay.entities.MessageAckFrame;
import org.idenap2p.relay.entities.MessageFrame;
import org.idenap2p.relay.entities.OutboundFrame;
import org.idenap2p.relay.entities.PingFrame;
import org.idenap2p.relay.entities.PongFrame;
import org.idenap2p.relay.entities.ReadFrame;
import org.idenap2p.relay.entities.ReadReceiptFrame;
import org.idenap2p.relay.entities.SendMessageFrame;
import org.idenap2p.relay.entities.TypingFrame;
import org.idenap2p.relay.entities.TypingNotificationFrame;
import org.idenap2p.relay.entities.UnknownFrame;
import org.idenap2p.relay.storage.MessageQueue;
import org.idenap2p.relay.storage.QueuedMessage;
import org.idenap2p.relay.util.Addresses;
import org.idenap2p.websocket.WebSocketClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Protocol state for a single relay socket. The transport feeds it text frames one at a time, in arrival order; the
 * first frame must authenticate the socket as an address, after which the socket can send messages, typing
 * indicators and read receipts to other addresses.
 * <p>
 * Messages for a recipient without an open connection are put in the {@link MessageQueue} and pushed to the recipient
 * when it next authenticates.
 */
public class RelayConnection {

  private static final Logger logger = LoggerFactory.getLogger(RelayConnection.class);

  private static final Counter DELIVERED_COUNTER = Metrics.counter(name(RelayConnection.class, "delivered"));
  private static final Counter QUEUED_COUNTER = Metrics.counter(name(RelayConnection.class, "queued"));
  private static final Counter DRAINED_COUNTER = Metrics.counter(name(RelayConnection.class, "drained"));
  private static final Counter REJECTED_COUNTER = Metrics.counter(name(RelayConnection.class, "rejected"));

  public static final int AUTHENTICATION_REQUIRED_CLOSE_CODE = 1008;

  private final WebSocketClient client;
  private final ConnectionRegistry connectionRegistry;
  private final MessageQueue messageQueue;
  private final RelayFrameCodec codec;
  private final Clock clock;

  private final Map<ConnectionState, Consumer<String>> textHandlers = new EnumMap<>(ConnectionState.class);

  private volatile ConnectionState state = ConnectionState.UNAUTHENTICATED;

  @Nullable
  private volatile String address;

  private volatile long lastActivity;

  public RelayConnection(final WebSocketClient client,
      final ConnectionRegistry connectionRegistry,
      final MessageQueue messageQueue,
      final RelayFrameCodec codec,
      final Clock clock) {

    this.client = client;
    this.connectionRegistry = connectionRegistry;
    this.messageQueue = messageQueue;
    this.codec = codec;
    this.clock = clock;
    this.lastActivity = clock.millis();

    textHandlers.put(ConnectionState.UNAUTHENTICATED, this::handleUnauthenticatedText);
    textHandlers.put(ConnectionState.AUTHENTICATED, this::handleAuthenticatedText);
    textHandlers.put(ConnectionState.CLOSED,
        text -> logger.debug("Ignoring frame received after close from {}", client.getRemoteAddress()));
  }

  public void onText(final String text) {
    textHandlers.get(state).accept(text);
  }

  /**
   * Marks this connection closed and, if it authenticated, removes it from the registry unless it has already been
   * replaced by a newer connection for the same address.
   */
  public void onClosed(final int statusCode, @Nullable final String reason) {
    state = ConnectionState.CLOSED;

    final String closedAddress = address;

    if (closedAddress != null) {
      connectionRegistry.unregister(closedAddress, this);
    }

    logger.debug("Connection for {} closed: {} {}", closedAddress, statusCode, reason);
  }

  private void handleUnauthenticatedText(final String text) {
    final InboundFrame frame;

    try {
      frame = codec.decode(text);
    } catch (final InvalidFrameException e) {
      logger.debug("Undecodable frame before authentication from {}", client.getRemoteAddress(), e);
      rejectUnauthenticated();
      return;
    }

    if (frame instanceof AuthFrame authFrame && StringUtils.isNotBlank(authFrame.address())) {
      authenticate(authFrame.address());
    } else {
      rejectUnauthenticated();
    }
  }

  private void rejectUnauthenticated() {
    REJECTED_COUNTER.increment();
    state = ConnectionState.CLOSED;

    send(new ErrorFrame(ErrorFrame.AUTHENTICATION_REQUIRED))
        .whenComplete((ignored, throwable) ->
            client.close(AUTHENTICATION_REQUIRED_CLOSE_CODE, ErrorFrame.AUTHENTICATION_REQUIRED));
  }

  private void authenticate(final String claimedAddress) {
    final String authenticatedAddress = Addresses.normalize(claimedAddress);

    address = authenticatedAddress;
    lastActivity = clock.millis();
    state = ConnectionState.AUTHENTICATED;

    // Queued messages go out before live deliveries can reach this connection
    connectionRegistry.register(authenticatedAddress, this, () -> {
      send(new AuthSuccessFrame(authenticatedAddress, clock.millis()));
      deliverQueuedMessages(authenticatedAddress);
    });
  }

  private void deliverQueuedMessages(final String authenticatedAddress) {
    final List<QueuedMessage> queuedMessages = messageQueue.dequeue(authenticatedAddress);

    if (queuedMessages.isEmpty()) {
      return;
    }

    logger.info("Delivering {} queued messages to {}", queuedMessages.size(), authenticatedAddress);

    for (final QueuedMessage queuedMessage : queuedMessages) {
      DRAINED_COUNTER.increment();

      send(MessageFrame.queued(queuedMessage.sender(), queuedMessage.content(), queuedMessage.messageId(),
          queuedMessage.timestamp()))
          .whenComplete((ignored, throwable) -> {
            if (throwable != null) {
              logger.warn("Lost queued message {} for {}", queuedMessage.messageId(), authenticatedAddress, throwable);
            }
          });
    }
  }

  private void handleAuthenticatedText(final String text) {
    lastActivity = clock.millis();

    try {
      final InboundFrame frame = codec.decode(text);

      if (frame instanceof SendMessageFrame sendMessageFrame) {
        handleMessage(sendMessageFrame);
      } else if (frame instanceof TypingFrame typingFrame) {
        handleTyping(typingFrame);
      } else if (frame instanceof ReadReceiptFrame readReceiptFrame) {
        handleReadReceipt(readReceiptFrame);
      } else if (frame instanceof PingFrame) {
        send(new PongFrame(clock.millis()));
      } else if (frame instanceof UnknownFrame unknownFrame) {
        logger.warn("Unknown frame type {} from {}", unknownFrame.type(), address);
      } else {
        logger.warn("Unexpected {} from already authenticated {}", frame.getClass().getSimpleName(), address);
      }
    } catch (final InvalidFrameException e) {
      logger.debug("Undecodable frame from {}", address, e);
      send(new ErrorFrame(ErrorFrame.FAILED_TO_PROCESS));
    } catch (final RuntimeException e) {
      logger.error("Error handling frame from {}", address, e);
      send(new ErrorFrame(ErrorFrame.FAILED_TO_PROCESS));
    }
  }

  private void handleMessage(final SendMessageFrame frame) {
    if (StringUtils.isAnyEmpty(frame.to(), frame.content(), frame.messageId())) {
      send(new ErrorFrame(ErrorFrame.INVALID_MESSAGE_FORMAT, frame.messageId()));
      return;
    }

    final String sender = address;
    final String recipient = Addresses.normalize(frame.to());
    final long timestamp = frame.timestamp() != null && frame.timestamp() != 0 ? frame.timestamp() : clock.millis();

    final boolean delivered = connectionRegistry.withConnection(recipient, maybeRecipientConnection -> {
      final Optional<RelayConnection> maybeOpenConnection = maybeRecipientConnection.filter(RelayConnection::isOpen);

      if (maybeOpenConnection.isPresent()) {
        maybeOpenConnection.get().send(MessageFrame.live(sender, frame.content(), frame.messageId(), timestamp));
        return true;
      }

      messageQueue.enqueue(recipient,
          new QueuedMessage(frame.messageId(), sender, recipient, frame.content(), timestamp, clock.millis()));
      return false;
    });

    if (delivered) {
      send(MessageAckFrame.delivered(frame.messageId(), recipient, clock.millis()));

      DELIVERED_COUNTER.increment();
      logger.debug("Delivered message {} from {} to {}", frame.messageId(), sender, recipient);
    } else {
      send(MessageAckFrame.queued(frame.messageId(), recipient, clock.millis()));

      QUEUED_COUNTER.increment();
      logger.debug("Queued message {} from {} to {}", frame.messageId(), sender, recipient);
    }
  }

  private void handleTyping(final TypingFrame frame) {
    if (StringUtils.isEmpty(frame.to())) {
      return;
    }

    connectionRegistry.get(Addresses.normalize(frame.to()))
        .filter(RelayConnection::isOpen)
        .ifPresent(recipient -> recipient.send(new TypingNotificationFrame(address, frame.isTyping())));
  }

  private void handleReadReceipt(final ReadReceiptFrame frame) {
    if (StringUtils.isAnyEmpty(frame.to(), frame.messageId())) {
      return;
    }

    connectionRegistry.get(Addresses.normalize(frame.to()))
        .filter(RelayConnection::isOpen)
        .ifPresent(recipient -> recipient.send(new ReadFrame(address, frame.messageId(), clock.millis())));
  }

  /**
   * Sends a frame to this connection's client. Failures are logged and reported through the returned future.
   */
  public CompletableFuture<Void> send(final OutboundFrame frame) {
    return client.sendText(codec.encode(frame))
        .whenComplete((ignored, throwable) -> {
          if (throwable != null) {
            logger.debug("Failed to send {} frame to {}", frame.type(), address, throwable);
          }
        });
  }

  public boolean isOpen() {
    return state != ConnectionState.CLOSED && client.isOpen();
  }

  public void close(final int statusCode, final String reason) {
    state = ConnectionState.CLOSED;
    client.close(statusCode, reason);
  }

  public ConnectionState getState() {
    return state;
  }

  @Nullable
  public String getAddress() {
    return address;
  }

  /**
   * @return the time, in epoch milliseconds, at which this connection last received a frame after authenticating
   */
  public long getLastActivity() {
    return lastActivity;
  }
}
