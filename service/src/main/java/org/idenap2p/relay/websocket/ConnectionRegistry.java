/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.websocket;

import static org.idenap2p.relay.metrics.MetricsUtil.name;

import io.dropwizard.lifecycle.Managed;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Tags;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.idenap2p.relay.util.Addresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks the authenticated connection for each online address. At most one connection is registered per address; a
 * later registration for the same address replaces the earlier one without closing it.
 * <p>
 * Registration and {@link #withConnection(String, Function)} are serialized per address, so a sender that finds an
 * address offline finishes its work before a connection for that address can be registered.
 */
public class ConnectionRegistry implements Managed {

  private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

  private static final int SERVER_SHUTDOWN_CLOSE_CODE = 1001;

  private final Map<String, RelayConnection> connections = new ConcurrentHashMap<>();

  public ConnectionRegistry() {
    Metrics.gaugeMapSize(name(ConnectionRegistry.class, "connections"), Tags.empty(), connections);
  }

  public void register(final String address, final RelayConnection connection) {
    register(address, connection, () -> {});
  }

  /**
   * Registers a connection for the given address. {@code beforeVisible} runs while no other caller can observe or
   * deliver to the address, and the new connection becomes visible only once it returns.
   */
  public void register(final String address, final RelayConnection connection, final Runnable beforeVisible) {
    final String normalizedAddress = Addresses.normalize(address);

    connections.compute(normalizedAddress, (ignored, displaced) -> {
      beforeVisible.run();

      if (displaced != null && displaced != connection) {
        logger.info("New connection for {} replaced an existing one", normalizedAddress);
      }

      return connection;
    });

    logger.info("{} is online", normalizedAddress);
  }

  /**
   * Applies the given function to the connection currently registered for the address, if any, without letting a
   * concurrent registration for that address interleave.
   */
  public <T> T withConnection(final String address, final Function<Optional<RelayConnection>, T> function) {
    final AtomicReference<T> result = new AtomicReference<>();

    connections.compute(Addresses.normalize(address), (ignored, connection) -> {
      result.set(function.apply(Optional.ofNullable(connection)));
      return connection;
    });

    return result.get();
  }

  /**
   * Removes the registration for the given address, but only if it still belongs to the given connection.
   *
   * @return {@code true} if the registration was removed
   */
  public boolean unregister(final String address, final RelayConnection connection) {
    final String normalizedAddress = Addresses.normalize(address);
    final boolean removed = connections.remove(normalizedAddress, connection);

    if (removed) {
      logger.info("{} is offline", normalizedAddress);
    }

    return removed;
  }

  public Optional<RelayConnection> get(final String address) {
    return Optional.ofNullable(connections.get(Addresses.normalize(address)));
  }

  public boolean isOnline(final String address) {
    return get(address).map(RelayConnection::isOpen).orElse(false);
  }

  public int getConnectionCount() {
    return connections.size();
  }

  public List<String> getOnlineAddresses() {
    return new ArrayList<>(connections.keySet());
  }

  public List<RelayConnection> getConnections() {
    return new ArrayList<>(connections.values());
  }

  public void closeAll() {
    logger.info("Closing {} connections", connections.size());

    for (final Map.Entry<String, RelayConnection> entry : connections.entrySet()) {
      if (connections.remove(entry.getKey(), entry.getValue())) {
        entry.getValue().close(SERVER_SHUTDOWN_CLOSE_CODE, "Server shutting down");
      }
    }
  }

  @Override
  public void stop() throws Exception {
    closeAll();
  }
}
