/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.entities;

/**
 * @param timestamp      current server time, ISO-8601
 * @param uptime         seconds since the service started
 * @param connections    number of registered connections
 * @param queuedMessages number of messages waiting in all offline queues
 */
public record HealthResponse(String status, String timestamp, double uptime, int connections, long queuedMessages) {
}
