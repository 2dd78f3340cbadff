/*
 * Copyright 2013 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.storage;

public record MessageQueueStats(int totalUsers, long totalMessages, int maxMessagesPerUser, long retentionHours) {
}
