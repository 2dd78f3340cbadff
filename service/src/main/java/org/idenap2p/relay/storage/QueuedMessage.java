/*
 * Copyright 2013 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.storage;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A message held for an offline recipient.
 *
 * @param messageId the sender-chosen message identifier
 * @param sender    normalized address of the sender
 * @param recipient normalized address of the recipient
 * @param content   opaque payload, relayed as-is
 * @param timestamp sender-supplied send time in epoch milliseconds, or the server time if the sender omitted it
 * @param queuedAt  server time in epoch milliseconds at which the message was queued
 */
public record QueuedMessage(String messageId,
                            @JsonProperty("from") String sender,
                            @JsonProperty("to") String recipient,
                            String content,
                            long timestamp,
                            long queuedAt) {
}
