/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.entities;

import javax.annotation.Nullable;

/**
 * A message from the connected client to another address.
 * <p>
 * Message content is relayed and queued as text. A scalar JSON {@code content} is coerced to its text form, and an
 * object or array {@code content} makes the frame undecodable, so the sender gets a "Failed to process message" error.
 *
 * @param timestamp client send time in epoch milliseconds; the server time is used when absent
 */
public record SendMessageFrame(@Nullable String to,
                               @Nullable String content,
                               @Nullable String messageId,
                               @Nullable Long timestamp) implements InboundFrame {
}
