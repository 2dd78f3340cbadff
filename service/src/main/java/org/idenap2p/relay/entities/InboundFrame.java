/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.entities;

/**
 * A text frame received from a relay client, decoded according to its {@code type} field.
 */
public sealed interface InboundFrame
    permits AuthFrame, SendMessageFrame, TypingFrame, ReadReceiptFrame, PingFrame, UnknownFrame {
}
