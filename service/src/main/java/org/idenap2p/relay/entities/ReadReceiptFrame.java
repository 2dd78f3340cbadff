/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.entities;

import javax.annotation.Nullable;

public record ReadReceiptFrame(@Nullable String to, @Nullable String messageId) implements InboundFrame {
}
