/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.entities;

import javax.annotation.Nullable;

/**
 * A well-formed frame whose {@code type} is missing or not one the relay understands.
 */
public record UnknownFrame(@Nullable String type) implements InboundFrame {
}
