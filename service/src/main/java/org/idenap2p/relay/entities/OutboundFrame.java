/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.entities;

/**
 * A text frame sent to a relay client. Every frame serializes its {@code type} first.
 */
public interface OutboundFrame {

  String type();
}
