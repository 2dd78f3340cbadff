/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.entities;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

public enum FrameType {
  AUTH("auth", AuthFrame.class),
  MESSAGE("message", SendMessageFrame.class),
  TYPING("typing", TypingFrame.class),
  READ_RECEIPT("read_receipt", ReadReceiptFrame.class),
  PING("ping", PingFrame.class);

  private static final Map<String, FrameType> BY_WIRE_NAME = Arrays.stream(values())
      .collect(Collectors.toMap(FrameType::getWireName, Function.identity()));

  private final String wireName;
  private final Class<? extends InboundFrame> frameClass;

  FrameType(final String wireName, final Class<? extends InboundFrame> frameClass) {
    this.wireName = wireName;
    this.frameClass = frameClass;
  }

  public String getWireName() {
    return wireName;
  }

  public Class<? extends InboundFrame> getFrameClass() {
    return frameClass;
  }

  public static Optional<FrameType> forWireName(@Nullable final String wireName) {
    return wireName == null ? Optional.empty() : Optional.ofNullable(BY_WIRE_NAME.get(wireName));
  }
}
