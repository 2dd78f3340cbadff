/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.UncheckedIOException;
import java.util.Optional;
import org.idenap2p.relay.entities.FrameType;
import org.idenap2p.relay.entities.InboundFrame;
import org.idenap2p.relay.entities.OutboundFrame;
import org.idenap2p.relay.entities.UnknownFrame;

/**
 * Translates between JSON text frames and relay frame objects.
 */
public class RelayFrameCodec {

  private final ObjectMapper mapper;

  public RelayFrameCodec(final ObjectMapper mapper) {
    this.mapper = mapper;
  }

  /**
   * Decodes a text frame. A JSON object whose {@code type} is missing or unrecognized decodes to an
   * {@link UnknownFrame} rather than failing.
   *
   * @throws InvalidFrameException if the text is not a JSON object, or its fields do not fit its declared type
   */
  public InboundFrame decode(final String text) throws InvalidFrameException {
    final JsonNode node;

    try {
      node = mapper.readTree(text);
    } catch (final JsonProcessingException e) {
      throw new InvalidFrameException("Frame is not valid JSON", e);
    }

    if (node == null || !node.isObject()) {
      throw new InvalidFrameException("Frame is not a JSON object");
    }

    final JsonNode typeNode = node.get("type");
    final String type = typeNode != null && typeNode.isTextual() ? typeNode.asText() : null;
    final Optional<FrameType> maybeFrameType = FrameType.forWireName(type);

    if (maybeFrameType.isEmpty()) {
      return new UnknownFrame(type);
    }

    try {
      return mapper.treeToValue(node, maybeFrameType.get().getFrameClass());
    } catch (final JsonProcessingException | IllegalArgumentException e) {
      throw new InvalidFrameException("Malformed " + type + " frame", e);
    }
  }

  public String encode(final OutboundFrame frame) {
    try {
      return mapper.writeValueAsString(frame);
    } catch (final JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }
}
