/*
 * Copyright 2013 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.util;

import java.util.Locale;
import java.util.regex.Pattern;
import javax.annotation.Nullable;
import org.idenap2p.relay.controllers.InvalidRequestException;

/**
 * Helpers for Idena identity addresses ({@code 0x} followed by 40 hex digits). Every map in the relay is keyed by the
 * normalized, lower-case form.
 */
public class Addresses {

  public static final String INVALID_ADDRESS_MESSAGE = "Invalid Idena address format";

  private static final Pattern ADDRESS_PATTERN = Pattern.compile("^0x[a-fA-F0-9]{40}$");

  private Addresses() {
  }

  public static boolean isValid(@Nullable final String address) {
    return address != null && ADDRESS_PATTERN.matcher(address).matches();
  }

  public static String normalize(final String address) {
    return address.toLowerCase(Locale.ROOT);
  }

  /**
   * Returns the normalized form of the given address.
   *
   * @throws InvalidRequestException if the address is not well-formed
   */
  public static String requireValid(@Nullable final String address) {
    if (!isValid(address)) {
      throw new InvalidRequestException(INVALID_ADDRESS_MESSAGE);
    }

    return normalize(address);
  }
}
