/*
 * Copyright 2013-2021 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.util.logging;

import org.glassfish.jersey.server.ExtendedUriInfo;

public class UriInfoUtil {

  /**
   * Returns the matched resource template (for example {@code /api/messages/{address}}) so that logged paths do not
   * carry addresses.
   */
  public static String getPathTemplate(final ExtendedUriInfo uriInfo) {
    final StringBuilder pathBuilder = new StringBuilder();

    for (int i = uriInfo.getMatchedTemplates().size() - 1; i >= 0; i--) {
      pathBuilder.append(uriInfo.getMatchedTemplates().get(i).getTemplate());
    }

    return pathBuilder.toString();
  }
}
