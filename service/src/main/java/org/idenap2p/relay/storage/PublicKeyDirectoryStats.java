/*
 * Copyright 2013 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.idenap2p.relay.storage;

import java.util.List;

public record PublicKeyDirectoryStats(int totalKeys, List<String> addresses) {
}
