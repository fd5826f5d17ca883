/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.parameters;

import java.util.Optional;

/**
 * Supplies the identifier of the device the validating application runs on. On macOS this is the MAC address of the
 * primary network interface; on iOS it is the vendor identifier.
 */
@FunctionalInterface
public interface DeviceIdentifierProvider {

  Optional<byte[]> currentDeviceIdentifier();

  static DeviceIdentifierProvider unavailable() {
    return Optional::empty;
  }
}
