/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.parameters;

import java.io.IOException;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Where to load a receipt from.
 */
@FunctionalInterface
public interface ReceiptOrigin {

  /**
   * @return the raw receipt bytes, or empty if there is no receipt
   * @throws IOException if the receipt exists but could not be read
   */
  Optional<byte[]> load() throws IOException;

  static ReceiptOrigin of(final byte[] receiptData) {
    final byte[] copy = receiptData.clone();
    return () -> Optional.of(copy.clone());
  }

  /**
   * @param receiptDataSupplier a supplier consulted each time the receipt is loaded
   */
  static ReceiptOrigin dynamic(final Supplier<Optional<byte[]>> receiptDataSupplier) {
    return receiptDataSupplier::get;
  }

  static ReceiptOrigin installed(final InstalledReceiptLoader installedReceiptLoader) {
    return installedReceiptLoader::loadInstalledReceipt;
  }
}
