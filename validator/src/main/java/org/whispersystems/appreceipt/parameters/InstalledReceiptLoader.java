/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Loads the receipt installed alongside an application, for example {@code Contents/_MASReceipt/receipt} inside a
 * macOS application bundle.
 */
@FunctionalInterface
public interface InstalledReceiptLoader {

  Optional<byte[]> loadInstalledReceipt() throws IOException;

  /**
   * @param receiptPath the path of the installed receipt; a missing file means there is no receipt
   */
  static InstalledReceiptLoader fromPath(final Path receiptPath) {
    return () -> {
      try {
        return Optional.of(Files.readAllBytes(receiptPath));
      } catch (final NoSuchFileException e) {
        return Optional.empty();
      }
    };
  }
}
