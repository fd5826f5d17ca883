/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.validation;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.whispersystems.appreceipt.ReceiptValidationError;
import org.whispersystems.appreceipt.ReceiptValidationException;
import org.whispersystems.appreceipt.receipt.Receipt;

/**
 * Checks that a receipt was issued for a specific device. The receipt's hash is the SHA-1 digest of the device
 * identifier, the receipt's opaque value and the receipt's encoded bundle identifier, in that order.
 */
public class HashValidator {

  private HashValidator() {
  }

  public static void validateHash(final Receipt receipt, final byte[] deviceIdentifier)
      throws ReceiptValidationException {

    if (receipt.opaqueValue() == null || receipt.bundleIdData() == null || receipt.sha1Hash() == null) {
      throw new ReceiptValidationException(ReceiptValidationError.INCORRECT_HASH);
    }

    final MessageDigest sha1;

    try {
      sha1 = MessageDigest.getInstance("SHA-1");
    } catch (final NoSuchAlgorithmException e) {
      // All Java implementations are required to support SHA-1, so this should never happen
      throw new AssertionError(e);
    }

    sha1.update(deviceIdentifier);
    sha1.update(receipt.opaqueValue());
    sha1.update(receipt.bundleIdData());

    if (!MessageDigest.isEqual(sha1.digest(), receipt.sha1Hash())) {
      throw new ReceiptValidationException(ReceiptValidationError.INCORRECT_HASH);
    }
  }
}
