/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt;

import java.util.Optional;
import javax.annotation.Nullable;
import org.whispersystems.appreceipt.receipt.Receipt;

/**
 * The outcome of a receipt validation. A successful result carries the validated receipt; a failed one carries the
 * reason. Either way the raw receipt bytes and the device identifier are included when they were obtained, which helps
 * diagnose failures.
 */
public class ReceiptValidationResult {

  @Nullable
  private final Receipt receipt;

  @Nullable
  private final ReceiptValidationError error;

  @Nullable
  private final byte[] receiptData;

  @Nullable
  private final byte[] deviceIdentifier;

  private ReceiptValidationResult(@Nullable final Receipt receipt,
      @Nullable final ReceiptValidationError error,
      @Nullable final byte[] receiptData,
      @Nullable final byte[] deviceIdentifier) {

    this.receipt = receipt;
    this.error = error;
    this.receiptData = receiptData != null ? receiptData.clone() : null;
    this.deviceIdentifier = deviceIdentifier != null ? deviceIdentifier.clone() : null;
  }

  public static ReceiptValidationResult success(final Receipt receipt, final byte[] receiptData,
      @Nullable final byte[] deviceIdentifier) {

    return new ReceiptValidationResult(receipt, null, receiptData, deviceIdentifier);
  }

  public static ReceiptValidationResult error(final ReceiptValidationError error, @Nullable final byte[] receiptData,
      @Nullable final byte[] deviceIdentifier) {

    return new ReceiptValidationResult(null, error, receiptData, deviceIdentifier);
  }

  public boolean isSuccess() {
    return error == null;
  }

  public Optional<Receipt> getReceipt() {
    return Optional.ofNullable(receipt);
  }

  public Optional<ReceiptValidationError> getError() {
    return Optional.ofNullable(error);
  }

  public Optional<byte[]> getReceiptData() {
    return Optional.ofNullable(receiptData).map(byte[]::clone);
  }

  public Optional<byte[]> getDeviceIdentifier() {
    return Optional.ofNullable(deviceIdentifier).map(byte[]::clone);
  }

  @Override
  public String toString() {
    return isSuccess() ? "ReceiptValidationResult{success, " + receipt + "}" : "ReceiptValidationResult{" + error + "}";
  }
}
