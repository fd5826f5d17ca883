/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.validation;

import java.util.function.Function;
import javax.annotation.Nullable;
import org.whispersystems.appreceipt.receipt.Receipt;

/**
 * Receipt properties that can be compared against an expected value.
 */
public enum ReceiptProperty {
  BUNDLE_IDENTIFIER(Receipt::bundleIdentifier),
  APP_VERSION(Receipt::appVersion),
  ORIGINAL_APP_VERSION(Receipt::originalAppVersion);

  private final Function<Receipt, String> accessor;

  ReceiptProperty(final Function<Receipt, String> accessor) {
    this.accessor = accessor;
  }

  @Nullable
  public String valueOf(final Receipt receipt) {
    return accessor.apply(receipt);
  }
}
