/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt;

import org.whispersystems.appreceipt.util.NoStackTraceException;

/**
 * Indicates that a receipt could not be loaded, parsed or validated for the given {@link ReceiptValidationError}.
 */
public class ReceiptValidationException extends NoStackTraceException {

  private final ReceiptValidationError error;

  public ReceiptValidationException(final ReceiptValidationError error) {
    super(error.name());
    this.error = error;
  }

  public ReceiptValidationException(final ReceiptValidationError error, final Throwable cause) {
    super(error.name(), cause);
    this.error = error;
  }

  public ReceiptValidationError getError() {
    return error;
  }
}
