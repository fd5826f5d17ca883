/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.receipt;

import java.util.Arrays;
import java.util.Optional;

/**
 * Values observed for the unofficial provisioning-type attribute.
 */
public enum ProvisioningType {
  PRODUCTION("Production"),
  PRODUCTION_SANDBOX("ProductionSandbox");

  private final String receiptValue;

  ProvisioningType(final String receiptValue) {
    this.receiptValue = receiptValue;
  }

  public String receiptValue() {
    return receiptValue;
  }

  public static Optional<ProvisioningType> fromReceiptValue(final String receiptValue) {
    return Arrays.stream(values())
        .filter(provisioningType -> provisioningType.receiptValue.equals(receiptValue))
        .findFirst();
  }
}
