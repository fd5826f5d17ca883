/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import javax.annotation.Nullable;
import org.whispersystems.appreceipt.validation.PropertyValidation;
import org.whispersystems.appreceipt.validation.ReceiptProperty;

/**
 * @param property the receipt property to check
 * @param expected the expected value; an absent value means the receipt must not carry the property
 */
public record PropertyValidationConfiguration(
    @JsonProperty("property") @NotNull ReceiptProperty property,
    @JsonProperty("expected") @Nullable String expected) {

  public PropertyValidation toPropertyValidation() {
    return PropertyValidation.matching(property, expected);
  }
}
