/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.validation;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.appreceipt.ReceiptValidationError;
import org.whispersystems.appreceipt.ReceiptValidationException;
import org.whispersystems.appreceipt.receipt.Receipt;

/**
 * Compares one receipt property with an expected value. The expected value is either a literal, where {@code null}
 * means the property must be absent, or is read from an external source (typically the embedding application's own
 * metadata) when the validation runs.
 */
public class PropertyValidation {

  private static final Logger logger = LoggerFactory.getLogger(PropertyValidation.class);

  private final ReceiptProperty property;

  @Nullable
  private final String expectedValue;

  @Nullable
  private final Supplier<Optional<String>> expectedValueSupplier;

  private PropertyValidation(final ReceiptProperty property,
      @Nullable final String expectedValue,
      @Nullable final Supplier<Optional<String>> expectedValueSupplier) {

    this.property = property;
    this.expectedValue = expectedValue;
    this.expectedValueSupplier = expectedValueSupplier;
  }

  public static PropertyValidation matching(final ReceiptProperty property, @Nullable final String expectedValue) {
    return new PropertyValidation(property, expectedValue, null);
  }

  public static PropertyValidation matchingExternal(final ReceiptProperty property,
      final Supplier<Optional<String>> expectedValueSupplier) {

    return new PropertyValidation(property, null, Objects.requireNonNull(expectedValueSupplier));
  }

  public ReceiptProperty property() {
    return property;
  }

  /**
   * @throws ReceiptValidationException with {@link ReceiptValidationError#COULD_NOT_GET_EXPECTED_PROPERTY_VALUE} if an
   * external expected value is unavailable, or {@link ReceiptValidationError#PROPERTY_VALUE_MISMATCH} if the receipt's
   * value differs from the expected one
   */
  public void validate(final Receipt receipt) throws ReceiptValidationException {
    final String expected = expectedValueSupplier != null ? resolveExternalValue() : expectedValue;

    if (!Objects.equals(expected, property.valueOf(receipt))) {
      logger.debug("Receipt property {} does not match expected value", property);
      throw new ReceiptValidationException(ReceiptValidationError.PROPERTY_VALUE_MISMATCH);
    }
  }

  private String resolveExternalValue() throws ReceiptValidationException {
    final Optional<String> maybeExpected;

    try {
      maybeExpected = expectedValueSupplier.get();
    } catch (final RuntimeException e) {
      logger.info("Failed to get expected value for {}", property, e);
      throw new ReceiptValidationException(ReceiptValidationError.COULD_NOT_GET_EXPECTED_PROPERTY_VALUE, e);
    }

    if (maybeExpected == null || maybeExpected.isEmpty()) {
      throw new ReceiptValidationException(ReceiptValidationError.COULD_NOT_GET_EXPECTED_PROPERTY_VALUE);
    }

    return maybeExpected.get();
  }
}
