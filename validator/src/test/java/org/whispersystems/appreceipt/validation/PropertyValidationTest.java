/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.validation;

import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.whispersystems.appreceipt.ReceiptValidationError;
import org.whispersystems.appreceipt.ReceiptValidationException;
import org.whispersystems.appreceipt.receipt.Receipt;

class PropertyValidationTest {

  private static final Receipt RECEIPT =
      new Receipt("com.example.App", null, "1.2.3", null, null, null, null, null, List.of());

  @ParameterizedTest
  @CsvSource({
      "BUNDLE_IDENTIFIER, com.example.App, true",
      "BUNDLE_IDENTIFIER, com.example.app, false",
      "BUNDLE_IDENTIFIER, '', false",
      "APP_VERSION, 1.2.3, true",
      "APP_VERSION, 1.2.4, false",
      "ORIGINAL_APP_VERSION, 1.0, false",
  })
  void validate(final ReceiptProperty property, final String expectedValue, final boolean expectMatch) {
    final PropertyValidation propertyValidation = PropertyValidation.matching(property, expectedValue);

    if (expectMatch) {
      assertDoesNotThrow(() -> propertyValidation.validate(RECEIPT));
    } else {
      assertValidationError(propertyValidation, ReceiptValidationError.PROPERTY_VALUE_MISMATCH);
    }
  }

  @Test
  void validateAbsentProperty() {
    assertDoesNotThrow(() -> PropertyValidation.matching(ReceiptProperty.ORIGINAL_APP_VERSION, null).validate(RECEIPT));

    assertValidationError(PropertyValidation.matching(ReceiptProperty.BUNDLE_IDENTIFIER, null),
        ReceiptValidationError.PROPERTY_VALUE_MISMATCH);
  }

  @Test
  void validateExternal() {
    assertDoesNotThrow(() -> PropertyValidation.matchingExternal(ReceiptProperty.BUNDLE_IDENTIFIER,
        () -> Optional.of("com.example.App")).validate(RECEIPT));

    assertValidationError(PropertyValidation.matchingExternal(ReceiptProperty.APP_VERSION,
        () -> Optional.of("2.0")), ReceiptValidationError.PROPERTY_VALUE_MISMATCH);
  }

  @Test
  void validateExternalUnavailable() {
    assertValidationError(PropertyValidation.matchingExternal(ReceiptProperty.BUNDLE_IDENTIFIER, Optional::empty),
        ReceiptValidationError.COULD_NOT_GET_EXPECTED_PROPERTY_VALUE);

    assertValidationError(PropertyValidation.matchingExternal(ReceiptProperty.BUNDLE_IDENTIFIER, () -> {
      throw new IllegalStateException("No bundle");
    }), ReceiptValidationError.COULD_NOT_GET_EXPECTED_PROPERTY_VALUE);

    @SuppressWarnings("OptionalAssignedToNull") final Supplier<Optional<String>> nullSupplier = () -> null;
    assertValidationError(PropertyValidation.matchingExternal(ReceiptProperty.BUNDLE_IDENTIFIER, nullSupplier),
        ReceiptValidationError.COULD_NOT_GET_EXPECTED_PROPERTY_VALUE);
  }

  @Test
  void externalValueIsResolvedOnEachValidation() throws ReceiptValidationException {
    final String[] expectedValue = {"com.example.App"};
    final PropertyValidation propertyValidation = PropertyValidation.matchingExternal(
        ReceiptProperty.BUNDLE_IDENTIFIER, () -> Optional.of(expectedValue[0]));

    propertyValidation.validate(RECEIPT);

    expectedValue[0] = "com.example.Other";
    assertValidationError(propertyValidation, ReceiptValidationError.PROPERTY_VALUE_MISMATCH);
  }

  private static void assertValidationError(final PropertyValidation propertyValidation,
      final ReceiptValidationError expectedError) {

    assertThatExceptionOfType(ReceiptValidationException.class)
        .isThrownBy(() -> propertyValidation.validate(RECEIPT))
        .satisfies(e -> assertEquals(expectedError, e.getError()));
  }
}
