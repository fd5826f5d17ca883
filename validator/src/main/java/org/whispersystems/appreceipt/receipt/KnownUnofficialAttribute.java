/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.receipt;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Undocumented top-level attributes whose meaning has been observed in real receipts.
 */
public enum KnownUnofficialAttribute {
  PROVISIONING_TYPE(0, ValueType.STRING),
  DATE_1(8, ValueType.DATE),
  AGE_RATING(10, ValueType.STRING),
  DATE_2(18, ValueType.DATE),
  DATE_3(22, ValueType.DATE),
  CLIENT_NAME(23, ValueType.STRING);

  public enum ValueType {
    STRING,
    DATE,
    BYTES
  }

  private static final Map<Integer, KnownUnofficialAttribute> ATTRIBUTES_BY_NUMBER = Arrays.stream(values())
      .collect(Collectors.toMap(KnownUnofficialAttribute::attributeNumber, Function.identity()));

  private final int attributeNumber;
  private final ValueType valueType;

  KnownUnofficialAttribute(final int attributeNumber, final ValueType valueType) {
    this.attributeNumber = attributeNumber;
    this.valueType = valueType;
  }

  public int attributeNumber() {
    return attributeNumber;
  }

  public ValueType valueType() {
    return valueType;
  }

  public static Optional<KnownUnofficialAttribute> fromAttributeNumber(final int attributeNumber) {
    return Optional.ofNullable(ATTRIBUTES_BY_NUMBER.get(attributeNumber));
  }
}
