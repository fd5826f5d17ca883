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
 * Attributes of a single in-app purchase receipt, nested inside top-level attribute 17.
 */
public enum InAppPurchaseAttribute {
  QUANTITY(1701),
  PRODUCT_IDENTIFIER(1702),
  TRANSACTION_IDENTIFIER(1703),
  PURCHASE_DATE(1704),
  ORIGINAL_TRANSACTION_IDENTIFIER(1705),
  ORIGINAL_PURCHASE_DATE(1706),
  SUBSCRIPTION_EXPIRATION_DATE(1708),
  WEB_ORDER_LINE_ITEM_ID(1711),
  CANCELLATION_DATE(1712),
  INTRODUCTORY_PRICE_PERIOD(1719);

  private static final Map<Integer, InAppPurchaseAttribute> ATTRIBUTES_BY_TYPE = Arrays.stream(values())
      .collect(Collectors.toMap(InAppPurchaseAttribute::type, Function.identity()));

  private final int type;

  InAppPurchaseAttribute(final int type) {
    this.type = type;
  }

  public int type() {
    return type;
  }

  public static Optional<InAppPurchaseAttribute> fromType(final int type) {
    return Optional.ofNullable(ATTRIBUTES_BY_TYPE.get(type));
  }
}
