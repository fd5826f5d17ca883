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
 * Documented top-level receipt attributes.
 *
 * @see <a href="https://developer.apple.com/library/archive/releasenotes/General/ValidateAppStoreReceipt/Chapters/ReceiptFields.html">Receipt Fields</a>
 */
public enum ReceiptAttribute {
  BUNDLE_IDENTIFIER(2),
  APP_VERSION(3),
  OPAQUE_VALUE(4),
  SHA1_HASH(5),
  RECEIPT_CREATION_DATE(12),
  IN_APP_PURCHASE_RECEIPT(17),
  ORIGINAL_APP_VERSION(19),
  EXPIRATION_DATE(21);

  private static final Map<Integer, ReceiptAttribute> ATTRIBUTES_BY_TYPE = Arrays.stream(values())
      .collect(Collectors.toMap(ReceiptAttribute::type, Function.identity()));

  private final int type;

  ReceiptAttribute(final int type) {
    this.type = type;
  }

  public int type() {
    return type;
  }

  public static Optional<ReceiptAttribute> fromType(final int type) {
    return Optional.ofNullable(ATTRIBUTES_BY_TYPE.get(type));
  }
}
