/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt;

/**
 * The reasons a receipt can fail to load, parse or validate.
 */
public enum ReceiptValidationError {
  COULD_NOT_FIND_RECEIPT,
  EMPTY_RECEIPT_CONTENTS,
  RECEIPT_NOT_SIGNED,
  APPLE_ROOT_CERTIFICATE_NOT_FOUND,
  MALFORMED_APPLE_ROOT_CERTIFICATE,
  CERTIFICATE_CHAIN_INVALID,
  RECEIPT_SIGNATURE_INVALID,
  MALFORMED_RECEIPT,
  MALFORMED_IN_APP_PURCHASE_RECEIPT,
  INCORRECT_HASH,
  DEVICE_IDENTIFIER_NOT_DETERMINABLE,
  COULD_NOT_GET_EXPECTED_PROPERTY_VALUE,
  PROPERTY_VALUE_MISMATCH,
  UNKNOWN
}
