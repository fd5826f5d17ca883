/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.asn1;

import org.whispersystems.appreceipt.util.NoStackTraceException;

/**
 * Indicates that a byte range does not hold a well-formed TLV.
 */
public class Asn1DecodingException extends NoStackTraceException {

  public Asn1DecodingException(final String message) {
    super(message);
  }
}
