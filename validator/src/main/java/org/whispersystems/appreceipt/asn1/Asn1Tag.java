/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.asn1;

/**
 * Identifier octets of the universal types that appear in App Store receipts.
 */
public final class Asn1Tag {

  public static final int INTEGER = 0x02;
  public static final int OCTET_STRING = 0x04;
  public static final int UTF8_STRING = 0x0c;
  public static final int IA5_STRING = 0x16;
  public static final int SEQUENCE = 0x30;
  public static final int SET = 0x31;

  static final int HIGH_TAG_NUMBER = 0x1f;
  static final int CONSTRUCTED = 0x20;

  private Asn1Tag() {
  }
}
