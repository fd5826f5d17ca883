/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.receipt;

import java.time.Instant;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * The documented contents of an App Store receipt. Every field is optional except the list of in-app purchases, which
 * is empty when the receipt records none.
 *
 * @param bundleIdentifier      the application's bundle identifier
 * @param bundleIdData          the encoded bundle identifier exactly as it appears in the receipt; an input to the
 *                              receipt hash
 * @param appVersion            the application version the receipt was issued for
 * @param originalAppVersion    the version of the application that was originally purchased
 * @param opaqueValue           an opaque value used as an input to the receipt hash
 * @param sha1Hash              the SHA-1 hash of the device identifier, opaque value and bundle identifier data
 * @param receiptCreationDate   when the receipt was created
 * @param expirationDate        when the receipt expires (volume purchase program only)
 * @param inAppPurchaseReceipts in-app purchase receipts in the order they appear in the receipt
 */
public record Receipt(
    @Nullable String bundleIdentifier,
    @Nullable byte[] bundleIdData,
    @Nullable String appVersion,
    @Nullable String originalAppVersion,
    @Nullable byte[] opaqueValue,
    @Nullable byte[] sha1Hash,
    @Nullable Instant receiptCreationDate,
    @Nullable Instant expirationDate,
    List<InAppPurchaseReceipt> inAppPurchaseReceipts) {

  public Receipt {
    bundleIdData = copy(bundleIdData);
    opaqueValue = copy(opaqueValue);
    sha1Hash = copy(sha1Hash);
    inAppPurchaseReceipts = List.copyOf(inAppPurchaseReceipts);
  }

  @Override
  @Nullable
  public byte[] bundleIdData() {
    return copy(bundleIdData);
  }

  @Override
  @Nullable
  public byte[] opaqueValue() {
    return copy(opaqueValue);
  }

  @Override
  @Nullable
  public byte[] sha1Hash() {
    return copy(sha1Hash);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }

    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    final Receipt that = (Receipt) o;

    return Objects.equals(bundleIdentifier, that.bundleIdentifier)
        && Arrays.equals(bundleIdData, that.bundleIdData)
        && Objects.equals(appVersion, that.appVersion)
        && Objects.equals(originalAppVersion, that.originalAppVersion)
        && Arrays.equals(opaqueValue, that.opaqueValue)
        && Arrays.equals(sha1Hash, that.sha1Hash)
        && Objects.equals(receiptCreationDate, that.receiptCreationDate)
        && Objects.equals(expirationDate, that.expirationDate)
        && inAppPurchaseReceipts.equals(that.inAppPurchaseReceipts);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(bundleIdentifier, appVersion, originalAppVersion, receiptCreationDate, expirationDate,
        inAppPurchaseReceipts);
    result = 31 * result + Arrays.hashCode(bundleIdData);
    result = 31 * result + Arrays.hashCode(opaqueValue);
    result = 31 * result + Arrays.hashCode(sha1Hash);
    return result;
  }

  @Override
  public String toString() {
    return "Receipt{" +
        "bundleIdentifier=" + bundleIdentifier +
        ", bundleIdData=" + hex(bundleIdData) +
        ", appVersion=" + appVersion +
        ", originalAppVersion=" + originalAppVersion +
        ", opaqueValue=" + hex(opaqueValue) +
        ", sha1Hash=" + hex(sha1Hash) +
        ", receiptCreationDate=" + receiptCreationDate +
        ", expirationDate=" + expirationDate +
        ", inAppPurchaseReceipts=" + inAppPurchaseReceipts +
        '}';
  }

  @Nullable
  private static byte[] copy(@Nullable final byte[] bytes) {
    return bytes != null ? bytes.clone() : null;
  }

  @Nullable
  private static String hex(@Nullable final byte[] bytes) {
    return bytes != null ? HexFormat.of().formatHex(bytes) : null;
  }
}
