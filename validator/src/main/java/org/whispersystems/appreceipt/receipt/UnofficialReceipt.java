/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.receipt;

import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * Top-level receipt attributes that are not part of Apple's documented receipt format. Entries with a known meaning
 * come first; within each group entries are ordered by attribute number.
 */
public record UnofficialReceipt(List<Entry> entries) {

  private static final Comparator<Entry> ENTRY_ORDER = Comparator.comparing((Entry entry) -> entry.meaning().isEmpty())
      .thenComparingInt(Entry::attributeNumber);

  public UnofficialReceipt {
    entries = entries.stream().sorted(ENTRY_ORDER).toList();
  }

  public static UnofficialReceipt empty() {
    return new UnofficialReceipt(List.of());
  }

  public Optional<Entry> entry(final int attributeNumber) {
    return entries.stream()
        .filter(entry -> entry.attributeNumber() == attributeNumber)
        .findFirst();
  }

  public Optional<ProvisioningType> provisioningType() {
    return entry(KnownUnofficialAttribute.PROVISIONING_TYPE.attributeNumber())
        .flatMap(Entry::value)
        .filter(StringValue.class::isInstance)
        .map(StringValue.class::cast)
        .flatMap(stringValue -> ProvisioningType.fromReceiptValue(stringValue.value()));
  }

  public record Entry(int attributeNumber, Optional<KnownUnofficialAttribute> meaning, Optional<Value> value) {
  }

  public interface Value {
  }

  public record StringValue(String value) implements Value {
  }

  public record DateValue(Instant value) implements Value {

    @Override
    public String toString() {
      return "DateValue[" + ReceiptDateFormatter.format(value) + "]";
    }
  }

  public record BytesValue(byte[] value) implements Value {

    public BytesValue {
      value = value.clone();
    }

    @Override
    public byte[] value() {
      return value.clone();
    }

    @Override
    public boolean equals(final Object o) {
      if (this == o) {
        return true;
      }

      if (o == null || getClass() != o.getClass()) {
        return false;
      }

      return Arrays.equals(value, ((BytesValue) o).value);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
      return "BytesValue[" + HexFormat.of().formatHex(value) + "]";
    }
  }
}
