/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.receipt;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses and formats the RFC 3339 timestamps used inside receipts. Receipts use whole-second timestamps, but some
 * carry a millisecond fraction; both are accepted, and formatting picks whichever form preserves the instant.
 */
public class ReceiptDateFormatter {

  private static final DateTimeFormatter SECONDS_FORMATTER =
      DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss'Z'", Locale.ROOT).withZone(ZoneOffset.UTC);

  private static final DateTimeFormatter MILLISECONDS_FORMATTER =
      DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'", Locale.ROOT).withZone(ZoneOffset.UTC);

  private ReceiptDateFormatter() {
  }

  public static Optional<Instant> parse(final String receiptDate) {
    return parse(receiptDate, SECONDS_FORMATTER).or(() -> parse(receiptDate, MILLISECONDS_FORMATTER));
  }

  public static String format(final Instant instant) {
    return instant.get(ChronoField.MILLI_OF_SECOND) != 0
        ? MILLISECONDS_FORMATTER.format(instant)
        : SECONDS_FORMATTER.format(instant);
  }

  private static Optional<Instant> parse(final String receiptDate, final DateTimeFormatter formatter) {
    try {
      return Optional.of(formatter.parse(receiptDate, Instant::from));
    } catch (final DateTimeParseException e) {
      return Optional.empty();
    }
  }
}
