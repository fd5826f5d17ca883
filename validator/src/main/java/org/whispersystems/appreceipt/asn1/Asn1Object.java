/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.asn1;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

/**
 * A single decoded TLV. The value is not copied; it stays a view into the array the {@link Asn1Reader} was reading.
 */
public final class Asn1Object {

  private static final int MAX_INTEGER_LENGTH = Long.BYTES;

  private final byte[] source;
  private final int identifier;
  private final int tagNumber;
  private final int length;
  private final int valueOffset;

  Asn1Object(final byte[] source, final int identifier, final int tagNumber, final int length,
      final int valueOffset) {

    this.source = source;
    this.identifier = identifier;
    this.tagNumber = tagNumber;
    this.length = length;
    this.valueOffset = valueOffset;
  }

  /**
   * @return the first identifier octet, which for the universal types used here is the full tag (see {@link Asn1Tag})
   */
  public int tag() {
    return identifier;
  }

  public int tagNumber() {
    return tagNumber;
  }

  public boolean isConstructed() {
    return (identifier & Asn1Tag.CONSTRUCTED) != 0;
  }

  public int length() {
    return length;
  }

  public int valueOffset() {
    return valueOffset;
  }

  public int nextOffset() {
    return valueOffset + length;
  }

  public boolean isSet() {
    return identifier == Asn1Tag.SET;
  }

  public boolean isSequence() {
    return identifier == Asn1Tag.SEQUENCE;
  }

  public boolean isOctetString() {
    return identifier == Asn1Tag.OCTET_STRING;
  }

  /**
   * @return a reader bounded to this object's value
   */
  public Asn1Reader contents() {
    return new Asn1Reader(source, valueOffset, length);
  }

  /**
   * @return a copy of this object's value octets
   */
  public byte[] bytes() {
    return Arrays.copyOfRange(source, valueOffset, valueOffset + length);
  }

  /**
   * Decodes the TLV nested inside an OCTET STRING.
   *
   * @return the nested object, or empty if this is not an OCTET STRING or its value is not a well-formed TLV
   */
  public Optional<Asn1Object> unwrap() {
    if (!isOctetString()) {
      return Optional.empty();
    }

    try {
      return Optional.of(contents().next());
    } catch (final Asn1DecodingException e) {
      return Optional.empty();
    }
  }

  /**
   * @return the two's-complement value of an INTEGER of one to eight octets, or empty for anything else
   */
  public Optional<Long> integerValue() {
    if (identifier != Asn1Tag.INTEGER || length < 1 || length > MAX_INTEGER_LENGTH) {
      return Optional.empty();
    }

    // The first octet is sign-extended
    long value = source[valueOffset];
    for (int i = 1; i < length; i++) {
      value = (value << 8) | (source[valueOffset + i] & 0xff);
    }

    return Optional.of(value);
  }

  /**
   * @return the text of a UTF8String or IA5String, or empty for other types and for malformed encodings
   */
  public Optional<String> stringValue() {
    return switch (identifier) {
      case Asn1Tag.UTF8_STRING -> decode(StandardCharsets.UTF_8);
      case Asn1Tag.IA5_STRING -> decode(StandardCharsets.US_ASCII);
      default -> Optional.empty();
    };
  }

  private Optional<String> decode(final Charset charset) {
    try {
      return Optional.of(charset.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(source, valueOffset, length))
          .toString());
    } catch (final CharacterCodingException e) {
      return Optional.empty();
    }
  }
}
