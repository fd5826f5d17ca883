/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.asn1;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.util.Optional;
import java.util.stream.Stream;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.DERNull;
import org.bouncycastle.asn1.DERSequence;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.whispersystems.appreceipt.util.ReceiptPayloadBuilder;

class Asn1ReaderTest {

  private static byte[] bytes(final int... values) {
    final byte[] bytes = new byte[values.length];
    for (int i = 0; i < values.length; i++) {
      bytes[i] = (byte) values[i];
    }
    return bytes;
  }

  @Test
  void shortFormLength() throws Asn1DecodingException {
    final Asn1Reader reader = new Asn1Reader(bytes(0x02, 0x01, 0x05));
    final Asn1Object integer = reader.next();

    assertEquals(Asn1Tag.INTEGER, integer.tag());
    assertEquals(1, integer.length());
    assertEquals(2, integer.valueOffset());
    assertEquals(3, integer.nextOffset());
    assertEquals(Optional.of(5L), integer.integerValue());
    assertFalse(reader.hasNext());
  }

  @Test
  void longFormLength() throws Asn1DecodingException {
    final byte[] encoded = new byte[203];
    encoded[0] = Asn1Tag.OCTET_STRING;
    encoded[1] = (byte) 0x81;
    encoded[2] = (byte) 200;

    final Asn1Object octetString = new Asn1Reader(encoded).next();

    assertTrue(octetString.isOctetString());
    assertEquals(200, octetString.length());
    assertEquals(3, octetString.valueOffset());
    assertEquals(200, octetString.bytes().length);
  }

  @Test
  void highTagNumber() throws Asn1DecodingException {
    final Asn1Object object = new Asn1Reader(bytes(0x9f, 0x81, 0x00, 0x01, 0x07)).next();

    assertEquals(0x9f, object.tag());
    assertEquals(128, object.tagNumber());
    assertEquals(1, object.length());
    assertThat(object.bytes()).containsExactly(0x07);
  }

  @Test
  void childReaderIsBoundedToParent() throws Asn1DecodingException {
    final Asn1Reader reader = new Asn1Reader(bytes(0x30, 0x03, 0x02, 0x01, 0x01, 0x02, 0x01, 0x02));

    final Asn1Object sequence = reader.next();
    assertTrue(sequence.isSequence());
    assertTrue(sequence.isConstructed());

    final Asn1Reader contents = sequence.contents();
    assertEquals(Optional.of(1L), contents.next().integerValue());
    assertFalse(contents.hasNext());

    assertEquals(Optional.of(2L), reader.next().integerValue());
    assertFalse(reader.hasNext());
  }

  @Test
  void childLengthExceedingParent() throws Asn1DecodingException {
    final Asn1Object sequence = new Asn1Reader(bytes(0x30, 0x02, 0x04, 0x05, 0x01, 0x02, 0x03, 0x04, 0x05)).next();

    assertThatExceptionOfType(Asn1DecodingException.class).isThrownBy(() -> sequence.contents().next());
  }

  @ParameterizedTest
  @MethodSource
  void malformed(final byte[] encoded) {
    assertThatExceptionOfType(Asn1DecodingException.class).isThrownBy(() -> new Asn1Reader(encoded).next());
  }

  private static Stream<Arguments> malformed() {
    return Stream.of(
        Arguments.of((Object) bytes()),
        Arguments.of((Object) bytes(0x04)),
        Arguments.of((Object) bytes(0x30, 0x80, 0x00, 0x00)),
        Arguments.of((Object) bytes(0x04, 0x05, 0x01, 0x02)),
        Arguments.of((Object) bytes(0x04, 0x82, 0x01)),
        Arguments.of((Object) bytes(0x04, 0x85, 0x00, 0x00, 0x00, 0x00, 0x01, 0x00)),
        Arguments.of((Object) bytes(0x04, 0x84, 0xff, 0xff, 0xff, 0xff)),
        Arguments.of((Object) bytes(0x1f, 0x81)));
  }

  @ParameterizedTest
  @MethodSource
  void integerValue(final byte[] encoded, final Optional<Long> expected) throws Asn1DecodingException {
    assertEquals(expected, new Asn1Reader(encoded).next().integerValue());
  }

  private static Stream<Arguments> integerValue() {
    return Stream.of(
        Arguments.of(bytes(0x02, 0x01, 0x00), Optional.of(0L)),
        Arguments.of(bytes(0x02, 0x01, 0x7f), Optional.of(127L)),
        Arguments.of(bytes(0x02, 0x02, 0x00, 0x80), Optional.of(128L)),
        Arguments.of(bytes(0x02, 0x01, 0xff), Optional.of(-1L)),
        Arguments.of(bytes(0x02, 0x02, 0xff, 0x7f), Optional.of(-129L)),
        Arguments.of(bytes(0x02, 0x08, 0x7f, 0xff, 0xff, 0xff, 0xff, 0xff, 0xff, 0xff), Optional.of(Long.MAX_VALUE)),
        Arguments.of(bytes(0x02, 0x09, 0x00, 0x80, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00), Optional.empty()),
        Arguments.of(bytes(0x02, 0x00), Optional.empty()),
        Arguments.of(bytes(0x04, 0x01, 0x05), Optional.empty()));
  }

  @ParameterizedTest
  @MethodSource
  void stringValue(final byte[] encoded, final Optional<String> expected) throws Asn1DecodingException {
    assertEquals(expected, new Asn1Reader(encoded).next().stringValue());
  }

  private static Stream<Arguments> stringValue() {
    return Stream.of(
        Arguments.of(bytes(0x0c, 0x03, 'a', 'b', 'c'), Optional.of("abc")),
        Arguments.of(bytes(0x0c, 0x02, 0xc3, 0xa9), Optional.of("é")),
        Arguments.of(bytes(0x0c, 0x00), Optional.of("")),
        Arguments.of(bytes(0x16, 0x02, '4', '+'), Optional.of("4+")),
        Arguments.of(bytes(0x0c, 0x02, 0xc3, 0x28), Optional.empty()),
        Arguments.of(bytes(0x16, 0x01, 0x80), Optional.empty()),
        Arguments.of(bytes(0x04, 0x01, 'a'), Optional.empty()),
        Arguments.of(bytes(0x02, 0x01, 0x05), Optional.empty()));
  }

  @Test
  void unwrap() throws Asn1DecodingException {
    final Asn1Object wrapped = new Asn1Reader(bytes(0x04, 0x05, 0x0c, 0x03, 'a', 'b', 'c')).next();

    assertEquals(Optional.of("abc"), wrapped.unwrap().flatMap(Asn1Object::stringValue));
    assertEquals(Optional.empty(), wrapped.stringValue());
  }

  @ParameterizedTest
  @MethodSource
  void unwrapFailure(final byte[] encoded) throws Asn1DecodingException {
    assertEquals(Optional.empty(), new Asn1Reader(encoded).next().unwrap());
  }

  private static Stream<Arguments> unwrapFailure() {
    return Stream.of(
        Arguments.of((Object) bytes(0x04, 0x00)),
        Arguments.of((Object) bytes(0x04, 0x01, 0x0c)),
        Arguments.of((Object) bytes(0x04, 0x02, 0x0c, 0x05)),
        Arguments.of((Object) bytes(0x0c, 0x03, 0x04, 0x01, 0x00)));
  }

  @Test
  void readerOverSlice() throws Asn1DecodingException {
    final byte[] encoded = bytes(0xff, 0xff, 0x02, 0x01, 0x09, 0xff);
    final Asn1Reader reader = new Asn1Reader(encoded, 2, 3);

    assertEquals(2, reader.position());
    assertEquals(Optional.of(9L), reader.next().integerValue());
    assertEquals(5, reader.position());
    assertFalse(reader.hasNext());
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 16, 64})
  void checkNestingDepthDefinite(final int depth) throws Asn1DecodingException {
    final Asn1Reader reader = new Asn1Reader(definiteNesting(depth));

    reader.checkNestingDepth(64);

    assertEquals(0, reader.position());
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 16, 64})
  void checkNestingDepthIndefinite(final int depth) throws Asn1DecodingException {
    new Asn1Reader(indefiniteNesting(depth, true)).checkNestingDepth(64);
  }

  @Test
  void checkNestingDepthIgnoresTrailingBytes() throws Asn1DecodingException {
    final ByteArrayOutputStream encoded = new ByteArrayOutputStream();
    encoded.writeBytes(indefiniteNesting(4, true));
    encoded.writeBytes(bytes(0x30, 0x80, 0x30, 0x80));

    new Asn1Reader(encoded.toByteArray()).checkNestingDepth(4);
  }

  @ParameterizedTest
  @MethodSource
  void checkNestingDepthRejected(final byte[] encoded) {
    assertThatExceptionOfType(Asn1DecodingException.class)
        .isThrownBy(() -> new Asn1Reader(encoded).checkNestingDepth(64));
  }

  private static Stream<Arguments> checkNestingDepthRejected() {
    return Stream.of(
        Arguments.of((Object) definiteNesting(65)),
        Arguments.of((Object) indefiniteNesting(65, true)),
        // Unterminated nesting far deeper than any receipt
        Arguments.of((Object) indefiniteNesting(10_000, false)),
        Arguments.of((Object) indefiniteNesting(4, false)),
        Arguments.of((Object) bytes()),
        Arguments.of((Object) bytes(0x04, 0x80, 0x00, 0x00)),
        Arguments.of((Object) bytes(0x30, 0x03, 0x04, 0x02, 0x00, 0x00)),
        Arguments.of((Object) bytes(0x30, 0x04, 0x30, 0x03, 0x05, 0x00, 0x05, 0x00)));
  }

  private static byte[] definiteNesting(final int depth) {
    ASN1Encodable encodable = DERNull.INSTANCE;

    for (int i = 0; i < depth; i++) {
      encodable = new DERSequence(encodable);
    }

    return ReceiptPayloadBuilder.encode(encodable);
  }

  private static byte[] indefiniteNesting(final int depth, final boolean terminated) {
    final ByteArrayOutputStream encoded = new ByteArrayOutputStream();

    for (int i = 0; i < depth; i++) {
      encoded.writeBytes(bytes(0x30, 0x80));
    }

    encoded.writeBytes(bytes(0x05, 0x00));

    if (terminated) {
      for (int i = 0; i < depth; i++) {
        encoded.writeBytes(bytes(0x00, 0x00));
      }
    }

    return encoded.toByteArray();
  }
}
