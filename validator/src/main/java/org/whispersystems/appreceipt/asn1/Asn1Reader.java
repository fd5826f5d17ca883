/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.asn1;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * A forward-only cursor over a run of DER/BER TLVs. Each call to {@link #next()} decodes exactly one TLV and advances
 * past it; the reader never looks at bytes beyond its limit.
 * <p>
 * Only definite lengths are supported by {@link #next()}. Lengths may use up to four length octets.
 */
public class Asn1Reader {

  private static final int MAX_LENGTH_OCTETS = 4;
  private static final int MAX_TAG_NUMBER_OCTETS = 4;

  private static final int INDEFINITE_LENGTH = -1;

  private final byte[] bytes;
  private final int limit;

  private int position;

  private record Header(int identifier, int tagNumber, int length, int valueOffset) {

    boolean constructed() {
      return (identifier & Asn1Tag.CONSTRUCTED) != 0;
    }

    boolean indefinite() {
      return length == INDEFINITE_LENGTH;
    }
  }

  public Asn1Reader(final byte[] bytes) {
    this(bytes, 0, bytes.length);
  }

  public Asn1Reader(final byte[] bytes, final int offset, final int length) {
    Objects.checkFromIndexSize(offset, length, bytes.length);

    this.bytes = bytes;
    this.position = offset;
    this.limit = offset + length;
  }

  public boolean hasNext() {
    return position < limit;
  }

  public int position() {
    return position;
  }

  /**
   * Decodes the TLV at the current position and advances past it.
   *
   * @return the decoded TLV
   * @throws Asn1DecodingException if no bytes remain, or if the identifier or length is truncated, indefinite,
   * oversized or points past the end of this reader
   */
  public Asn1Object next() throws Asn1DecodingException {
    if (!hasNext()) {
      throw new Asn1DecodingException("No TLV at offset " + position);
    }

    final Header header = readHeader(position);

    if (header.indefinite()) {
      throw new Asn1DecodingException("Indefinite length at offset " + position);
    }

    final Asn1Object object =
        new Asn1Object(bytes, header.identifier(), header.tagNumber(), header.length(), header.valueOffset());
    position = object.nextOffset();

    return object;
  }

  /**
   * Walks the BER element at the current position header by header, without building it, and checks that its
   * constructed values nest at most {@code maxDepth} levels deep. Indefinite lengths and their end-of-contents markers
   * are accepted here. Bytes after the element are not examined and the position is not advanced.
   *
   * @param maxDepth the greatest number of constructed values that may enclose one another
   * @throws Asn1DecodingException if the element nests too deeply, is truncated or has a child that overruns its
   * parent
   */
  public void checkNestingDepth(final int maxDepth) throws Asn1DecodingException {
    // End offsets of the enclosing constructed values, innermost first
    final Deque<Integer> enclosingEnds = new ArrayDeque<>();
    int offset = position;

    do {
      if (!enclosingEnds.isEmpty() && enclosingEnds.peek() == INDEFINITE_LENGTH && isEndOfContents(offset)) {
        enclosingEnds.pop();
        offset += 2;
      } else {
        final Header header = readHeader(offset);

        if (header.constructed()) {
          if (enclosingEnds.size() >= maxDepth) {
            throw new Asn1DecodingException("Nesting deeper than " + maxDepth + " levels at offset " + offset);
          }

          enclosingEnds.push(header.indefinite() ? INDEFINITE_LENGTH : header.valueOffset() + header.length());
          offset = header.valueOffset();
        } else if (header.indefinite()) {
          throw new Asn1DecodingException("Indefinite length on primitive value at offset " + offset);
        } else {
          offset = header.valueOffset() + header.length();
        }
      }

      while (!enclosingEnds.isEmpty() && enclosingEnds.peek() != INDEFINITE_LENGTH && offset >= enclosingEnds.peek()) {
        if (offset > enclosingEnds.peek()) {
          throw new Asn1DecodingException("Value overruns its parent at offset " + offset);
        }

        enclosingEnds.pop();
      }
    } while (!enclosingEnds.isEmpty());
  }

  private boolean isEndOfContents(final int offset) {
    return offset + 1 < limit && bytes[offset] == 0 && bytes[offset + 1] == 0;
  }

  private Header readHeader(final int start) throws Asn1DecodingException {
    int offset = start;

    final int identifier = readOctet(offset++, start);
    int tagNumber = identifier & Asn1Tag.HIGH_TAG_NUMBER;

    if (tagNumber == Asn1Tag.HIGH_TAG_NUMBER) {
      tagNumber = 0;

      int octet;
      int tagNumberOctets = 0;

      do {
        if (++tagNumberOctets > MAX_TAG_NUMBER_OCTETS) {
          throw new Asn1DecodingException("Tag number too large at offset " + start);
        }

        octet = readOctet(offset++, start);
        tagNumber = (tagNumber << 7) | (octet & 0x7f);
      } while ((octet & 0x80) != 0);
    }

    final int length;
    final int initialLengthOctet = readOctet(offset++, start);

    if ((initialLengthOctet & 0x80) == 0) {
      length = initialLengthOctet;
    } else {
      final int lengthOctets = initialLengthOctet & 0x7f;

      if (lengthOctets == 0) {
        return new Header(identifier, tagNumber, INDEFINITE_LENGTH, offset);
      }

      if (lengthOctets > MAX_LENGTH_OCTETS) {
        throw new Asn1DecodingException("Length uses " + lengthOctets + " octets at offset " + start);
      }

      long longLength = 0;
      for (int i = 0; i < lengthOctets; i++) {
        longLength = (longLength << 8) | readOctet(offset++, start);
      }

      if (longLength > Integer.MAX_VALUE) {
        throw new Asn1DecodingException("Length too large at offset " + start);
      }

      length = (int) longLength;
    }

    if (length > limit - offset) {
      throw new Asn1DecodingException(
          "Length " + length + " exceeds " + (limit - offset) + " remaining bytes at offset " + start);
    }

    return new Header(identifier, tagNumber, length, offset);
  }

  private int readOctet(final int offset, final int start) throws Asn1DecodingException {
    if (offset >= limit) {
      throw new Asn1DecodingException("Truncated TLV at offset " + start);
    }

    return bytes[offset] & 0xff;
  }
}
