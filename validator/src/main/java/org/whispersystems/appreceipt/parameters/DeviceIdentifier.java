/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.parameters;

import com.google.common.base.Splitter;
import java.nio.ByteBuffer;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import javax.annotation.Nullable;

/**
 * The identifier of the device a receipt is expected to have been issued for. It is either a fixed value or the
 * identifier of the current device, looked up through a {@link DeviceIdentifierProvider} when validation runs.
 */
public final class DeviceIdentifier {

  private static final String DEFAULT_MAC_ADDRESS_SEPARATOR = ":";
  private static final int MAC_ADDRESS_LENGTH = 6;

  @Nullable
  private final byte[] identifier;

  @Nullable
  private final DeviceIdentifierProvider currentDeviceProvider;

  private DeviceIdentifier(@Nullable final byte[] identifier,
      @Nullable final DeviceIdentifierProvider currentDeviceProvider) {

    this.identifier = identifier;
    this.currentDeviceProvider = currentDeviceProvider;
  }

  public static DeviceIdentifier of(final byte[] identifier) {
    return new DeviceIdentifier(identifier.clone(), null);
  }

  public static DeviceIdentifier currentDevice(final DeviceIdentifierProvider currentDeviceProvider) {
    return new DeviceIdentifier(null, Objects.requireNonNull(currentDeviceProvider));
  }

  /**
   * @throws IllegalArgumentException if the given string is not valid base64
   */
  public static DeviceIdentifier fromBase64(final String base64Identifier) {
    return of(Base64.getDecoder().decode(base64Identifier));
  }

  /**
   * Builds an identifier from the 16 big-endian bytes of a UUID, as used for iOS vendor identifiers.
   */
  public static DeviceIdentifier fromUuid(final UUID uuid) {
    return of(ByteBuffer.allocate(16)
        .putLong(uuid.getMostSignificantBits())
        .putLong(uuid.getLeastSignificantBits())
        .array());
  }

  public static DeviceIdentifier fromMacAddress(final String macAddress) {
    return fromMacAddress(macAddress, DEFAULT_MAC_ADDRESS_SEPARATOR);
  }

  /**
   * Builds an identifier from a MAC address of the form {@code 00:0d:3f:cd:02:5f}.
   *
   * @param macAddress the MAC address
   * @param separator  the string between octets
   * @throws IllegalArgumentException unless the address is exactly six hexadecimal octets
   */
  public static DeviceIdentifier fromMacAddress(final String macAddress, final String separator) {
    final List<String> octets = Splitter.on(separator).splitToList(macAddress);

    if (octets.size() != MAC_ADDRESS_LENGTH) {
      throw new IllegalArgumentException("MAC address must have exactly " + MAC_ADDRESS_LENGTH + " octets");
    }

    final byte[] identifier = new byte[MAC_ADDRESS_LENGTH];

    for (int i = 0; i < MAC_ADDRESS_LENGTH; i++) {
      final String octet = octets.get(i);

      if (octet.isEmpty() || octet.length() > 2 || !octet.chars().allMatch(HexFormat::isHexDigit)) {
        throw new IllegalArgumentException("Invalid MAC address octet: " + octet);
      }

      identifier[i] = (byte) HexFormat.fromHexDigits(octet);
    }

    return of(identifier);
  }

  public boolean isCurrentDevice() {
    return currentDeviceProvider != null;
  }

  /**
   * @return the identifier bytes, or empty if this refers to the current device and its identifier is unavailable
   */
  public Optional<byte[]> resolve() {
    if (identifier != null) {
      return Optional.of(identifier.clone());
    }

    return currentDeviceProvider.currentDeviceIdentifier();
  }
}
