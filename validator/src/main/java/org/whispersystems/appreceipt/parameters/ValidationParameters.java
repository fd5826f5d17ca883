/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.whispersystems.appreceipt.validation.PropertyValidation;

/**
 * The checks to run for a single receipt validation.
 *
 * @param receiptOrigin             where to load the receipt from
 * @param deviceIdentifier          the device the receipt must have been issued for; only used for the hash check
 * @param validateSignaturePresence whether the receipt must be signed
 * @param signatureValidation       whether to verify the receipt's signature against a trusted root
 * @param validateHash              whether to check the receipt's hash against the device identifier
 * @param propertyValidations       property checks, run in order
 */
public record ValidationParameters(
    ReceiptOrigin receiptOrigin,
    DeviceIdentifier deviceIdentifier,
    boolean validateSignaturePresence,
    SignatureValidation signatureValidation,
    boolean validateHash,
    List<PropertyValidation> propertyValidations) {

  public ValidationParameters {
    Objects.requireNonNull(receiptOrigin);
    Objects.requireNonNull(deviceIdentifier);
    Objects.requireNonNull(signatureValidation);
    propertyValidations = List.copyOf(propertyValidations);
  }

  /**
   * Returns a builder whose defaults run every check: signature presence, signature validation against
   * {@link RootCertificateOrigin#appleRootCertificate()}, and the hash check for the current device. No properties are
   * validated by default.
   */
  public static Builder builder(final ReceiptOrigin receiptOrigin) {
    return new Builder(receiptOrigin);
  }

  public static class Builder {

    private final ReceiptOrigin receiptOrigin;
    private DeviceIdentifier deviceIdentifier = DeviceIdentifier.currentDevice(DeviceIdentifierProvider.unavailable());
    private boolean validateSignaturePresence = true;
    private SignatureValidation signatureValidation =
        SignatureValidation.validate(RootCertificateOrigin.appleRootCertificate());
    private boolean validateHash = true;
    private final List<PropertyValidation> propertyValidations = new ArrayList<>();

    private Builder(final ReceiptOrigin receiptOrigin) {
      this.receiptOrigin = Objects.requireNonNull(receiptOrigin);
    }

    public Builder deviceIdentifier(final DeviceIdentifier deviceIdentifier) {
      this.deviceIdentifier = deviceIdentifier;
      return this;
    }

    public Builder validateSignaturePresence(final boolean validateSignaturePresence) {
      this.validateSignaturePresence = validateSignaturePresence;
      return this;
    }

    public Builder signatureValidation(final SignatureValidation signatureValidation) {
      this.signatureValidation = signatureValidation;
      return this;
    }

    public Builder validateHash(final boolean validateHash) {
      this.validateHash = validateHash;
      return this;
    }

    public Builder propertyValidation(final PropertyValidation propertyValidation) {
      this.propertyValidations.add(propertyValidation);
      return this;
    }

    public Builder propertyValidations(final List<PropertyValidation> propertyValidations) {
      this.propertyValidations.addAll(propertyValidations);
      return this;
    }

    /**
     * Skips every check, leaving only parsing.
     */
    public Builder skipAllValidation() {
      this.validateSignaturePresence = false;
      this.signatureValidation = SignatureValidation.skip();
      this.validateHash = false;
      this.propertyValidations.clear();
      return this;
    }

    public ValidationParameters build() {
      return new ValidationParameters(receiptOrigin, deviceIdentifier, validateSignaturePresence, signatureValidation,
          validateHash, propertyValidations);
    }
  }
}
