/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.util.List;
import javax.annotation.Nullable;
import org.whispersystems.appreceipt.parameters.DeviceIdentifier;
import org.whispersystems.appreceipt.parameters.DeviceIdentifierProvider;
import org.whispersystems.appreceipt.parameters.ReceiptOrigin;
import org.whispersystems.appreceipt.parameters.ValidationParameters;

/**
 * A validation policy read from YAML; see {@link ReceiptValidationConfigurationLoader}. Omitted checks default to
 * enabled.
 *
 * @param validateSignaturePresence whether receipts must be signed
 * @param signatureValidation       whether and how to verify receipt signatures
 * @param validateHash              whether to check the receipt hash against the device identifier
 * @param deviceIdentifier          a fixed, base64-encoded device identifier; if absent, the current device's
 *                                  identifier is used
 * @param propertyValidations       receipt properties to check, in order
 */
public record ReceiptValidationConfiguration(
    @JsonProperty("validateSignaturePresence") @Nullable Boolean validateSignaturePresence,
    @JsonProperty("signatureValidation") @NotNull @Valid SignatureValidationConfiguration signatureValidation,
    @JsonProperty("validateHash") @Nullable Boolean validateHash,
    @JsonProperty("deviceIdentifier") @Nullable @Pattern(regexp = BASE64_PATTERN) String deviceIdentifier,
    @JsonProperty("propertyValidations") @NotNull List<@NotNull @Valid PropertyValidationConfiguration> propertyValidations) {

  static final String BASE64_PATTERN = "^(?:[A-Za-z0-9+/]{4})*(?:[A-Za-z0-9+/]{2}==|[A-Za-z0-9+/]{3}=)?$";

  public ReceiptValidationConfiguration {
    if (validateSignaturePresence == null) {
      validateSignaturePresence = true;
    }

    if (signatureValidation == null) {
      signatureValidation = SignatureValidationConfiguration.defaults();
    }

    if (validateHash == null) {
      validateHash = true;
    }

    if (propertyValidations == null) {
      propertyValidations = List.of();
    }
  }

  /**
   * Builds the parameters for validating a single receipt under this policy.
   *
   * @param receiptOrigin            where to load the receipt from
   * @param deviceIdentifierProvider looks up the current device's identifier when no fixed identifier is configured
   */
  public ValidationParameters toParameters(final ReceiptOrigin receiptOrigin,
      final DeviceIdentifierProvider deviceIdentifierProvider) {

    final ValidationParameters.Builder builder = ValidationParameters.builder(receiptOrigin)
        .validateSignaturePresence(validateSignaturePresence)
        .signatureValidation(signatureValidation.toSignatureValidation())
        .validateHash(validateHash)
        .deviceIdentifier(deviceIdentifier != null
            ? DeviceIdentifier.fromBase64(deviceIdentifier)
            : DeviceIdentifier.currentDevice(deviceIdentifierProvider));

    propertyValidations.forEach(propertyValidation -> builder.propertyValidation(propertyValidation.toPropertyValidation()));

    return builder.build();
  }
}
