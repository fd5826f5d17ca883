/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt;

import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.Metrics;
import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.appreceipt.metrics.MetricsUtil;
import org.whispersystems.appreceipt.parameters.DeviceIdentifier;
import org.whispersystems.appreceipt.parameters.ReceiptOrigin;
import org.whispersystems.appreceipt.parameters.RootCertificateOrigin;
import org.whispersystems.appreceipt.parameters.ValidationParameters;
import org.whispersystems.appreceipt.pkcs7.Pkcs7Container;
import org.whispersystems.appreceipt.pkcs7.ReceiptSignatureVerifier;
import org.whispersystems.appreceipt.receipt.ParsedReceipt;
import org.whispersystems.appreceipt.receipt.Receipt;
import org.whispersystems.appreceipt.receipt.ReceiptDecoder;
import org.whispersystems.appreceipt.validation.HashValidator;
import org.whispersystems.appreceipt.validation.PropertyValidation;

/**
 * Validates and parses App Store receipts on the device they were issued for.
 * <p>
 * Validation runs in a fixed order: load the receipt, extract its PKCS #7 container, check that it is signed, verify
 * the signature against a trusted root, decode the payload, compare receipt properties with expected values, and
 * finally check the receipt hash against the device identifier. The first failing step determines the result.
 *
 * @see <a href="https://developer.apple.com/library/archive/releasenotes/General/ValidateAppStoreReceipt/Introduction.html">Receipt Validation Programming Guide</a>
 */
public class AppReceiptValidator {

  private static final Logger logger = LoggerFactory.getLogger(AppReceiptValidator.class);

  private static final String VALIDATION_COUNTER_NAME = MetricsUtil.name(AppReceiptValidator.class, "validations");
  private static final String OUTCOME_TAG_NAME = "outcome";

  private final ReceiptDecoder receiptDecoder;
  private final ReceiptSignatureVerifier signatureVerifier;

  public AppReceiptValidator() {
    this(Clock.systemUTC());
  }

  /**
   * @param clock the clock that determines when signer certificates must be valid
   */
  public AppReceiptValidator(final Clock clock) {
    this(new ReceiptDecoder(), new ReceiptSignatureVerifier(clock));
  }

  @VisibleForTesting
  AppReceiptValidator(final ReceiptDecoder receiptDecoder, final ReceiptSignatureVerifier signatureVerifier) {
    this.receiptDecoder = receiptDecoder;
    this.signatureVerifier = signatureVerifier;
  }

  /**
   * Validates a receipt. This method never throws; any failure, expected or not, is reported in the returned result.
   *
   * @param parameters the checks to run
   * @return the validated receipt, or the reason validation failed
   */
  public ReceiptValidationResult validateReceipt(final ValidationParameters parameters) {
    @Nullable final byte[] deviceIdentifier = resolveDeviceIdentifier(parameters.deviceIdentifier()).orElse(null);
    @Nullable byte[] receiptData = null;

    ReceiptValidationResult result;

    try {
      receiptData = loadReceipt(parameters.receiptOrigin());
      final Receipt receipt = validateLoadedReceipt(receiptData, deviceIdentifier, parameters);

      result = ReceiptValidationResult.success(receipt, receiptData, deviceIdentifier);
    } catch (final ReceiptValidationException e) {
      result = ReceiptValidationResult.error(e.getError(), receiptData, deviceIdentifier);
    } catch (final RuntimeException e) {
      logger.warn("Unexpected failure while validating receipt", e);
      result = ReceiptValidationResult.error(ReceiptValidationError.UNKNOWN, receiptData, deviceIdentifier);
    }

    Metrics.counter(VALIDATION_COUNTER_NAME, OUTCOME_TAG_NAME,
        result.getError().map(Enum::name).orElse("success")).increment();

    return result;
  }

  private Receipt validateLoadedReceipt(final byte[] receiptData,
      @Nullable final byte[] deviceIdentifier,
      final ValidationParameters parameters) throws ReceiptValidationException {

    final Pkcs7Container container = Pkcs7Container.extract(receiptData);

    if (parameters.validateSignaturePresence()) {
      container.checkSignaturePresent();
    }

    if (parameters.signatureValidation().rootCertificateOrigin().isPresent()) {
      final byte[] rootCertificate = loadRootCertificate(parameters.signatureValidation().rootCertificateOrigin().get());
      signatureVerifier.checkAuthenticity(container, rootCertificate);
    }

    final Receipt receipt = receiptDecoder.decode(container.signedContent(), false).receipt();

    validateProperties(receipt, parameters.propertyValidations());

    if (parameters.validateHash()) {
      if (deviceIdentifier == null) {
        throw new ReceiptValidationException(ReceiptValidationError.DEVICE_IDENTIFIER_NOT_DETERMINABLE);
      }

      HashValidator.validateHash(receipt, deviceIdentifier);
    }

    return receipt;
  }

  /**
   * Parses a receipt without validating it.
   *
   * @throws ReceiptValidationException if the receipt cannot be loaded or parsed
   */
  public Receipt parseReceipt(final ReceiptOrigin origin) throws ReceiptValidationException {
    return parse(origin, false).receipt();
  }

  /**
   * Parses a receipt, including its undocumented attributes, without validating it.
   *
   * @throws ReceiptValidationException if the receipt cannot be loaded or parsed
   */
  public ParsedReceipt parseUnofficialReceipt(final ReceiptOrigin origin) throws ReceiptValidationException {
    return parse(origin, true);
  }

  /**
   * Runs each of the given property validations in order, stopping at the first failure.
   *
   * @throws ReceiptValidationException with the first failing validation's error
   */
  public void validateProperties(final Receipt receipt, final List<PropertyValidation> propertyValidations)
      throws ReceiptValidationException {

    for (final PropertyValidation propertyValidation : propertyValidations) {
      propertyValidation.validate(receipt);
    }
  }

  private ParsedReceipt parse(final ReceiptOrigin origin, final boolean collectUnofficialAttributes)
      throws ReceiptValidationException {

    final Pkcs7Container container = Pkcs7Container.extract(loadReceipt(origin));
    return receiptDecoder.decode(container.signedContent(), collectUnofficialAttributes);
  }

  private static byte[] loadReceipt(final ReceiptOrigin origin) throws ReceiptValidationException {
    final Optional<byte[]> maybeReceiptData;

    try {
      maybeReceiptData = origin.load();
    } catch (final IOException | RuntimeException e) {
      logger.info("Failed to load receipt", e);
      throw new ReceiptValidationException(ReceiptValidationError.COULD_NOT_FIND_RECEIPT, e);
    }

    return absentIfNull(maybeReceiptData)
        .orElseThrow(() -> new ReceiptValidationException(ReceiptValidationError.COULD_NOT_FIND_RECEIPT));
  }

  private static byte[] loadRootCertificate(final RootCertificateOrigin origin) throws ReceiptValidationException {
    final Optional<byte[]> maybeRootCertificate;

    try {
      maybeRootCertificate = origin.load();
    } catch (final IOException | RuntimeException e) {
      logger.info("Failed to load root certificate", e);
      throw new ReceiptValidationException(ReceiptValidationError.APPLE_ROOT_CERTIFICATE_NOT_FOUND, e);
    }

    return absentIfNull(maybeRootCertificate)
        .orElseThrow(() -> new ReceiptValidationException(ReceiptValidationError.APPLE_ROOT_CERTIFICATE_NOT_FOUND));
  }

  private static Optional<byte[]> resolveDeviceIdentifier(final DeviceIdentifier deviceIdentifier) {
    try {
      return absentIfNull(deviceIdentifier.resolve());
    } catch (final RuntimeException e) {
      logger.info("Failed to determine device identifier", e);
      return Optional.empty();
    }
  }

  // Collaborators are supplied by the embedding application and may return null instead of an empty optional
  private static <T> Optional<T> absentIfNull(@Nullable final Optional<T> maybeValue) {
    return maybeValue != null ? maybeValue : Optional.empty();
  }
}
