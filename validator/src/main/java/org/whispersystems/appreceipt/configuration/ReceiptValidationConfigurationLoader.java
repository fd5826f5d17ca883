/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.configuration;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.io.IOException;
import java.io.InputStream;
import java.util.Set;
import java.util.stream.Collectors;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;
import org.whispersystems.appreceipt.util.SystemMapper;

/**
 * Reads {@link ReceiptValidationConfiguration} documents from YAML and checks their constraints.
 */
public class ReceiptValidationConfigurationLoader {

  private static final Validator VALIDATOR = Validation.byDefaultProvider()
      .configure()
      .messageInterpolator(new ParameterMessageInterpolator())
      .buildValidatorFactory()
      .getValidator();

  private ReceiptValidationConfigurationLoader() {
  }

  /**
   * @throws IOException              if the document is not valid YAML or does not map onto the configuration
   * @throws IllegalArgumentException if the document violates a configuration constraint
   */
  public static ReceiptValidationConfiguration load(final InputStream yaml) throws IOException {
    return validate(SystemMapper.yamlMapper().readValue(yaml, ReceiptValidationConfiguration.class));
  }

  /**
   * @throws IOException              if the document is not valid YAML or does not map onto the configuration
   * @throws IllegalArgumentException if the document violates a configuration constraint
   */
  public static ReceiptValidationConfiguration load(final String yaml) throws IOException {
    return validate(SystemMapper.yamlMapper().readValue(yaml, ReceiptValidationConfiguration.class));
  }

  private static ReceiptValidationConfiguration validate(final ReceiptValidationConfiguration configuration) {
    final Set<ConstraintViolation<ReceiptValidationConfiguration>> violations = VALIDATOR.validate(configuration);

    if (!violations.isEmpty()) {
      throw new IllegalArgumentException("Invalid receipt validation configuration: " + violations.stream()
          .map(violation -> violation.getPropertyPath() + " " + violation.getMessage())
          .sorted()
          .collect(Collectors.joining(", ")));
    }

    return configuration;
  }
}
