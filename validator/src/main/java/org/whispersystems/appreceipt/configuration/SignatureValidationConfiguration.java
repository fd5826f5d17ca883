/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.configuration;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import java.util.Base64;
import javax.annotation.Nullable;
import org.whispersystems.appreceipt.parameters.RootCertificateOrigin;
import org.whispersystems.appreceipt.parameters.SignatureValidation;

/**
 * @param enabled                 whether to verify receipt signatures; defaults to {@code true}
 * @param rootCertificateResource the classpath resource holding the trusted root certificate; defaults to
 *                                {@value RootCertificateOrigin#APPLE_ROOT_CERTIFICATE_RESOURCE_NAME}
 * @param rootCertificateBase64   the base64-encoded trusted root certificate; takes precedence over
 *                                {@code rootCertificateResource} when set
 */
public record SignatureValidationConfiguration(
    @JsonProperty("enabled") @Nullable Boolean enabled,
    @JsonProperty("rootCertificateResource") @NotBlank String rootCertificateResource,
    @JsonProperty("rootCertificateBase64") @Nullable @Pattern(regexp = ReceiptValidationConfiguration.BASE64_PATTERN)
    String rootCertificateBase64) {

  public SignatureValidationConfiguration {
    if (enabled == null) {
      enabled = true;
    }

    if (rootCertificateResource == null) {
      rootCertificateResource = RootCertificateOrigin.APPLE_ROOT_CERTIFICATE_RESOURCE_NAME;
    }
  }

  public static SignatureValidationConfiguration defaults() {
    return new SignatureValidationConfiguration(null, null, null);
  }

  public SignatureValidation toSignatureValidation() {
    if (!enabled) {
      return SignatureValidation.skip();
    }

    return SignatureValidation.validate(rootCertificateBase64 != null
        ? RootCertificateOrigin.of(Base64.getDecoder().decode(rootCertificateBase64))
        : RootCertificateOrigin.classpathResource(rootCertificateResource));
  }
}
