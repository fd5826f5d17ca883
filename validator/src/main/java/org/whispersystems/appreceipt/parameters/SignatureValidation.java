/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.parameters;

import java.util.Optional;

/**
 * Whether to check a receipt's signature and, if so, which root certificate to trust.
 */
public record SignatureValidation(Optional<RootCertificateOrigin> rootCertificateOrigin) {

  public static SignatureValidation skip() {
    return new SignatureValidation(Optional.empty());
  }

  public static SignatureValidation validate(final RootCertificateOrigin rootCertificateOrigin) {
    return new SignatureValidation(Optional.of(rootCertificateOrigin));
  }

  public boolean enabled() {
    return rootCertificateOrigin.isPresent();
  }
}
