/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.util;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;

public class CertificateUtil {

  private CertificateUtil() {
  }

  /**
   * Parses a single DER-encoded X.509 certificate.
   *
   * @param derBytes the encoded certificate
   * @return the parsed certificate
   * @throws CertificateException if the bytes do not begin with a well-formed certificate
   */
  public static X509Certificate getCertificate(final byte[] derBytes) throws CertificateException {
    final CertificateFactory certificateFactory = CertificateFactory.getInstance("X.509");

    try (final ByteArrayInputStream derInputStream = new ByteArrayInputStream(derBytes)) {
      final X509Certificate certificate = (X509Certificate) certificateFactory.generateCertificate(derInputStream);

      if (certificate == null) {
        throw new CertificateException("No certificate found in parsing!");
      }

      return certificate;
    } catch (IOException e) {
      throw new CertificateException(e);
    }
  }
}
