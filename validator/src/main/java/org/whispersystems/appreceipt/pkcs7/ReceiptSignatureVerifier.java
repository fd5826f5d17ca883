/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.pkcs7;

import io.micrometer.core.instrument.Metrics;
import java.security.InvalidAlgorithmParameterException;
import java.security.NoSuchAlgorithmException;
import java.security.Provider;
import java.security.cert.CertPathBuilder;
import java.security.cert.CertPathBuilderException;
import java.security.cert.CertStore;
import java.security.cert.CertificateException;
import java.security.cert.CollectionCertStoreParameters;
import java.security.cert.PKIXBuilderParameters;
import java.security.cert.TrustAnchor;
import java.security.cert.X509CertSelector;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cms.CMSException;
import org.bouncycastle.cms.CMSSignedData;
import org.bouncycastle.cms.CMSVerifierCertificateNotValidException;
import org.bouncycastle.cms.SignerInformation;
import org.bouncycastle.cms.jcajce.JcaSimpleSignerInfoVerifierBuilder;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.operator.OperatorCreationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.appreceipt.ReceiptValidationError;
import org.whispersystems.appreceipt.ReceiptValidationException;
import org.whispersystems.appreceipt.metrics.MetricsUtil;
import org.whispersystems.appreceipt.util.CertificateUtil;

/**
 * Verifies that a receipt container was signed by a certificate chaining to a single trusted root.
 * <p>
 * The trust store holds only the supplied root. Certificate paths are validated at the time reported by this
 * verifier's clock, with revocation checking disabled.
 */
public class ReceiptSignatureVerifier {

  private static final Logger logger = LoggerFactory.getLogger(ReceiptSignatureVerifier.class);

  private static final String AUTHENTICITY_FAILURE_COUNTER_NAME =
      MetricsUtil.name(ReceiptSignatureVerifier.class, "authenticityFailure");

  private static final Provider BOUNCY_CASTLE_PROVIDER = new BouncyCastleProvider();

  private final Clock clock;

  public ReceiptSignatureVerifier(final Clock clock) {
    this.clock = clock;
  }

  /**
   * Checks that every signer of the given container holds a certificate chaining to the given root and that every
   * signature covers the container's content.
   *
   * @param container       the receipt container
   * @param rootCertificate the DER-encoded trusted root certificate
   * @throws ReceiptValidationException with {@link ReceiptValidationError#MALFORMED_APPLE_ROOT_CERTIFICATE} if the root
   * cannot be parsed, {@link ReceiptValidationError#CERTIFICATE_CHAIN_INVALID} if a signer's certificate is missing or
   * does not chain to the root, or {@link ReceiptValidationError#RECEIPT_SIGNATURE_INVALID} if the container is unsigned
   * or a signature does not verify
   */
  public void checkAuthenticity(final Pkcs7Container container, final byte[] rootCertificate)
      throws ReceiptValidationException {

    final X509Certificate root;

    try {
      root = CertificateUtil.getCertificate(rootCertificate);
    } catch (final CertificateException e) {
      logger.info("Failed to parse root certificate", e);
      throw failure(ReceiptValidationError.MALFORMED_APPLE_ROOT_CERTIFICATE, e);
    }

    final CMSSignedData signedData = container.signedData()
        .orElseThrow(() -> failure(ReceiptValidationError.RECEIPT_SIGNATURE_INVALID, null));

    final Collection<SignerInformation> signers = signedData.getSignerInfos().getSigners();

    if (signers.isEmpty()) {
      throw failure(ReceiptValidationError.RECEIPT_SIGNATURE_INVALID, null);
    }

    final List<X509Certificate> embeddedCertificates = new ArrayList<>();

    for (final X509CertificateHolder certificateHolder : container.certificates()) {
      embeddedCertificates.add(toX509Certificate(certificateHolder));
    }

    for (final SignerInformation signer : signers) {
      final X509Certificate signerCertificate = toX509Certificate(findSignerCertificate(signedData, signer));

      validateCertificatePath(signerCertificate, root, embeddedCertificates);
      verifySignature(signer, signerCertificate);
    }
  }

  private void validateCertificatePath(final X509Certificate signerCertificate,
      final X509Certificate root,
      final List<X509Certificate> embeddedCertificates) throws ReceiptValidationException {

    final X509CertSelector targetSelector = new X509CertSelector();
    targetSelector.setCertificate(signerCertificate);

    try {
      final PKIXBuilderParameters parameters =
          new PKIXBuilderParameters(Set.of(new TrustAnchor(root, null)), targetSelector);

      parameters.setRevocationEnabled(false);
      parameters.setDate(Date.from(clock.instant()));
      parameters.addCertStore(
          CertStore.getInstance("Collection", new CollectionCertStoreParameters(embeddedCertificates)));

      CertPathBuilder.getInstance("PKIX").build(parameters);
    } catch (final CertPathBuilderException e) {
      logger.info("Failed to build certificate path for receipt signer", e);
      throw failure(ReceiptValidationError.CERTIFICATE_CHAIN_INVALID, e);
    } catch (final InvalidAlgorithmParameterException | NoSuchAlgorithmException e) {
      // PKIX and the Collection cert store are mandatory for every JRE
      throw new AssertionError(e);
    }
  }

  private static void verifySignature(final SignerInformation signer, final X509Certificate signerCertificate)
      throws ReceiptValidationException {

    final boolean verified;

    try {
      verified = signer.verify(new JcaSimpleSignerInfoVerifierBuilder()
          .setProvider(BOUNCY_CASTLE_PROVIDER)
          .build(signerCertificate));
    } catch (final CMSVerifierCertificateNotValidException e) {
      logger.info("Signer certificate was not valid at signing time", e);
      throw failure(ReceiptValidationError.CERTIFICATE_CHAIN_INVALID, e);
    } catch (final CMSException | OperatorCreationException e) {
      logger.info("Failed to verify receipt signature", e);
      throw failure(ReceiptValidationError.RECEIPT_SIGNATURE_INVALID, e);
    }

    if (!verified) {
      logger.info("Receipt signature did not verify");
      throw failure(ReceiptValidationError.RECEIPT_SIGNATURE_INVALID, null);
    }
  }

  @SuppressWarnings("unchecked")
  private static X509CertificateHolder findSignerCertificate(final CMSSignedData signedData,
      final SignerInformation signer) throws ReceiptValidationException {

    final Collection<X509CertificateHolder> matches = signedData.getCertificates().getMatches(signer.getSID());

    if (matches.isEmpty()) {
      logger.info("No embedded certificate matches receipt signer");
      throw failure(ReceiptValidationError.CERTIFICATE_CHAIN_INVALID, null);
    }

    return matches.iterator().next();
  }

  private static X509Certificate toX509Certificate(final X509CertificateHolder certificateHolder)
      throws ReceiptValidationException {

    try {
      return new JcaX509CertificateConverter().getCertificate(certificateHolder);
    } catch (final CertificateException e) {
      logger.info("Failed to convert embedded certificate", e);
      throw failure(ReceiptValidationError.CERTIFICATE_CHAIN_INVALID, e);
    }
  }

  private static ReceiptValidationException failure(final ReceiptValidationError error,
      @Nullable final Throwable cause) {

    Metrics.counter(AUTHENTICITY_FAILURE_COUNTER_NAME, "reason", error.name()).increment();

    return cause != null ? new ReceiptValidationException(error, cause) : new ReceiptValidationException(error);
  }
}
