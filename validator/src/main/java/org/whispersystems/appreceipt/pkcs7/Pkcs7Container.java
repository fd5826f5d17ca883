/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.pkcs7;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1InputStream;
import org.bouncycastle.asn1.ASN1OctetString;
import org.bouncycastle.asn1.cms.CMSObjectIdentifiers;
import org.bouncycastle.asn1.cms.ContentInfo;
import org.bouncycastle.asn1.cms.SignedData;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cms.CMSException;
import org.bouncycastle.cms.CMSSignedData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.appreceipt.ReceiptValidationError;
import org.whispersystems.appreceipt.ReceiptValidationException;
import org.whispersystems.appreceipt.asn1.Asn1DecodingException;
import org.whispersystems.appreceipt.asn1.Asn1Reader;

/**
 * The PKCS #7 container wrapping a receipt payload. Receipts are normally {@code signedData} whose encapsulated content
 * is {@code data}; a bare {@code data} container is also accepted here so that callers can tell an unsigned receipt
 * apart from one that is not a receipt at all.
 */
public class Pkcs7Container {

  private static final Logger logger = LoggerFactory.getLogger(Pkcs7Container.class);

  // Receipts nest about a dozen levels deep; BouncyCastle builds the tree recursively
  private static final int MAX_NESTING_DEPTH = 64;

  @Nullable
  private final CMSSignedData signedData;
  private final byte[] content;

  private Pkcs7Container(@Nullable final CMSSignedData signedData, final byte[] content) {
    this.signedData = signedData;
    this.content = content;
  }

  /**
   * Parses a BER or DER encoded PKCS #7 container.
   *
   * @param encoded the raw receipt bytes
   * @return the parsed container
   * @throws ReceiptValidationException with {@link ReceiptValidationError#EMPTY_RECEIPT_CONTENTS} if the bytes are not
   * a PKCS #7 container, if its values nest more than {@value #MAX_NESTING_DEPTH} levels deep, if the encapsulated
   * content type is not {@code data} or if the content octets are missing
   */
  public static Pkcs7Container extract(final byte[] encoded) throws ReceiptValidationException {
    try {
      new Asn1Reader(encoded).checkNestingDepth(MAX_NESTING_DEPTH);
    } catch (final Asn1DecodingException e) {
      logger.debug("Receipt is not a well-formed PKCS #7 container: {}", e.getMessage());
      throw new ReceiptValidationException(ReceiptValidationError.EMPTY_RECEIPT_CONTENTS, e);
    }

    final ContentInfo contentInfo;

    // Bytes after the container are ignored
    try (final ASN1InputStream asn1InputStream = new ASN1InputStream(encoded)) {
      contentInfo = ContentInfo.getInstance(asn1InputStream.readObject());
    } catch (final IOException | RuntimeException e) {
      logger.debug("Receipt is not a PKCS #7 container: {}", e.getMessage());
      throw new ReceiptValidationException(ReceiptValidationError.EMPTY_RECEIPT_CONTENTS, e);
    }

    if (contentInfo == null) {
      throw new ReceiptValidationException(ReceiptValidationError.EMPTY_RECEIPT_CONTENTS);
    }

    if (CMSObjectIdentifiers.data.equals(contentInfo.getContentType())) {
      return new Pkcs7Container(null, octets(contentInfo.getContent()));
    }

    if (!CMSObjectIdentifiers.signedData.equals(contentInfo.getContentType())) {
      logger.debug("Unexpected container content type: {}", contentInfo.getContentType());
      throw new ReceiptValidationException(ReceiptValidationError.EMPTY_RECEIPT_CONTENTS);
    }

    try {
      final ContentInfo encapsulatedContentInfo = SignedData.getInstance(contentInfo.getContent()).getEncapContentInfo();

      if (!CMSObjectIdentifiers.data.equals(encapsulatedContentInfo.getContentType())) {
        logger.debug("Unexpected encapsulated content type: {}", encapsulatedContentInfo.getContentType());
        throw new ReceiptValidationException(ReceiptValidationError.EMPTY_RECEIPT_CONTENTS);
      }

      return new Pkcs7Container(new CMSSignedData(contentInfo), octets(encapsulatedContentInfo.getContent()));
    } catch (final CMSException | RuntimeException e) {
      logger.debug("Malformed signed data: {}", e.getMessage());
      throw new ReceiptValidationException(ReceiptValidationError.EMPTY_RECEIPT_CONTENTS, e);
    }
  }

  private static byte[] octets(@Nullable final ASN1Encodable content) throws ReceiptValidationException {
    if (content instanceof ASN1OctetString octetString) {
      return octetString.getOctets();
    }

    throw new ReceiptValidationException(ReceiptValidationError.EMPTY_RECEIPT_CONTENTS);
  }

  /**
   * Checks that this container is signed data with at least one signer.
   *
   * @throws ReceiptValidationException with {@link ReceiptValidationError#RECEIPT_NOT_SIGNED} otherwise
   */
  public void checkSignaturePresent() throws ReceiptValidationException {
    if (signedData == null || signedData.getSignerInfos().getSigners().isEmpty()) {
      throw new ReceiptValidationException(ReceiptValidationError.RECEIPT_NOT_SIGNED);
    }
  }

  /**
   * @return the exact octets covered by the signature; this is the receipt payload
   */
  public byte[] signedContent() {
    return content.clone();
  }

  public List<X509CertificateHolder> certificates() {
    if (signedData == null) {
      return List.of();
    }

    final Collection<X509CertificateHolder> certificates = signedData.getCertificates().getMatches(null);
    return List.copyOf(certificates);
  }

  public Optional<CMSSignedData> signedData() {
    return Optional.ofNullable(signedData);
  }
}
