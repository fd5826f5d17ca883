/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.util;

import java.math.BigInteger;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.cms.CMSObjectIdentifiers;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaCertStore;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.cms.CMSProcessableByteArray;
import org.bouncycastle.cms.CMSSignedDataGenerator;
import org.bouncycastle.cms.jcajce.JcaSignerInfoGeneratorBuilder;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.bouncycastle.operator.jcajce.JcaDigestCalculatorProviderBuilder;

/**
 * A throwaway root, intermediate and leaf certificate chain shaped like Apple's receipt signing chain, and helpers for
 * signing receipt payloads with the leaf.
 */
public class TestCertificateChain {

  private static final String SIGNATURE_ALGORITHM = "SHA256withRSA";
  private static final AtomicLong SERIAL_NUMBER = new AtomicLong(1);

  private final X509Certificate rootCertificate;
  private final X509Certificate intermediateCertificate;
  private final X509Certificate leafCertificate;
  private final PrivateKey leafPrivateKey;

  private TestCertificateChain(final X509Certificate rootCertificate,
      final X509Certificate intermediateCertificate,
      final X509Certificate leafCertificate,
      final PrivateKey leafPrivateKey) {

    this.rootCertificate = rootCertificate;
    this.intermediateCertificate = intermediateCertificate;
    this.leafCertificate = leafCertificate;
    this.leafPrivateKey = leafPrivateKey;
  }

  /**
   * Generates a chain whose certificates are valid from a month ago until a year from now.
   */
  public static TestCertificateChain generate() throws Exception {
    return generate(Instant.now().plus(Duration.ofDays(365)));
  }

  /**
   * Generates a chain whose intermediate certificate expires at the given instant.
   */
  public static TestCertificateChain generate(final Instant intermediateNotAfter) throws Exception {
    final Instant now = Instant.now();
    final Instant notBefore = now.minus(Duration.ofDays(30));
    final Instant notAfter = now.plus(Duration.ofDays(365));

    final KeyPair rootKeyPair = generateKeyPair();
    final KeyPair intermediateKeyPair = generateKeyPair();
    final KeyPair leafKeyPair = generateKeyPair();

    final X500Name rootName = new X500Name("CN=Test Root CA, O=Example Inc., C=US");
    final X500Name intermediateName = new X500Name("CN=Test Worldwide Developer Relations CA, O=Example Inc., C=US");
    final X500Name leafName = new X500Name("CN=Test Store Receipt Signing, O=Example Inc., C=US");

    final X509Certificate root = certificate(rootName, rootKeyPair.getPublic(), rootName, rootKeyPair.getPrivate(),
        notBefore, notAfter, true);
    final X509Certificate intermediate = certificate(intermediateName, intermediateKeyPair.getPublic(), rootName,
        rootKeyPair.getPrivate(), notBefore, intermediateNotAfter, true);
    final X509Certificate leaf = certificate(leafName, leafKeyPair.getPublic(), intermediateName,
        intermediateKeyPair.getPrivate(), now.minus(Duration.ofDays(1)), notAfter, false);

    return new TestCertificateChain(root, intermediate, leaf, leafKeyPair.getPrivate());
  }

  public byte[] encodedRootCertificate() throws Exception {
    return rootCertificate.getEncoded();
  }

  public X509Certificate leafCertificate() {
    return leafCertificate;
  }

  /**
   * Signs the given payload, embedding the leaf and intermediate certificates.
   */
  public byte[] sign(final byte[] payload) throws Exception {
    return sign(CMSObjectIdentifiers.data, payload);
  }

  public byte[] sign(final ASN1ObjectIdentifier contentType, final byte[] payload) throws Exception {
    final CMSSignedDataGenerator generator = certificatesOnlyGenerator(List.of(leafCertificate, intermediateCertificate));
    final ContentSigner contentSigner = new JcaContentSignerBuilder(SIGNATURE_ALGORITHM).build(leafPrivateKey);

    generator.addSignerInfoGenerator(new JcaSignerInfoGeneratorBuilder(new JcaDigestCalculatorProviderBuilder().build())
        .build(contentSigner, leafCertificate));

    return generator.generate(new CMSProcessableByteArray(contentType, payload), true).getEncoded();
  }

  /**
   * Signs the given payload but embeds only the intermediate certificate, leaving the signer's certificate out.
   */
  public byte[] signWithoutSignerCertificate(final byte[] payload) throws Exception {
    final CMSSignedDataGenerator generator = certificatesOnlyGenerator(List.of(intermediateCertificate));
    final ContentSigner contentSigner = new JcaContentSignerBuilder(SIGNATURE_ALGORITHM).build(leafPrivateKey);

    generator.addSignerInfoGenerator(new JcaSignerInfoGeneratorBuilder(new JcaDigestCalculatorProviderBuilder().build())
        .build(contentSigner, leafCertificate));

    return generator.generate(new CMSProcessableByteArray(payload), true).getEncoded();
  }

  /**
   * Wraps the given payload in signed data that has certificates but no signers.
   */
  public byte[] wrapWithoutSigners(final byte[] payload) throws Exception {
    return certificatesOnlyGenerator(List.of(leafCertificate, intermediateCertificate))
        .generate(new CMSProcessableByteArray(payload), true)
        .getEncoded();
  }

  private static CMSSignedDataGenerator certificatesOnlyGenerator(final List<X509Certificate> certificates)
      throws Exception {

    final CMSSignedDataGenerator generator = new CMSSignedDataGenerator();
    generator.addCertificates(new JcaCertStore(certificates));

    return generator;
  }

  private static KeyPair generateKeyPair() throws Exception {
    final KeyPairGenerator keyPairGenerator = KeyPairGenerator.getInstance("RSA");
    keyPairGenerator.initialize(2048);

    return keyPairGenerator.generateKeyPair();
  }

  private static X509Certificate certificate(final X500Name subject,
      final PublicKey subjectPublicKey,
      final X500Name issuer,
      final PrivateKey issuerPrivateKey,
      final Instant notBefore,
      final Instant notAfter,
      final boolean certificateAuthority) throws Exception {

    final X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(issuer,
        BigInteger.valueOf(SERIAL_NUMBER.getAndIncrement()),
        Date.from(notBefore),
        Date.from(notAfter),
        subject,
        subjectPublicKey);

    builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(certificateAuthority));
    builder.addExtension(Extension.keyUsage, true, new KeyUsage(certificateAuthority
        ? KeyUsage.keyCertSign | KeyUsage.cRLSign
        : KeyUsage.digitalSignature));

    final ContentSigner signer = new JcaContentSignerBuilder(SIGNATURE_ALGORITHM).build(issuerPrivateKey);

    return new JcaX509CertificateConverter().getCertificate(builder.build(signer));
  }
}
