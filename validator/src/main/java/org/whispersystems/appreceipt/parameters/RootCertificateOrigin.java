/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.parameters;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Where to load the trusted root certificate from. The certificate is DER-encoded X.509.
 */
@FunctionalInterface
public interface RootCertificateOrigin {

  /**
   * The name of the classpath resource holding Apple's root certificate. It is not shipped with this library; the
   * embedding application is expected to provide it, for example from
   * <a href="https://www.apple.com/certificateauthority/AppleIncRootCertificate.cer">Apple's certificate authority</a>.
   */
  String APPLE_ROOT_CERTIFICATE_RESOURCE_NAME = "AppleIncRootCertificate.cer";

  /**
   * @return the encoded root certificate, or empty if it could not be found
   */
  Optional<byte[]> load() throws IOException;

  static RootCertificateOrigin of(final byte[] rootCertificate) {
    final byte[] copy = rootCertificate.clone();
    return () -> Optional.of(copy.clone());
  }

  /**
   * Looks the resource up through the calling thread's context class loader when the certificate is loaded, then
   * through the class loader of this library.
   *
   * @param resourceName the name of a resource relative to the root of the classpath
   */
  static RootCertificateOrigin classpathResource(final String resourceName) {
    return () -> {
      final ClassLoader contextClassLoader = Thread.currentThread().getContextClassLoader();

      if (contextClassLoader != null) {
        final Optional<byte[]> maybeResource = readResource(contextClassLoader, resourceName);

        if (maybeResource.isPresent()) {
          return maybeResource;
        }
      }

      return readResource(RootCertificateOrigin.class.getClassLoader(), resourceName);
    };
  }

  /**
   * @param resourceName the name of a resource relative to the root of the classpath
   * @param classLoader the class loader to look the resource up through
   */
  static RootCertificateOrigin classpathResource(final String resourceName, final ClassLoader classLoader) {
    return () -> readResource(classLoader, resourceName);
  }

  private static Optional<byte[]> readResource(final ClassLoader classLoader, final String resourceName)
      throws IOException {

    try (final InputStream stream = classLoader.getResourceAsStream(resourceName)) {
      if (stream == null) {
        return Optional.empty();
      }

      return Optional.of(stream.readAllBytes());
    }
  }

  static RootCertificateOrigin appleRootCertificate() {
    return classpathResource(APPLE_ROOT_CERTIFICATE_RESOURCE_NAME);
  }
}
