/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.util;

/**
 * Base class for checked exceptions that carry no stack trace. These exceptions describe an expected outcome of
 * processing untrusted input (a malformed or unsigned receipt, for example) and are converted into a result value
 * before they ever reach a log.
 */
public abstract class NoStackTraceException extends Exception {

  protected NoStackTraceException(final String message) {
    super(message, null, true, false);
  }

  protected NoStackTraceException(final String message, final Throwable cause) {
    super(message, cause, true, false);
  }
}
