/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.receipt;

/**
 * A receipt together with the undocumented attributes found alongside it.
 */
public record ParsedReceipt(Receipt receipt, UnofficialReceipt unofficialReceipt) {
}
