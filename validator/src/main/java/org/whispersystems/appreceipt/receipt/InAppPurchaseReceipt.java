/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.receipt;

import java.time.Instant;
import javax.annotation.Nullable;

/**
 * A single in-app purchase. Fields are independently optional; a receipt may omit any of them.
 *
 * @param introductoryPricePeriod whether the purchase was made in an introductory price period, as transmitted
 */
public record InAppPurchaseReceipt(
    @Nullable Long quantity,
    @Nullable String productIdentifier,
    @Nullable String transactionIdentifier,
    @Nullable String originalTransactionIdentifier,
    @Nullable Instant purchaseDate,
    @Nullable Instant originalPurchaseDate,
    @Nullable Instant subscriptionExpirationDate,
    @Nullable Instant cancellationDate,
    @Nullable Long webOrderLineItemId,
    @Nullable Boolean introductoryPricePeriod) {
}
