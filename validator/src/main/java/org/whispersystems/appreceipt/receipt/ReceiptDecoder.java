/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.appreceipt.receipt;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.appreceipt.ReceiptValidationError;
import org.whispersystems.appreceipt.ReceiptValidationException;
import org.whispersystems.appreceipt.asn1.Asn1DecodingException;
import org.whispersystems.appreceipt.asn1.Asn1Object;
import org.whispersystems.appreceipt.asn1.Asn1Reader;

/**
 * Decodes the signed content of an App Store receipt.
 * <p>
 * The payload is a SET of attribute SEQUENCEs, each holding an INTEGER type, an INTEGER version and an OCTET STRING
 * value. Attribute 17 holds a nested SET of the same shape describing one in-app purchase.
 */
public class ReceiptDecoder {

  private static final Logger logger = LoggerFactory.getLogger(ReceiptDecoder.class);

  @FunctionalInterface
  private interface AttributeConsumer {

    void accept(int type, Asn1Object value) throws ReceiptValidationException;
  }

  /**
   * Decodes a receipt payload.
   *
   * @param content                      the signed content of the receipt container
   * @param collectUnofficialAttributes  whether to collect undocumented top-level attributes; if {@code false} the
   *                                     returned {@link UnofficialReceipt} is empty
   * @return the decoded receipt
   * @throws ReceiptValidationException with {@link ReceiptValidationError#MALFORMED_RECEIPT} or
   *                                    {@link ReceiptValidationError#MALFORMED_IN_APP_PURCHASE_RECEIPT} if the payload
   *                                    does not have the expected structure
   */
  public ParsedReceipt decode(final byte[] content, final boolean collectUnofficialAttributes)
      throws ReceiptValidationException {

    final ReceiptFields receipt = new ReceiptFields();
    final List<UnofficialReceipt.Entry> unofficialEntries = new ArrayList<>();

    try {
      forEachAttribute(new Asn1Reader(content), (type, value) -> {
        final Optional<ReceiptAttribute> maybeAttribute = ReceiptAttribute.fromType(type);

        if (maybeAttribute.isEmpty()) {
          if (collectUnofficialAttributes) {
            unofficialEntries.add(decodeUnofficialEntry(type, value));
          }

          return;
        }

        switch (maybeAttribute.get()) {
          case BUNDLE_IDENTIFIER -> {
            receipt.bundleIdData = value.bytes();
            receipt.bundleIdentifier = unwrappedString(value);
          }
          case APP_VERSION -> receipt.appVersion = unwrappedString(value);
          case OPAQUE_VALUE -> receipt.opaqueValue = value.bytes();
          case SHA1_HASH -> receipt.sha1Hash = value.bytes();
          case RECEIPT_CREATION_DATE -> receipt.receiptCreationDate = unwrappedDate(value);
          case IN_APP_PURCHASE_RECEIPT -> receipt.inAppPurchaseReceipts.add(decodeInAppPurchaseReceipt(value));
          case ORIGINAL_APP_VERSION -> receipt.originalAppVersion = unwrappedString(value);
          case EXPIRATION_DATE -> receipt.expirationDate = unwrappedDate(value);
        }
      });
    } catch (final Asn1DecodingException e) {
      logger.debug("Malformed receipt payload: {}", e.getMessage());
      throw new ReceiptValidationException(ReceiptValidationError.MALFORMED_RECEIPT, e);
    }

    return new ParsedReceipt(receipt.build(), new UnofficialReceipt(unofficialEntries));
  }

  private static InAppPurchaseReceipt decodeInAppPurchaseReceipt(final Asn1Object attributeValue)
      throws ReceiptValidationException {

    final InAppPurchaseFields inAppPurchase = new InAppPurchaseFields();

    try {
      forEachAttribute(attributeValue.contents(), (type, wrappedValue) -> {
        final Optional<InAppPurchaseAttribute> maybeAttribute = InAppPurchaseAttribute.fromType(type);
        final Optional<Asn1Object> maybeValue = wrappedValue.unwrap();

        if (maybeAttribute.isEmpty() || maybeValue.isEmpty()) {
          return;
        }

        final Asn1Object value = maybeValue.get();

        switch (maybeAttribute.get()) {
          case QUANTITY -> inAppPurchase.quantity = value.integerValue().orElse(null);
          case PRODUCT_IDENTIFIER -> inAppPurchase.productIdentifier = value.stringValue().orElse(null);
          case TRANSACTION_IDENTIFIER -> inAppPurchase.transactionIdentifier = value.stringValue().orElse(null);
          case PURCHASE_DATE -> inAppPurchase.purchaseDate = date(value);
          case ORIGINAL_TRANSACTION_IDENTIFIER ->
              inAppPurchase.originalTransactionIdentifier = value.stringValue().orElse(null);
          case ORIGINAL_PURCHASE_DATE -> inAppPurchase.originalPurchaseDate = date(value);
          case SUBSCRIPTION_EXPIRATION_DATE -> inAppPurchase.subscriptionExpirationDate = date(value);
          case WEB_ORDER_LINE_ITEM_ID -> inAppPurchase.webOrderLineItemId = value.integerValue().orElse(null);
          case CANCELLATION_DATE -> inAppPurchase.cancellationDate = date(value);
          case INTRODUCTORY_PRICE_PERIOD ->
              inAppPurchase.introductoryPricePeriod = value.integerValue().map(flag -> flag != 0).orElse(null);
        }
      });
    } catch (final Asn1DecodingException e) {
      logger.debug("Malformed in-app purchase receipt: {}", e.getMessage());
      throw new ReceiptValidationException(ReceiptValidationError.MALFORMED_IN_APP_PURCHASE_RECEIPT, e);
    }

    return inAppPurchase.build();
  }

  private static UnofficialReceipt.Entry decodeUnofficialEntry(final int type, final Asn1Object value) {
    final Optional<KnownUnofficialAttribute> meaning = KnownUnofficialAttribute.fromAttributeNumber(type);
    final Optional<String> unwrappedString = value.unwrap().flatMap(Asn1Object::stringValue);

    final Optional<UnofficialReceipt.Value> decodedValue;

    if (meaning.isPresent()) {
      decodedValue = switch (meaning.get().valueType()) {
        case STRING -> unwrappedString.map(UnofficialReceipt.StringValue::new);
        case DATE -> unwrappedString.map(ReceiptDecoder::dateOrString);
        case BYTES -> Optional.of(new UnofficialReceipt.BytesValue(value.bytes()));
      };
    } else if (unwrappedString.isPresent()) {
      decodedValue = Optional.of(new UnofficialReceipt.StringValue(unwrappedString.get()));
    } else {
      decodedValue = Optional.of(new UnofficialReceipt.BytesValue(value.bytes()));
    }

    return new UnofficialReceipt.Entry(type, meaning, decodedValue);
  }

  // Dates that don't parse are kept as their original text
  private static UnofficialReceipt.Value dateOrString(final String text) {
    return ReceiptDateFormatter.parse(text)
        .<UnofficialReceipt.Value>map(UnofficialReceipt.DateValue::new)
        .orElseGet(() -> new UnofficialReceipt.StringValue(text));
  }

  private static void forEachAttribute(final Asn1Reader reader, final AttributeConsumer consumer)
      throws Asn1DecodingException, ReceiptValidationException {

    final Asn1Object attributeSet = reader.next();

    if (!attributeSet.isSet()) {
      throw new Asn1DecodingException("Expected SET at offset " + attributeSet.valueOffset());
    }

    final Asn1Reader attributes = attributeSet.contents();

    while (attributes.hasNext()) {
      final Asn1Object attribute = attributes.next();

      if (!attribute.isSequence()) {
        throw new Asn1DecodingException("Expected SEQUENCE at offset " + attribute.valueOffset());
      }

      final Asn1Reader fields = attribute.contents();

      final long type = fields.next().integerValue()
          .orElseThrow(() -> new Asn1DecodingException("Attribute type is not an INTEGER"));

      if (type < Integer.MIN_VALUE || type > Integer.MAX_VALUE) {
        throw new Asn1DecodingException("Attribute type out of range: " + type);
      }

      // The attribute version is not used, but must be present
      fields.next().integerValue()
          .orElseThrow(() -> new Asn1DecodingException("Attribute version is not an INTEGER"));

      final Asn1Object value = fields.next();

      if (!value.isOctetString()) {
        throw new Asn1DecodingException("Attribute value is not an OCTET STRING");
      }

      consumer.accept((int) type, value);
    }
  }

  @Nullable
  private static String unwrappedString(final Asn1Object value) {
    return value.unwrap().flatMap(Asn1Object::stringValue).orElse(null);
  }

  @Nullable
  private static Instant unwrappedDate(final Asn1Object value) {
    return value.unwrap().map(ReceiptDecoder::date).orElse(null);
  }

  @Nullable
  private static Instant date(final Asn1Object value) {
    return value.stringValue().flatMap(ReceiptDateFormatter::parse).orElse(null);
  }

  private static class ReceiptFields {

    @Nullable String bundleIdentifier;
    @Nullable byte[] bundleIdData;
    @Nullable String appVersion;
    @Nullable String originalAppVersion;
    @Nullable byte[] opaqueValue;
    @Nullable byte[] sha1Hash;
    @Nullable Instant receiptCreationDate;
    @Nullable Instant expirationDate;
    final List<InAppPurchaseReceipt> inAppPurchaseReceipts = new ArrayList<>();

    Receipt build() {
      return new Receipt(bundleIdentifier, bundleIdData, appVersion, originalAppVersion, opaqueValue, sha1Hash,
          receiptCreationDate, expirationDate, inAppPurchaseReceipts);
    }
  }

  private static class InAppPurchaseFields {

    @Nullable Long quantity;
    @Nullable String productIdentifier;
    @Nullable String transactionIdentifier;
    @Nullable String originalTransactionIdentifier;
    @Nullable Instant purchaseDate;
    @Nullable Instant originalPurchaseDate;
    @Nullable Instant subscriptionExpirationDate;
    @Nullable Instant cancellationDate;
    @Nullable Long webOrderLineItemId;
    @Nullable Boolean introductoryPricePeriod;

    InAppPurchaseReceipt build() {
      return new InAppPurchaseReceipt(quantity, productIdentifier, transactionIdentifier,
          originalTransactionIdentifier, purchaseDate, originalPurchaseDate, subscriptionExpirationDate,
          cancellationDate, webOrderLineItemId, introductoryPricePeriod);
    }
  }
}
