package com.libragraph.nsm.core.ledger;

/**
 * A pending token purchase; the user completes payment at {@code paymentUrl}.
 */
public record PurchaseOrder(String paymentUrl, String orderId) {
}
