package com.libragraph.nsm.api.model;

public record PurchaseView(String paymentUrl, String orderId) {
}
