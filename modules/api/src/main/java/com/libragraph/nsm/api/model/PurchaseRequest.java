package com.libragraph.nsm.api.model;

public record PurchaseRequest(Integer tokenCount) {
}
