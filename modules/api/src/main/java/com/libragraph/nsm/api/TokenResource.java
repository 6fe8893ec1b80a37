package com.libragraph.nsm.api;

import com.libragraph.nsm.api.model.PurchaseRequest;
import com.libragraph.nsm.api.model.PurchaseView;
import com.libragraph.nsm.api.model.TokenStatusView;
import com.libragraph.nsm.core.ledger.PurchaseOrder;
import com.libragraph.nsm.core.ledger.UsageLedger;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * Usage ledger balance, online validation and token purchase.
 */
@Path("/api/v1/tokens")
@Produces(MediaType.APPLICATION_JSON)
public class TokenResource {

    @Inject
    UsageLedger ledger;

    @GET
    public TokenStatusView status() {
        return TokenStatusView.of(ledger.state());
    }

    @POST
    @Path("/validate")
    public TokenStatusView validate() {
        return TokenStatusView.of(ledger.validateOnline());
    }

    @POST
    @Path("/purchase")
    @Consumes(MediaType.APPLICATION_JSON)
    public PurchaseView purchase(PurchaseRequest request) {
        if (request == null || request.tokenCount() == null) {
            throw new IllegalArgumentException("tokenCount is required");
        }
        PurchaseOrder order = ledger.initiatePurchase(request.tokenCount());
        return new PurchaseView(order.paymentUrl(), order.orderId());
    }
}
