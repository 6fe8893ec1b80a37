package com.libragraph.nsm.api.marketplace;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

import java.time.Instant;

/**
 * REST client for the token marketplace. Base URL comes from
 * {@code quarkus.rest-client.marketplace.url}.
 */
@Path("/api/v1/tokens")
@RegisterRestClient(configKey = "marketplace")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public interface MarketplaceClient {

    @GET
    @Path("/validate")
    ValidationResponse validate(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization);

    @POST
    @Path("/purchase")
    PurchaseResponse purchase(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization, PurchaseRequest request);

    record ValidationResponse(
            @JsonProperty("is_valid") boolean valid,
            @JsonProperty("available_tokens") int availableTokens,
            @JsonProperty("last_sync") Instant lastSync) {
    }

    record PurchaseRequest(@JsonProperty("token_count") int tokenCount) {
    }

    record PurchaseResponse(
            @JsonProperty("payment_url") String paymentUrl,
            @JsonProperty("order_id") String orderId) {
    }
}
