package com.libragraph.nsm.api.marketplace;

import com.libragraph.nsm.core.ledger.LicenseAuthority;
import com.libragraph.nsm.core.ledger.LicenseStatus;
import com.libragraph.nsm.core.ledger.LicenseValidationException;
import com.libragraph.nsm.core.ledger.PurchaseOrder;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;

/**
 * {@link LicenseAuthority} backed by the marketplace REST API. The license id
 * is sent as a bearer token.
 */
@ApplicationScoped
public class MarketplaceLicenseAuthority implements LicenseAuthority {

    private static final Logger log = Logger.getLogger(MarketplaceLicenseAuthority.class);

    @Inject
    @RestClient
    MarketplaceClient client;

    @Override
    public LicenseStatus validate(String licenseId) {
        log.info("Validating license with marketplace");
        try {
            MarketplaceClient.ValidationResponse response = client.validate(bearer(licenseId));
            if (response == null) {
                throw new LicenseValidationException("Marketplace returned an empty validation response");
            }
            return new LicenseStatus(response.valid(), response.availableTokens(), response.lastSync());
        } catch (WebApplicationException e) {
            throw new LicenseValidationException(
                    "Marketplace returned an error (status " + e.getResponse().getStatus() + ")", e);
        } catch (ProcessingException e) {
            throw new LicenseValidationException("Failed to communicate with marketplace: " + e.getMessage(), e);
        }
    }

    @Override
    public PurchaseOrder purchase(String licenseId, int tokenCount) {
        log.infof("Initiating purchase of %d tokens", tokenCount);
        try {
            MarketplaceClient.PurchaseResponse response =
                    client.purchase(bearer(licenseId), new MarketplaceClient.PurchaseRequest(tokenCount));
            if (response == null) {
                throw new LicenseValidationException("Marketplace returned an empty purchase response");
            }
            return new PurchaseOrder(response.paymentUrl(), response.orderId());
        } catch (WebApplicationException e) {
            throw new LicenseValidationException(
                    "Marketplace returned an error (status " + e.getResponse().getStatus() + ")", e);
        } catch (ProcessingException e) {
            throw new LicenseValidationException("Failed to communicate with marketplace: " + e.getMessage(), e);
        }
    }

    private static String bearer(String licenseId) {
        return "Bearer " + licenseId;
    }
}
