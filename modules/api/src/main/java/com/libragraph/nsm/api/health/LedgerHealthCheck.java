package com.libragraph.nsm.api.health;

import com.libragraph.nsm.core.ledger.UsageLedger;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class LedgerHealthCheck implements HealthCheck {

    @Inject
    UsageLedger ledger;

    @Override
    public HealthCheckResponse call() {
        try {
            int tokens = ledger.availableTokens();
            return HealthCheckResponse.named("usage-ledger")
                    .up()
                    .withData("availableTokens", tokens)
                    .build();
        } catch (Exception e) {
            return HealthCheckResponse.named("usage-ledger")
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
