package com.libragraph.nsm.core.ledger;

import java.util.ArrayList;
import java.util.List;

/**
 * Scriptable {@link LicenseAuthority} that records every call.
 */
class RecordingAuthority implements LicenseAuthority {

    final List<String> calls = new ArrayList<>();
    LicenseStatus status;
    PurchaseOrder order;
    RuntimeException failure;

    @Override
    public LicenseStatus validate(String licenseId) {
        calls.add("validate:" + licenseId);
        if (failure != null) throw failure;
        return status;
    }

    @Override
    public PurchaseOrder purchase(String licenseId, int tokenCount) {
        calls.add("purchase:" + licenseId + ":" + tokenCount);
        if (failure != null) throw failure;
        return order;
    }
}
