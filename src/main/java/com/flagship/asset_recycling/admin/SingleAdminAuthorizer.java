package com.flagship.asset_recycling.admin;

import java.util.Objects;

/**
 * Grants every administrative operation to exactly one configured identity.
 */
public class SingleAdminAuthorizer implements AdminAuthorizer {

    private final String adminAddress;

    public SingleAdminAuthorizer(String adminAddress) {
        this.adminAddress = Objects.requireNonNull(adminAddress, "adminAddress");
    }

    @Override
    public boolean authorize(String actor, AdminOperation operation) {
        return adminAddress.equals(actor);
    }
}
