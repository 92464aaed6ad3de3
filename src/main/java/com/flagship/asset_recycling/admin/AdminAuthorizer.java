package com.flagship.asset_recycling.admin;

/**
 * Authorization capability checked at the top of every administrative operation.
 *
 * How the actor identity was established is outside this interface.
 */
@FunctionalInterface
public interface AdminAuthorizer {

    boolean authorize(String actor, AdminOperation operation);
}
