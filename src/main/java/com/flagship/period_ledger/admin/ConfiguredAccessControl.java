package com.flagship.period_ledger.admin;

import java.util.Collection;
import java.util.Set;

/**
 * Grants the administrative capability to the accounts listed in
 * {@code ledger.admin.accounts}.
 */
public class ConfiguredAccessControl implements AccessControl {

    private final Set<String> adminAccounts;

    public ConfiguredAccessControl(Collection<String> adminAccounts) {
        this.adminAccounts = Set.copyOf(adminAccounts);
    }

    @Override
    public boolean hasAdminCapability(String caller) {
        return caller != null && adminAccounts.contains(caller);
    }
}
