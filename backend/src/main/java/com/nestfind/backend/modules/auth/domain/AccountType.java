package com.nestfind.backend.modules.auth.domain;

/**
 * Self-registration choice; maps onto the role granted at sign-up.
 */
public enum AccountType {
    USER(Role.USER),
    AGENT(Role.AGENT);

    private final String roleCode;

    AccountType(String roleCode) {
        this.roleCode = roleCode;
    }

    public String roleCode() {
        return roleCode;
    }
}
