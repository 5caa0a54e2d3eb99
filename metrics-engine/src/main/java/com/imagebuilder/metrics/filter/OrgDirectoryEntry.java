package com.imagebuilder.metrics.filter;

/**
 * Named organization record from the user directory.
 */
public final class OrgDirectoryEntry {
    static final String MISSING_NAME = "---";

    private final String name;
    private final String accountNumber;
    private final String orgId;

    public OrgDirectoryEntry(String name, String accountNumber, String orgId) {
        this.name = name == null ? MISSING_NAME : name;
        this.accountNumber = accountNumber;
        this.orgId = orgId;
    }

    public String name() {
        return name;
    }

    public String accountNumber() {
        return accountNumber;
    }

    public String orgId() {
        return orgId;
    }
}
