package com.clevertap.symtab;

/**
 * Controls {@link SymbolTables#compatible(SymbolTable, SymbolTable, CompatibilityPolicy)}.
 */
public enum CompatibilityPolicy {

    /**
     * Compare labeled checksums and log a warning on mismatch.
     */
    DEFAULT(true, true),

    /**
     * Compare labeled checksums quietly.
     */
    SILENT(true, false),

    /**
     * Treat every pair of tables as compatible.
     */
    DISABLED(false, false);

    private final boolean checkEnabled;
    private final boolean warnOnMismatch;

    CompatibilityPolicy(boolean checkEnabled, boolean warnOnMismatch) {
        this.checkEnabled = checkEnabled;
        this.warnOnMismatch = warnOnMismatch;
    }

    public boolean isCheckEnabled() {
        return checkEnabled;
    }

    public boolean warnOnMismatch() {
        return warnOnMismatch;
    }
}
