package com.finanzas.ops.cli;

/**
 * Process exit codes.
 */
public final class ExitCodes {

    public static final int OK = 0;
    /** Apply run finished with item failures */
    public static final int ITEM_FAILURES = 1;
    /** Fatal setup, parse or scan error; or unknown references found by validate-referencing */
    public static final int FATAL = 2;

    private ExitCodes() {
    }
}
