package com.gridt.admin.adapter.in.cli;

public final class ExitCodes {

    public static final int OK = 0;
    public static final int NOT_FOUND = 1;
    public static final int CONFIGURATION_ERROR = 1;
    /** Integrity or storage failure, including a bulk insert that stopped part way. */
    public static final int FAILURE = 2;
    public static final int USAGE = 2;

    private ExitCodes() {
    }
}
