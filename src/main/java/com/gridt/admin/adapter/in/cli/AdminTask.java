package com.gridt.admin.adapter.in.cli;

import java.io.PrintWriter;

/**
 * A command handler. Picocli fills in the arguments; the shell supplies everything else.
 */
@FunctionalInterface
public interface AdminTask {

    /**
     * @return the process exit code, see {@link ExitCodes}
     */
    int run(AdminSettings settings, AdminOperations operations, PrintWriter out, PrintWriter err);
}
