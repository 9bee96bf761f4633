package com.gridt.admin.adapter.in.cli;

import com.gridt.admin.domain.model.UserId;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.util.Optional;

/**
 * Prints the id of the user whose username or email is exactly the query.
 * Prints nothing and exits 1 when there is no such user.
 */
@Command(name = "find-user", description = "Find a user id by exact username or email.")
class FindUserCommand implements AdminTask {

    @Parameters(index = "0", description = "Username or email.")
    String query;

    @Override
    public int run(AdminSettings settings, AdminOperations operations, PrintWriter out, PrintWriter err) {
        Optional<UserId> found = operations.findUser().findUserBy(query);
        if (found.isEmpty()) {
            return ExitCodes.NOT_FOUND;
        }
        out.println(found.get());
        return ExitCodes.OK;
    }
}
