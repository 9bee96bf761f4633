package com.gridt.admin.adapter.in.cli;

import com.gridt.admin.domain.error.ValidationError;
import com.gridt.admin.domain.model.MovementId;
import com.gridt.admin.domain.model.MovementInterval;
import com.gridt.admin.domain.model.Result;
import com.gridt.admin.domain.model.UserId;
import com.gridt.admin.infrastructure.config.DatabaseUri;
import com.gridt.admin.infrastructure.config.DatabaseUriResolver;
import com.gridt.admin.infrastructure.exception.BusinessException;
import com.gridt.admin.infrastructure.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;
import picocli.CommandLine;
import picocli.CommandLine.ParseResult;
import picocli.CommandLine.TypeConversionException;

import java.io.PrintWriter;

/**
 * The shell around the command table: resolves the database URI, opens a session, runs the
 * selected {@link AdminTask} and turns failures into exit codes.
 *
 * <p>The URI is resolved before anything else, so a missing URI never reaches storage.
 * The session is closed on every path out of a command.
 */
public class AdminCli {

    private static final Logger log = LoggerFactory.getLogger(AdminCli.class);

    private final AdminSessionFactory sessionFactory;
    private final DatabaseUriResolver uriResolver;

    public AdminCli(AdminSessionFactory sessionFactory, DatabaseUriResolver uriResolver) {
        this.sessionFactory = sessionFactory;
        this.uriResolver = uriResolver;
    }

    public CommandLine commandLine() {
        CommandLine cli = new CommandLine(new AdminCommand());
        cli.registerConverter(UserId.class, value -> convert(UserId.parse(value)));
        cli.registerConverter(MovementId.class, value -> convert(MovementId.parse(value)));
        cli.registerConverter(MovementInterval.class, value -> convert(MovementInterval.parse(value)));
        cli.setExecutionStrategy(this::execute);
        return cli;
    }

    public int execute(String... args) {
        return commandLine().execute(args);
    }

    private int execute(ParseResult parseResult) {
        Integer helpExitCode = CommandLine.executeHelpRequest(parseResult);
        if (helpExitCode != null) {
            return helpExitCode;
        }

        CommandLine root = parseResult.commandSpec().commandLine();
        PrintWriter out = root.getOut();
        PrintWriter err = root.getErr();

        if (!parseResult.hasSubcommand()) {
            root.usage(err);
            return ExitCodes.USAGE;
        }

        AdminCommand options = (AdminCommand) parseResult.commandSpec().userObject();
        ParseResult selected = parseResult.subcommand();
        AdminTask task = (AdminTask) selected.commandSpec().userObject();

        if (options.chunkSize != null && options.chunkSize < 1) {
            err.println("--chunk-size must be at least 1");
            return ExitCodes.USAGE;
        }

        DatabaseUri database;
        try {
            database = uriResolver.resolve(options.uri);
        } catch (ConfigurationException e) {
            err.println(e.getMessage());
            return ExitCodes.CONFIGURATION_ERROR;
        }

        String command = selected.commandSpec().name();
        log.debug("Running {} against {}", command, database.jdbcUrl());
        try (AdminSession session = sessionFactory.open(database, options.chunkSize)) {
            return task.run(session.settings(), session.operations(), out, err);
        } catch (ConfigurationException e) {
            err.println(e.getMessage());
            return ExitCodes.CONFIGURATION_ERROR;
        } catch (BusinessException e) {
            log.warn("{} failed: {}", command, e.getMessage());
            err.println("Error [" + e.getErrorCode() + "]: " + e.getMessage());
            return ExitCodes.FAILURE;
        } catch (DataAccessException e) {
            log.error("{} failed on storage: {}", command, e.getMessage(), e);
            err.println("Storage error: " + e.getMostSpecificCause().getMessage());
            return ExitCodes.FAILURE;
        } catch (TransactionException e) {
            log.error("{} failed to open or commit a transaction: {}", command, e.getMessage(), e);
            err.println("Storage error: " + e.getMostSpecificCause().getMessage());
            return ExitCodes.FAILURE;
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return ExitCodes.USAGE;
        } finally {
            out.flush();
            err.flush();
        }
    }

    private static <T, E extends ValidationError> T convert(Result<T, E> parsed) {
        return parsed.fold(
            value -> value,
            error -> {
                throw new TypeConversionException(error.message());
            }
        );
    }
}
