package com.gridt.admin.infrastructure.config;

import com.gridt.admin.infrastructure.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Finds the database URI: the command line wins over the {@value #ENVIRONMENT_VARIABLE}
 * environment variable. Having neither is fatal.
 */
public final class DatabaseUriResolver {

    private static final Logger log = LoggerFactory.getLogger(DatabaseUriResolver.class);

    public static final String ENVIRONMENT_VARIABLE = "ADMIN_DB_URI";

    private final Map<String, String> environment;

    public DatabaseUriResolver(Map<String, String> environment) {
        this.environment = environment;
    }

    public DatabaseUri resolve(String commandLineUri) {
        if (commandLineUri != null && !commandLineUri.isBlank()) {
            log.info("Using database URI from command line");
            return DatabaseUri.parse(commandLineUri);
        }
        String fromEnvironment = environment.get(ENVIRONMENT_VARIABLE);
        if (fromEnvironment != null && !fromEnvironment.isBlank()) {
            log.info("Using database URI from environment");
            return DatabaseUri.parse(fromEnvironment);
        }
        throw new ConfigurationException(
            "No database URI provided: pass --uri or set " + ENVIRONMENT_VARIABLE);
    }
}
