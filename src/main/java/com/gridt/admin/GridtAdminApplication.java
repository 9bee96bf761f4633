package com.gridt.admin;

import com.gridt.admin.adapter.in.cli.AdminCli;
import com.gridt.admin.infrastructure.config.DatabaseUriResolver;
import com.gridt.admin.infrastructure.config.SpringAdminSessionFactory;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point. The command line is parsed before Spring starts; the application context is
 * only created once a command has a database to talk to.
 */
@SpringBootApplication
public class GridtAdminApplication {

    public static void main(String[] args) {
        AdminCli cli = new AdminCli(
            new SpringAdminSessionFactory(),
            new DatabaseUriResolver(System.getenv())
        );
        System.exit(cli.execute(args));
    }
}
