package com.gridt.admin.infrastructure.config;

import com.gridt.admin.GridtAdminApplication;
import com.gridt.admin.adapter.in.cli.AdminOperations;
import com.gridt.admin.adapter.in.cli.AdminSession;
import com.gridt.admin.adapter.in.cli.AdminSessionFactory;
import com.gridt.admin.adapter.in.cli.AdminSettings;
import com.gridt.admin.application.port.out.MetricsPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.Banner;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Opens one Spring context, and with it one small connection pool, per command.
 * Connection settings are passed as command-line properties so they win over application.yml.
 */
public class SpringAdminSessionFactory implements AdminSessionFactory {

    private static final Logger log = LoggerFactory.getLogger(SpringAdminSessionFactory.class);

    @Override
    public AdminSession open(DatabaseUri database, Integer chunkSize) {
        List<String> properties = new ArrayList<>();
        properties.add("--spring.datasource.url=" + database.jdbcUrl());
        if (database.username() != null) {
            properties.add("--spring.datasource.username=" + database.username());
        }
        if (database.password() != null) {
            properties.add("--spring.datasource.password=" + database.password());
        }
        if (chunkSize != null) {
            properties.add("--admin.chunk-size=" + chunkSize);
        }

        ConfigurableApplicationContext context = new SpringApplicationBuilder(GridtAdminApplication.class)
            .web(WebApplicationType.NONE)
            .bannerMode(Banner.Mode.OFF)
            .logStartupInfo(false)
            .run(properties.toArray(String[]::new));

        AdminProperties admin = context.getBean(AdminProperties.class);
        AdminSettings settings = new AdminSettings(
            database,
            admin.getChunkSize(),
            admin.getDeleteLimit(),
            admin.isRandomDelete()
        );
        return new SpringAdminSession(context, settings);
    }

    private static final class SpringAdminSession implements AdminSession {

        private final ConfigurableApplicationContext context;
        private final AdminSettings settings;

        private SpringAdminSession(ConfigurableApplicationContext context, AdminSettings settings) {
            this.context = context;
            this.settings = settings;
        }

        @Override
        public AdminSettings settings() {
            return settings;
        }

        @Override
        public AdminOperations operations() {
            return context.getBean(AdminOperations.class);
        }

        @Override
        public void close() {
            String summary = context.getBean(MetricsPort.class).summary();
            if (!summary.isEmpty()) {
                log.info("Session totals: {}", summary);
            }
            context.close();
        }
    }
}
