package com.gridt.admin.adapter.out.persistence;

import com.gridt.admin.application.port.out.SchemaInitializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;

/**
 * Applies {@code schema.sql} from the classpath. Every statement in it is
 * {@code CREATE ... IF NOT EXISTS}, so running it against an initialized database changes nothing.
 */
@Component
public class JdbcSchemaInitializer implements SchemaInitializer {

    private static final Logger log = LoggerFactory.getLogger(JdbcSchemaInitializer.class);
    static final String SCHEMA_RESOURCE = "schema.sql";

    private final DataSource dataSource;

    public JdbcSchemaInitializer(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void initialize() {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_RESOURCE));
        populator.setSqlScriptEncoding("UTF-8");
        populator.execute(dataSource);
        log.info("Database schema applied from {}", SCHEMA_RESOURCE);
    }
}
