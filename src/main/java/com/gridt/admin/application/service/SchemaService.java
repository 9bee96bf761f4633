package com.gridt.admin.application.service;

import com.gridt.admin.application.port.in.InitializeDatabaseUseCase;
import com.gridt.admin.application.port.out.SchemaInitializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SchemaService implements InitializeDatabaseUseCase {

    private static final Logger log = LoggerFactory.getLogger(SchemaService.class);

    private final SchemaInitializer schemaInitializer;

    public SchemaService(SchemaInitializer schemaInitializer) {
        this.schemaInitializer = schemaInitializer;
    }

    @Override
    public void initializeDatabase() {
        log.info("Creating tables");
        schemaInitializer.initialize();
    }
}
