package com.gridt.admin.application.port.in;

public interface InitializeDatabaseUseCase {
    void initializeDatabase();
}
