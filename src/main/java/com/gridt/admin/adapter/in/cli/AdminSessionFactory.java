package com.gridt.admin.adapter.in.cli;

import com.gridt.admin.infrastructure.config.DatabaseUri;

public interface AdminSessionFactory {

    /**
     * @param chunkSize overrides the configured chunk size when not null
     */
    AdminSession open(DatabaseUri database, Integer chunkSize);
}
