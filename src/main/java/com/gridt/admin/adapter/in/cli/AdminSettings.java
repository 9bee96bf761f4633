package com.gridt.admin.adapter.in.cli;

import com.gridt.admin.infrastructure.config.DatabaseUri;

/**
 * Everything a command handler may depend on besides its own arguments.
 *
 * @param chunkSize rows per transaction for bulk inserts
 * @param deleteLimit rows removed by a bulk delete when the command gives no number
 * @param randomDelete whether bulk deletes sample randomly unless told otherwise
 */
public record AdminSettings(
    DatabaseUri database,
    int chunkSize,
    int deleteLimit,
    boolean randomDelete
) {}
