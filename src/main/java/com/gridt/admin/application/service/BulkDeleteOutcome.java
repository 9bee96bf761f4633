package com.gridt.admin.application.service;

import java.util.List;

/**
 * @param matched how many rows matched the criteria before the limit was applied
 * @param selected identifiers chosen for deletion
 * @param deleted rows actually removed
 */
public record BulkDeleteOutcome<ID>(int matched, List<ID> selected, int deleted) {

    public BulkDeleteOutcome {
        selected = List.copyOf(selected);
    }
}
