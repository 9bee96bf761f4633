package com.gridt.admin.application.port.out;

import java.util.Collection;
import java.util.List;

/**
 * Rows that can be removed in bounded batches: select identifiers first, delete by that
 * exact set afterwards.
 *
 * @param <C> selection criteria
 * @param <ID> row identifier
 */
public interface BulkDeletable<C, ID> {

    /**
     * Identifiers of all rows matching {@code criteria}, in storage order (ascending id).
     */
    List<ID> findIds(C criteria);

    /**
     * Deletes exactly the given rows and returns how many were removed.
     */
    int deleteByIds(Collection<ID> ids);
}
