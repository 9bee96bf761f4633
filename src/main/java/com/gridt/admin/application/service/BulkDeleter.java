package com.gridt.admin.application.service;

import com.gridt.admin.application.port.out.BulkDeletable;
import com.gridt.admin.application.port.out.TransactionRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.function.Consumer;

/**
 * Removes a bounded number of rows in one transaction.
 *
 * <p>All matching identifiers are collected first. With random order they are shuffled in the
 * application (no vendor-specific {@code random()} in SQL), otherwise the first {@code limit}
 * in id order are taken. The delete then runs against that explicit id set.
 */
@Service
public class BulkDeleter {

    private static final Logger log = LoggerFactory.getLogger(BulkDeleter.class);

    private final TransactionRunner transactions;
    private final Random random;

    public BulkDeleter(TransactionRunner transactions, Random random) {
        this.transactions = transactions;
        this.random = random;
    }

    public <C, ID> BulkDeleteOutcome<ID> delete(BulkDeletable<C, ID> rows, C criteria, int limit, boolean randomOrder) {
        return delete(rows, criteria, limit, randomOrder, selected -> { });
    }

    /**
     * Same as {@link #delete(BulkDeletable, Object, int, boolean)}, running {@code beforeDelete}
     * on the selected ids inside the transaction, just before they are removed.
     */
    public <C, ID> BulkDeleteOutcome<ID> delete(
            BulkDeletable<C, ID> rows,
            C criteria,
            int limit,
            boolean randomOrder,
            Consumer<List<ID>> beforeDelete) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative, was " + limit);
        }

        return transactions.inTransaction(() -> {
            List<ID> candidates = rows.findIds(criteria);
            List<ID> selected = select(candidates, limit, randomOrder);
            if (selected.isEmpty()) {
                log.debug("Nothing to delete: {} rows matched {}", candidates.size(), criteria);
                return new BulkDeleteOutcome<>(candidates.size(), selected, 0);
            }

            beforeDelete.accept(selected);
            int deleted = rows.deleteByIds(selected);
            log.info("Deleted {} of {} matching rows (limit={}, random={})",
                deleted, candidates.size(), limit, randomOrder);
            return new BulkDeleteOutcome<>(candidates.size(), selected, deleted);
        });
    }

    <ID> List<ID> select(List<ID> candidates, int limit, boolean randomOrder) {
        if (!randomOrder) {
            return List.copyOf(candidates.subList(0, Math.min(limit, candidates.size())));
        }
        List<ID> shuffled = new ArrayList<>(candidates);
        Collections.shuffle(shuffled, random);
        return List.copyOf(shuffled.subList(0, Math.min(limit, shuffled.size())));
    }
}
