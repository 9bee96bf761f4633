package com.gridt.admin.application.service;

import com.gridt.admin.application.port.out.BulkDeletable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BulkDeleter")
class BulkDeleterTest {

    private RecordingTransactionRunner transactions;
    private InMemoryRows rows;

    @BeforeEach
    void setUp() {
        transactions = new RecordingTransactionRunner();
        rows = new InMemoryRows(IntStream.rangeClosed(1, 10).boxed().toList());
    }

    /** Rows keyed by integer ids; criteria is a minimum id. */
    static class InMemoryRows implements BulkDeletable<Integer, Integer> {
        final List<Integer> ids;
        final List<Collection<Integer>> deleteCalls = new ArrayList<>();

        InMemoryRows(List<Integer> ids) {
            this.ids = new ArrayList<>(ids);
        }

        @Override
        public List<Integer> findIds(Integer minimum) {
            return ids.stream().filter(id -> id >= minimum).toList();
        }

        @Override
        public int deleteByIds(Collection<Integer> selected) {
            deleteCalls.add(List.copyOf(selected));
            int before = ids.size();
            ids.removeAll(selected);
            return before - ids.size();
        }
    }

    @Nested
    @DisplayName("ordered deletion")
    class OrderedTests {

        @Test
        @DisplayName("Should delete the first N matching rows in id order")
        void shouldDeleteFirstRows() {
            BulkDeleter deleter = new BulkDeleter(transactions, new Random(1));

            BulkDeleteOutcome<Integer> outcome = deleter.delete(rows, 3, 4, false);

            assertEquals(List.of(3, 4, 5, 6), outcome.selected());
            assertEquals(4, outcome.deleted());
            assertEquals(8, outcome.matched());
            assertEquals(List.of(1, 2, 7, 8, 9, 10), rows.ids);
            assertEquals(1, transactions.commits);
        }

        @Test
        @DisplayName("Should delete everything that matched when the limit is larger")
        void shouldReturnLowerCountWhenLimitExceedsMatches() {
            BulkDeleter deleter = new BulkDeleter(transactions, new Random(1));

            BulkDeleteOutcome<Integer> outcome = deleter.delete(rows, 8, 100, false);

            assertEquals(3, outcome.deleted());
            assertEquals(List.of(1, 2, 3, 4, 5, 6, 7), rows.ids);
        }

        @Test
        @DisplayName("Should skip the delete statement when nothing is selected")
        void shouldNotDeleteWithZeroLimit() {
            BulkDeleter deleter = new BulkDeleter(transactions, new Random(1));

            BulkDeleteOutcome<Integer> outcome = deleter.delete(rows, 1, 0, false);

            assertEquals(0, outcome.deleted());
            assertEquals(10, outcome.matched());
            assertTrue(rows.deleteCalls.isEmpty());
        }

        @Test
        @DisplayName("Should reject a negative limit before opening a transaction")
        void shouldRejectNegativeLimit() {
            BulkDeleter deleter = new BulkDeleter(transactions, new Random(1));

            assertThrows(IllegalArgumentException.class, () -> deleter.delete(rows, 1, -1, false));
            assertEquals(0, transactions.commits + transactions.rollbacks);
        }
    }

    @Nested
    @DisplayName("random deletion")
    class RandomTests {

        @Test
        @DisplayName("Should delete exactly the selected id set")
        void shouldDeleteSelectedIds() {
            BulkDeleter deleter = new BulkDeleter(transactions, new Random(42));

            BulkDeleteOutcome<Integer> outcome = deleter.delete(rows, 1, 3, true);

            assertEquals(1, rows.deleteCalls.size());
            assertEquals(new HashSet<>(outcome.selected()), new HashSet<>(rows.deleteCalls.get(0)));
            assertEquals(7, rows.ids.size());
            outcome.selected().forEach(id -> assertFalse(rows.ids.contains(id)));
        }

        @Test
        @DisplayName("Should not always pick the first rows")
        void shouldSampleAcrossMatches() {
            List<Integer> candidates = IntStream.rangeClosed(1, 10).boxed().toList();
            boolean sawOtherThanPrefix = false;
            for (long seed = 0; seed < 20 && !sawOtherThanPrefix; seed++) {
                BulkDeleter deleter = new BulkDeleter(transactions, new Random(seed));
                List<Integer> selected = deleter.select(candidates, 3, true);
                sawOtherThanPrefix = !new HashSet<>(selected).equals(new HashSet<>(List.of(1, 2, 3)));
            }
            assertTrue(sawOtherThanPrefix);
        }

        @Test
        @DisplayName("Should pick distinct matching ids")
        void shouldPickDistinctIds() {
            BulkDeleter deleter = new BulkDeleter(transactions, new Random(7));

            List<Integer> selected = deleter.select(List.of(5, 6, 7, 8), 4, true);

            assertEquals(4, new HashSet<>(selected).size());
            assertTrue(List.of(5, 6, 7, 8).containsAll(selected));
        }

        @Test
        @DisplayName("Should be reproducible with the same seed")
        void shouldBeReproducible() {
            List<Integer> candidates = IntStream.rangeClosed(1, 50).boxed().toList();

            List<Integer> first = new BulkDeleter(transactions, new Random(99)).select(candidates, 5, true);
            List<Integer> second = new BulkDeleter(transactions, new Random(99)).select(candidates, 5, true);

            assertEquals(first, second);
        }
    }

    @Test
    @DisplayName("Should run the hook on the selection before deleting")
    void shouldRunBeforeDeleteHook() {
        BulkDeleter deleter = new BulkDeleter(transactions, new Random(1));
        List<List<Integer>> seen = new ArrayList<>();

        deleter.delete(rows, 1, 2, false, selected -> {
            seen.add(selected);
            assertTrue(rows.deleteCalls.isEmpty());
        });

        assertEquals(List.of(List.of(1, 2)), seen);
    }
}
