package com.gridt.admin.application.service;

import com.gridt.admin.application.port.out.MetricsPort;
import com.gridt.admin.application.port.out.TransactionRunner;
import com.gridt.admin.domain.error.BulkWriteError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedRuntimeException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;

/**
 * Inserts many rows without holding one long transaction open.
 *
 * <p>Drafts are pulled lazily and grouped into chunks of exactly {@code chunkSize}. Each chunk
 * is written in its own transaction, so a run of {@code L} drafts commits {@code ceil(L / chunkSize)}
 * times. When storage rejects a row, or the connection or commit for a chunk fails, the chunk in
 * flight is rolled back and the run stops: earlier chunks stay committed and are reported,
 * nothing is retried.
 */
@Service
public class BulkWriter {

    private static final Logger log = LoggerFactory.getLogger(BulkWriter.class);

    private final TransactionRunner transactions;
    private final MetricsPort metrics;

    public BulkWriter(TransactionRunner transactions, MetricsPort metrics) {
        this.transactions = transactions;
        this.metrics = metrics;
    }

    /**
     * @param drafts rows to insert, consumed once
     * @param chunkSize number of drafts per transaction, at least 1
     * @param writer inserts one draft and returns what the caller wants back, usually its id
     */
    public <D, T> BulkWriteOutcome<T> insert(Iterable<D> drafts, int chunkSize, Function<D, T> writer) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be at least 1, was " + chunkSize);
        }

        List<T> written = new ArrayList<>();
        Iterator<D> source = drafts.iterator();
        int commits = 0;

        while (source.hasNext()) {
            List<D> chunk = nextChunk(source, chunkSize);
            int chunkNumber = commits + 1;
            try {
                List<T> results = transactions.inTransaction(() -> writeChunk(chunk, writer));
                written.addAll(results);
                commits++;
                metrics.incrementChunksCommitted();
                log.info("Committed chunk {} ({} rows, {} total)", chunkNumber, results.size(), written.size());
            } catch (DuplicateKeyException e) {
                metrics.incrementChunksRolledBack();
                log.warn("Chunk {} rolled back on duplicate value after {} committed rows", chunkNumber, written.size());
                return new BulkWriteOutcome<>(written, commits,
                    new BulkWriteError.DuplicateValue(chunkNumber, rootMessage(e)));
            } catch (DataAccessException e) {
                metrics.incrementChunksRolledBack();
                log.error("Chunk {} rolled back after {} committed rows: {}", chunkNumber, written.size(), e.getMessage());
                return new BulkWriteOutcome<>(written, commits,
                    new BulkWriteError.StorageFailure(chunkNumber, rootMessage(e)));
            } catch (TransactionException e) {
                metrics.incrementChunksRolledBack();
                log.error("Transaction for chunk {} failed after {} committed rows: {}", chunkNumber, written.size(), e.getMessage());
                return new BulkWriteOutcome<>(written, commits,
                    new BulkWriteError.StorageFailure(chunkNumber, rootMessage(e)));
            }
        }

        return new BulkWriteOutcome<>(written, commits, null);
    }

    private static <D> List<D> nextChunk(Iterator<D> source, int chunkSize) {
        List<D> chunk = new ArrayList<>(Math.min(chunkSize, 1024));
        while (chunk.size() < chunkSize && source.hasNext()) {
            chunk.add(source.next());
        }
        return chunk;
    }

    private static <D, T> List<T> writeChunk(List<D> chunk, Function<D, T> writer) {
        List<T> results = new ArrayList<>(chunk.size());
        for (D draft : chunk) {
            results.add(writer.apply(draft));
        }
        return results;
    }

    private static String rootMessage(NestedRuntimeException e) {
        Throwable cause = e.getMostSpecificCause();
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
