package com.gridt.admin.infrastructure.metrics;

import com.gridt.admin.application.port.out.MetricsPort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.stream.Collectors;

@Component
public class AppMetrics implements MetricsPort {

    private final MeterRegistry registry;

    private final Counter movementsCreated;
    private final Counter usersCreated;
    private final Counter subscriptionsCreated;
    private final Counter subscriptionsDestroyed;
    private final Counter chunksCommitted;
    private final Counter chunksRolledBack;

    public AppMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.movementsCreated = Counter.builder("admin_movements_created_total")
            .description("Movements inserted by this tool")
            .register(registry);

        this.usersCreated = Counter.builder("admin_users_created_total")
            .description("Users registered by this tool")
            .register(registry);

        this.subscriptionsCreated = Counter.builder("admin_subscriptions_created_total")
            .description("Associations inserted by subscribe")
            .register(registry);

        this.subscriptionsDestroyed = Counter.builder("admin_subscriptions_destroyed_total")
            .description("Associations soft-deleted by unsubscribe")
            .register(registry);

        this.chunksCommitted = Counter.builder("admin_bulk_chunks_committed_total")
            .description("Bulk insert chunks committed")
            .register(registry);

        this.chunksRolledBack = Counter.builder("admin_bulk_chunks_rolled_back_total")
            .description("Bulk insert chunks rolled back")
            .register(registry);
    }

    @Override
    public void incrementMovementsCreated(int count) {
        movementsCreated.increment(count);
    }

    @Override
    public void incrementUsersCreated(int count) {
        usersCreated.increment(count);
    }

    @Override
    public void incrementSubscriptionsCreated() {
        subscriptionsCreated.increment();
    }

    @Override
    public void incrementSubscriptionsDestroyed() {
        subscriptionsDestroyed.increment();
    }

    @Override
    public void incrementRowsDeleted(String table, int count) {
        Counter.builder("admin_rows_deleted_total")
            .description("Rows removed by bulk delete")
            .tag("table", table)
            .register(registry)
            .increment(count);
    }

    @Override
    public void incrementChunksCommitted() {
        chunksCommitted.increment();
    }

    @Override
    public void incrementChunksRolledBack() {
        chunksRolledBack.increment();
    }

    @Override
    public String summary() {
        return registry.getMeters().stream()
            .filter(Counter.class::isInstance)
            .map(Counter.class::cast)
            .filter(counter -> counter.count() > 0)
            .sorted(Comparator.comparing(counter -> counter.getId().getName()))
            .map(counter -> describe(counter) + "=" + (long) counter.count())
            .collect(Collectors.joining(", "));
    }

    private static String describe(Meter meter) {
        String table = meter.getId().getTag("table");
        return table != null ? meter.getId().getName() + "{" + table + "}" : meter.getId().getName();
    }
}
