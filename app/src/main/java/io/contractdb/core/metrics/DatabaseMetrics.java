package io.contractdb.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public final class DatabaseMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter mapsCreated = Counter.builder("contractdb.map.created")
            .description("Maps created or re-created")
            .register(registry);
    private static final Counter entryReads = registry.counter("contractdb.entry.reads");
    private static final Counter entryWrites = Counter.builder("contractdb.entry.writes")
            .description("Entries set, inserted or deleted")
            .register(registry);
    private static final Counter typeMismatches = Counter.builder("contractdb.type.mismatch")
            .description("Keys or values rejected by a map schema")
            .register(registry);

    private DatabaseMetrics() {}

    public static void recordMapCreated() {
        mapsCreated.increment();
    }

    public static void recordRead() {
        entryReads.increment();
    }

    public static void recordWrite() {
        entryWrites.increment();
    }

    public static void recordTypeMismatch() {
        typeMismatches.increment();
    }

    public static double count(String name) {
        Counter c = registry.find(name).counter();
        return c == null ? 0.0 : c.count();
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName())
                  .append("{stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
