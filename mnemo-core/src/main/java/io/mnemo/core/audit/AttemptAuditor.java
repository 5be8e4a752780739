package io.mnemo.core.audit;

import io.mnemo.core.model.AttemptRecord;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Append-only attempt log with a bounded size, plus the aggregate view used by reports.
 */
public final class AttemptAuditor {
    public static final int DEFAULT_MAX_RECORDS = 20_000;

    private final AttemptStore store;
    private final int maxRecords;

    public AttemptAuditor(AttemptStore store) {
        this(store, DEFAULT_MAX_RECORDS);
    }

    public AttemptAuditor(AttemptStore store, int maxRecords) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.maxRecords = Math.max(1, maxRecords);
    }

    public synchronized void append(List<AttemptRecord> records) throws IOException {
        if (records == null || records.isEmpty()) {
            return;
        }
        List<AttemptRecord> all = new ArrayList<>(store.load());
        all.addAll(records);
        if (all.size() > maxRecords) {
            all = new ArrayList<>(all.subList(all.size() - maxRecords, all.size()));
        }
        store.save(all);
    }

    public synchronized List<AttemptRecord> recent(int limit) throws IOException {
        int safe = Math.max(1, limit);
        return store.load().stream()
            .sorted(Comparator.comparing(AttemptRecord::timestamp).reversed())
            .limit(safe)
            .toList();
    }

    public synchronized AttemptSummary summary() throws IOException {
        List<AttemptRecord> all = store.load();
        int successes = (int) all.stream().filter(AttemptRecord::succeeded).count();
        int failures = all.size() - successes;

        List<Double> latencies = all.stream()
            .map(record -> (double) record.latencyMs())
            .sorted()
            .toList();
        double totalCost = all.stream().mapToDouble(AttemptRecord::costUsd).sum();

        Map<String, Integer> byKind = new TreeMap<>();
        Map<String, Integer> byProvider = new TreeMap<>();
        int fallbackAttempts = 0;
        int correctiveAttempts = 0;
        for (AttemptRecord record : all) {
            if (!record.errorKind().isBlank()) {
                byKind.merge(record.errorKind(), 1, Integer::sum);
            }
            byProvider.merge(record.provider(), 1, Integer::sum);
            if (record.fallback()) {
                fallbackAttempts++;
            }
            if (record.corrective()) {
                correctiveAttempts++;
            }
        }

        return new AttemptSummary(
            all.size(),
            successes,
            failures,
            round2(percentage(successes, all.size())),
            round2(percentile(latencies, 50)),
            round2(percentile(latencies, 95)),
            round4(totalCost),
            round4(all.isEmpty() ? 0.0 : totalCost / all.size()),
            fallbackAttempts,
            correctiveAttempts,
            byKind,
            byProvider
        );
    }

    private double percentile(List<Double> sorted, int percentile) {
        if (sorted.isEmpty()) {
            return 0.0;
        }
        int safe = Math.max(0, Math.min(100, percentile));
        if (safe == 0) {
            return sorted.get(0);
        }
        int index = (int) Math.ceil((safe / 100.0) * sorted.size()) - 1;
        index = Math.max(0, Math.min(sorted.size() - 1, index));
        return sorted.get(index);
    }

    private double percentage(int numerator, int denominator) {
        if (denominator <= 0) {
            return 0.0;
        }
        return (numerator * 100.0) / denominator;
    }

    private double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
