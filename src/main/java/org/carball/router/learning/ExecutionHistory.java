package org.carball.router.learning;

import org.carball.router.model.telemetry.ExecutionOutcome;
import org.carball.router.model.telemetry.ExecutionRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Bounded in-memory log of recent execution records, kept for inspection only.
 */
public class ExecutionHistory implements TelemetrySink {

    private final int retention;
    private final Deque<ExecutionRecord> records = new ArrayDeque<>();
    private long totalRecorded;

    public ExecutionHistory(int retention) {
        if (retention <= 0) {
            throw new IllegalArgumentException("History retention must be positive: " + retention);
        }
        this.retention = retention;
    }

    @Override
    public synchronized void record(ExecutionRecord record) {
        records.addLast(record);
        totalRecorded++;
        while (records.size() > retention) {
            records.removeFirst();
        }
    }

    /**
     * Most recent records first.
     */
    public synchronized List<ExecutionRecord> recent(int limit) {
        List<ExecutionRecord> result = new ArrayList<>(Math.min(limit, records.size()));
        Iterator<ExecutionRecord> newestFirst = records.descendingIterator();
        while (newestFirst.hasNext() && result.size() < limit) {
            result.add(newestFirst.next());
        }
        return List.copyOf(result);
    }

    public synchronized Map<ExecutionOutcome, Long> outcomeCounts() {
        Map<ExecutionOutcome, Long> counts = new EnumMap<>(ExecutionOutcome.class);
        for (ExecutionRecord record : records) {
            counts.merge(record.outcome(), 1L, Long::sum);
        }
        return counts;
    }

    public synchronized int size() {
        return records.size();
    }

    public synchronized long getTotalRecorded() {
        return totalRecorded;
    }
}
