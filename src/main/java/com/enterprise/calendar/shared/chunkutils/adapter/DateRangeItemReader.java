package com.enterprise.calendar.shared.chunkutils.adapter;

import com.enterprise.calendar.holiday.domain.DateRange;

import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemStreamException;
import org.springframework.batch.item.ItemStreamReader;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Reads every day of a {@link DateRange} in ascending order, then {@code null}.
 *
 * <p>The number of days already handed out is saved under
 * {@code <name>.read.count} so a restarted step resumes where it stopped.
 */
public class DateRangeItemReader implements ItemStreamReader<LocalDate> {

    private final DateRange range;
    private final String countKey;
    private LocalDate next;
    private long readCount;

    public DateRangeItemReader(String name, DateRange range) {
        Objects.requireNonNull(name, "name");
        this.range = Objects.requireNonNull(range, "range");
        this.countKey = name + ".read.count";
        this.next = range.start();
    }

    @Override
    public LocalDate read() {
        if (next == null || next.isAfter(range.end())) {
            return null;
        }
        LocalDate current = next;
        next = next.plusDays(1);
        readCount++;
        return current;
    }

    @Override
    public void open(ExecutionContext executionContext) {
        if (executionContext.containsKey(countKey)) {
            long restored = executionContext.getLong(countKey);
            if (restored < 0 || restored > range.length()) {
                throw new ItemStreamException(
                    "Saved read count " + restored + " does not fit " + range);
            }
            readCount = restored;
            next = range.start().plusDays(restored);
        }
    }

    @Override
    public void update(ExecutionContext executionContext) {
        executionContext.putLong(countKey, readCount);
    }

    @Override
    public void close() {
        next = null;
    }
}
