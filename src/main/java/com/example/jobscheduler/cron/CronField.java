package com.example.jobscheduler.cron;

import lombok.Getter;

import java.util.BitSet;
import java.util.List;

/**
 * One parsed field of a cron expression.
 * <p>
 * Values are expanded at parse time and kept in the order they were
 * produced, so a wrapping day-of-week range such as {@code FRI-MON}
 * yields {@code [5, 6, 0, 1]}. Matching uses a bit set over the same values.
 */
@Getter
public final class CronField {

    private static final CronField ALL = new CronField(FieldKind.ALL, List.of());

    private final FieldKind kind;
    private final List<Integer> values;
    private final BitSet permitted;

    private CronField(FieldKind kind, List<Integer> values) {
        this.kind = kind;
        this.values = List.copyOf(values);
        this.permitted = new BitSet();
        this.values.forEach(permitted::set);
    }

    public static CronField all() {
        return ALL;
    }

    public static CronField of(FieldKind kind, List<Integer> values) {
        if (kind == FieldKind.ALL) {
            return ALL;
        }
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Field of kind " + kind + " needs at least one value");
        }
        return new CronField(kind, values);
    }

    public boolean matches(int value) {
        return kind == FieldKind.ALL || permitted.get(value);
    }

    @Override
    public String toString() {
        return kind == FieldKind.ALL ? "*" : kind + values.toString();
    }
}
