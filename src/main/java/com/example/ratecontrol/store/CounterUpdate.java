package com.example.ratecontrol.store;

/**
 * Outcome of {@link CounterStore#incrementIfBelow}: whether the counter moved, and its value afterwards.
 */
public final class CounterUpdate {

    private final boolean incremented;
    private final long count;

    private CounterUpdate(boolean incremented, long count) {
        this.incremented = incremented;
        this.count = count;
    }

    public static CounterUpdate accepted(long count) {
        return new CounterUpdate(true, count);
    }

    public static CounterUpdate rejected(long count) {
        return new CounterUpdate(false, count);
    }

    public boolean isIncremented() {
        return incremented;
    }

    public long getCount() {
        return count;
    }
}
