package com.imagebuilder.metrics.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Half-open time interval {@code [start, end)}.
 */
public final class Window {
    private final LocalDateTime start;
    private final LocalDateTime end;

    public Window(LocalDateTime start, LocalDateTime end) {
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Window start must be before end: [" + start + ", " + end + ")");
        }
    }

    public LocalDateTime start() {
        return start;
    }

    public LocalDateTime end() {
        return end;
    }

    public boolean contains(LocalDateTime ts) {
        return ts != null && !ts.isBefore(start) && ts.isBefore(end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Window)) {
            return false;
        }
        Window that = (Window) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
