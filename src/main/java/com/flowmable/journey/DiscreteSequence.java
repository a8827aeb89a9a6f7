package com.flowmable.journey;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Incremental walk over a journey's discrete index stream.
 * <p>
 * Holds only the next index and the previously emitted color, so each step costs
 * one sample plus one contrast check. The sequence is unbounded; {@link #hasNext()}
 * is always true until the index would overflow.
 * <p>
 * Owned by the caller and not thread-safe. The journey it walks is never modified.
 */
public final class DiscreteSequence implements Iterator<RgbColor> {

    private final DiscretePaletteGenerator generator;
    private int nextIndex;
    private RgbColor previous;

    DiscreteSequence(DiscretePaletteGenerator generator) {
        this.generator = generator;
    }

    @Override
    public boolean hasNext() {
        return nextIndex < Integer.MAX_VALUE;
    }

    @Override
    public RgbColor next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Index stream exhausted");
        }
        RgbColor color = generator.streamColor(nextIndex, previous);
        previous = color;
        nextIndex++;
        return color;
    }

    /**
     * Advance past {@code count} colors. Contrast chaining still needs each of them,
     * so this costs O(count).
     */
    public void skip(int count) {
        for (int i = 0; i < count; i++) {
            next();
        }
    }

    /** Index the next call to {@link #next()} will return. */
    public int nextIndex() {
        return nextIndex;
    }
}
