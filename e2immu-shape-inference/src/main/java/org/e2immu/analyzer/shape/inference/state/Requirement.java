package org.e2immu.analyzer.shape.inference.state;

import org.e2immu.analyzer.shape.cfg.place.Amount;
import org.e2immu.analyzer.shape.cfg.place.Place;

import java.util.Comparator;

/**
 * A permission a statement needs before it executes.
 * <ul>
 *     <li>OWNED: the place is held as one folded predicate instance, with at least the given amount;</li>
 *     <li>MEMORY_BLOCK: the place may be overwritten: it is uninitialised, or fully owned in any shape.</li>
 * </ul>
 */
public record Requirement(Place place, Kind kind, Amount amount) implements Comparable<Requirement> {

    public enum Kind {
        OWNED, MEMORY_BLOCK
    }

    private static final Comparator<Requirement> COMPARATOR = Comparator.comparing(Requirement::place)
            .thenComparing(Requirement::kind)
            .thenComparing(Requirement::amount);

    public static Requirement owned(Place place, Amount amount) {
        return new Requirement(place, Kind.OWNED, amount);
    }

    public static Requirement memoryBlock(Place place) {
        return new Requirement(place, Kind.MEMORY_BLOCK, Amount.FULL);
    }

    @Override
    public int compareTo(Requirement other) {
        return COMPARATOR.compare(this, other);
    }

    @Override
    public String toString() {
        return kind == Kind.OWNED ? "owned(" + place + ", " + amount + ")" : "memory_block(" + place + ")";
    }
}
