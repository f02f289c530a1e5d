package org.e2immu.analyzer.shape.cfg.place;

import java.util.Objects;

/**
 * A rational permission amount. Amounts held in a permission state are always positive;
 * {@link #ANY} only occurs in requests, where it stands for "any positive amount", i.e. read access.
 */
public final class Amount implements Comparable<Amount> {
    public static final Amount FULL = new Amount(1, 1);
    public static final Amount ANY = new Amount(0, 1);

    private final int numerator;
    private final int denominator;

    private Amount(int numerator, int denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    public static Amount of(int numerator, int denominator) {
        if (numerator <= 0 || denominator <= 0) {
            throw new IllegalArgumentException("Amount must be positive: " + numerator + "/" + denominator);
        }
        int gcd = gcd(numerator, denominator);
        int n = numerator / gcd;
        int d = denominator / gcd;
        if (n == 1 && d == 1) return FULL;
        return new Amount(n, d);
    }

    private static int gcd(int a, int b) {
        return b == 0 ? a : gcd(b, a % b);
    }

    public int numerator() {
        return numerator;
    }

    public int denominator() {
        return denominator;
    }

    public boolean isFull() {
        return numerator == denominator;
    }

    public boolean isAny() {
        return numerator == 0;
    }

    public Amount half() {
        assert !isAny();
        return of(numerator, denominator * 2);
    }

    public Amount plus(Amount other) {
        assert !isAny() && !other.isAny();
        return of(numerator * other.denominator + other.numerator * denominator, denominator * other.denominator);
    }

    /**
     * @param requested an amount, possibly {@link #ANY}
     * @return true when holding this amount satisfies the request
     */
    public boolean covers(Amount requested) {
        if (requested.isAny()) return numerator > 0;
        return compareTo(requested) >= 0;
    }

    @Override
    public int compareTo(Amount other) {
        return Long.compare((long) numerator * other.denominator, (long) other.numerator * denominator);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Amount amount)) return false;
        return numerator == amount.numerator && denominator == amount.denominator;
    }

    @Override
    public int hashCode() {
        return Objects.hash(numerator, denominator);
    }

    @Override
    public String toString() {
        if (isAny()) return "_";
        if (denominator == 1) return Integer.toString(numerator);
        return numerator + "/" + denominator;
    }
}
