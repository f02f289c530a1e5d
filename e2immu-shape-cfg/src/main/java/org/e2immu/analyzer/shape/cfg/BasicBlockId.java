package org.e2immu.analyzer.shape.cfg;

/*
index into the list of basic blocks of one procedure
 */
public record BasicBlockId(int index) implements Comparable<BasicBlockId> {

    public BasicBlockId {
        if (index < 0) throw new IllegalArgumentException("Negative block index " + index);
    }

    @Override
    public int compareTo(BasicBlockId other) {
        return Integer.compare(index, other.index);
    }

    @Override
    public String toString() {
        return "bb" + index;
    }
}
