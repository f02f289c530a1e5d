package org.e2immu.analyzer.shape.cfg.type;

public record Field(String name, Type type) {

    @Override
    public String toString() {
        return name + ": " + type;
    }
}
