package org.e2immu.analyzer.shape.cfg.place;

import org.e2immu.analyzer.shape.cfg.type.Type;

public record Variable(String name, Type type) {

    public Place place() {
        return Place.of(this);
    }

    @Override
    public String toString() {
        return name + ": " + type;
    }
}
