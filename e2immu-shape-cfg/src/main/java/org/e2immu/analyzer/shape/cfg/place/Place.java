package org.e2immu.analyzer.shape.cfg.place;

import org.e2immu.analyzer.shape.cfg.type.Field;
import org.e2immu.analyzer.shape.cfg.type.Type;
import org.e2immu.analyzer.shape.cfg.type.TypeDeclarations;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A symbolic access path: a variable followed by zero or more field projections.
 * <p>
 * Places are ordered canonically: by the name of the root variable, then by the names of the projections,
 * element-wise; a place comes before all its extensions. All tie-breaking in the analysis relies on this order.
 */
public record Place(Variable root, List<Field> projections) implements Comparable<Place> {

    public Place {
        projections = List.copyOf(projections);
    }

    public static Place of(Variable variable) {
        return new Place(variable, List.of());
    }

    public Place field(Field field) {
        List<Field> list = new ArrayList<>(projections.size() + 1);
        list.addAll(projections);
        list.add(field);
        return new Place(root, list);
    }

    public Place field(String fieldName, TypeDeclarations typeDeclarations) {
        if (!(type() instanceof Type.Struct struct)) {
            throw new IllegalArgumentException("Place " + this + " of type " + type() + " has no fields");
        }
        return field(typeDeclarations.struct(struct.name()).field(fieldName));
    }

    public Type type() {
        return projections.isEmpty() ? root.type() : projections.get(projections.size() - 1).type();
    }

    public boolean isRoot() {
        return projections.isEmpty();
    }

    public int depth() {
        return projections.size();
    }

    public Place parent() {
        if (projections.isEmpty()) return null;
        return new Place(root, projections.subList(0, projections.size() - 1));
    }

    /**
     * @return the strict ancestors of this place, the root first
     */
    public List<Place> ancestors() {
        List<Place> result = new ArrayList<>(projections.size());
        for (int i = 0; i < projections.size(); i++) {
            result.add(new Place(root, projections.subList(0, i)));
        }
        return result;
    }

    public Place ancestorAtDepth(int depth) {
        return new Place(root, projections.subList(0, depth));
    }

    /**
     * @return true when <code>other</code> equals this place, or extends it
     */
    public boolean isPrefixOf(Place other) {
        if (!root.equals(other.root) || projections.size() > other.projections.size()) return false;
        return projections.equals(other.projections.subList(0, projections.size()));
    }

    public boolean isStrictPrefixOf(Place other) {
        return projections.size() < other.projections.size() && isPrefixOf(other);
    }

    @Override
    public int compareTo(Place other) {
        int c = root.name().compareTo(other.root.name());
        if (c != 0) return c;
        int n = Math.min(projections.size(), other.projections.size());
        for (int i = 0; i < n; i++) {
            int d = projections.get(i).name().compareTo(other.projections.get(i).name());
            if (d != 0) return d;
        }
        return Integer.compare(projections.size(), other.projections.size());
    }

    @Override
    public String toString() {
        if (projections.isEmpty()) return root.name();
        return root.name() + "." + projections.stream().map(Field::name).collect(Collectors.joining("."));
    }
}
