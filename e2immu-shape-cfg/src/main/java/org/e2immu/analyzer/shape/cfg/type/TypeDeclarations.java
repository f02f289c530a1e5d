package org.e2immu.analyzer.shape.cfg.type;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Registry of the struct types a procedure can refer to. Unfolding a place of struct type exposes the fields
 * declared here, in declaration order.
 */
public class TypeDeclarations {
    public static final TypeDeclarations EMPTY = new Builder().build();

    private final Map<String, StructDeclaration> structs;

    private TypeDeclarations(Map<String, StructDeclaration> structs) {
        this.structs = Collections.unmodifiableMap(structs);
    }

    public StructDeclaration struct(String name) {
        StructDeclaration declaration = structs.get(name);
        if (declaration == null) throw new IllegalArgumentException("Unknown struct " + name);
        return declaration;
    }

    public List<Field> fieldsOf(Type type) {
        if (type instanceof Type.Struct struct) {
            return struct(struct.name()).fields();
        }
        return List.of();
    }

    public boolean isKnown(String name) {
        return structs.containsKey(name);
    }

    public static class Builder {
        private final Map<String, StructDeclaration> structs = new TreeMap<>();

        public Builder addStruct(String name, Field... fields) {
            StructDeclaration prev = structs.put(name, new StructDeclaration(name, List.of(fields)));
            if (prev != null) throw new IllegalArgumentException("Struct " + name + " declared twice");
            return this;
        }

        public TypeDeclarations build() {
            return new TypeDeclarations(new TreeMap<>(structs));
        }
    }
}
