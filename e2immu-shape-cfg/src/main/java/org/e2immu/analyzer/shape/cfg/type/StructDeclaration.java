package org.e2immu.analyzer.shape.cfg.type;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

public record StructDeclaration(String name, List<Field> fields) {

    public StructDeclaration {
        fields = List.copyOf(fields);
        Set<String> names = fields.stream().map(Field::name).collect(Collectors.toUnmodifiableSet());
        if (names.size() != fields.size()) {
            throw new IllegalArgumentException("Duplicate field names in struct " + name);
        }
    }

    public Field field(String fieldName) {
        return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Struct " + name + " has no field " + fieldName));
    }
}
