package org.e2immu.analyzer.shape.cfg.type;

public sealed interface Type permits Type.Int, Type.Bool, Type.Struct {
    Type INT = new Int();
    Type BOOL = new Bool();

    record Int() implements Type {
        @Override
        public String toString() {
            return "Int";
        }
    }

    record Bool() implements Type {
        @Override
        public String toString() {
            return "Bool";
        }
    }

    /*
    fields are looked up in TypeDeclarations, which allows for recursive definitions
     */
    record Struct(String name) implements Type {
        @Override
        public String toString() {
            return name;
        }
    }

    default boolean isStruct() {
        return this instanceof Struct;
    }
}
