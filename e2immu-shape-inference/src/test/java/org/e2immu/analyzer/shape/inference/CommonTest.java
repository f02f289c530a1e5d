package org.e2immu.analyzer.shape.inference;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.e2immu.analyzer.shape.cfg.place.Place;
import org.e2immu.analyzer.shape.cfg.place.Variable;
import org.e2immu.analyzer.shape.cfg.statement.Expression;
import org.e2immu.analyzer.shape.cfg.type.Field;
import org.e2immu.analyzer.shape.cfg.type.Type;
import org.e2immu.analyzer.shape.cfg.type.TypeDeclarations;
import org.junit.jupiter.api.BeforeAll;
import org.slf4j.LoggerFactory;

public class CommonTest {
    protected static final Type POINT = new Type.Struct("Point");
    protected static final Type PAIR = new Type.Struct("Pair");

    protected static final TypeDeclarations TYPES = new TypeDeclarations.Builder()
            .addStruct("Point", new Field("x", Type.INT), new Field("y", Type.INT))
            .addStruct("Pair", new Field("left", POINT), new Field("right", POINT))
            .build();

    @BeforeAll
    public static void beforeAll() {
        ((Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)).setLevel(Level.INFO);
        ((Logger) LoggerFactory.getLogger("org.e2immu.analyzer.shape")).setLevel(Level.DEBUG);
    }

    protected static Place place(Variable variable, String... fieldNames) {
        Place place = variable.place();
        for (String fieldName : fieldNames) {
            place = place.field(fieldName, TYPES);
        }
        return place;
    }

    protected static Expression read(Place place) {
        return new Expression.Read(place);
    }
}
