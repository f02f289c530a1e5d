package org.e2immu.analyzer.shape.cfg.statement;

import org.e2immu.analyzer.shape.cfg.place.Place;
import org.e2immu.analyzer.shape.cfg.type.Type;

public sealed interface Expression permits Expression.Constant, Expression.Read, Expression.Move,
        Expression.UnaryOperation, Expression.BinaryOperation {

    Type type();

    record Constant(Type type, Object value) implements Expression {
        public static final Constant TRUE = new Constant(Type.BOOL, true);
        public static final Constant FALSE = new Constant(Type.BOOL, false);

        public static Constant of(long value) {
            return new Constant(Type.INT, value);
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    // copies the value; read access is sufficient
    record Read(Place place) implements Expression {
        @Override
        public Type type() {
            return place.type();
        }

        @Override
        public String toString() {
            return place.toString();
        }
    }

    // takes the value; the place is uninitialised afterwards
    record Move(Place place) implements Expression {
        @Override
        public Type type() {
            return place.type();
        }

        @Override
        public String toString() {
            return "move " + place;
        }
    }

    record UnaryOperation(UnaryOperator operator, Expression operand) implements Expression {
        @Override
        public Type type() {
            return operator == UnaryOperator.NOT ? Type.BOOL : Type.INT;
        }

        @Override
        public String toString() {
            return operator.symbol + parenthesized(operand);
        }
    }

    record BinaryOperation(BinaryOperator operator, Expression left, Expression right) implements Expression {
        @Override
        public Type type() {
            return operator.comparison || operator.logical ? Type.BOOL : Type.INT;
        }

        @Override
        public String toString() {
            return parenthesized(left) + " " + operator.symbol + " " + parenthesized(right);
        }
    }

    private static String parenthesized(Expression expression) {
        if (expression instanceof BinaryOperation) return "(" + expression + ")";
        return expression.toString();
    }
}
