package org.e2immu.analyzer.shape.cfg.statement;

import org.e2immu.analyzer.shape.cfg.place.Amount;
import org.e2immu.analyzer.shape.cfg.place.Place;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The statements of a basic block. The first five kinds come from the front-end; the last four are the action
 * statements inserted by the shape inference. The set is closed: every consumer matches exhaustively.
 */
public sealed interface Statement permits Statement.Comment, Statement.Assign, Statement.Assert, Statement.Call,
        Statement.Borrow, Statement.Fold, Statement.Unfold, Statement.Restore, Statement.IntoMemoryBlock {

    default boolean isAction() {
        return false;
    }

    record Comment(String text) implements Statement {
        @Override
        public String toString() {
            return "// " + text;
        }
    }

    record Assign(Place target, Expression value) implements Statement {
        @Override
        public String toString() {
            return target + " = " + value;
        }
    }

    record Assert(Expression condition) implements Statement {
        @Override
        public String toString() {
            return "assert " + condition;
        }
    }

    /*
    target is null when the result of the call is not used
     */
    record Call(@Nullable Place target, String callee, List<Expression> arguments) implements Statement {
        public Call {
            arguments = List.copyOf(arguments);
        }

        @Override
        public String toString() {
            String call = callee + "(" + arguments.stream().map(Object::toString)
                    .collect(Collectors.joining(", ")) + ")";
            return target == null ? call : target + " = " + call;
        }
    }

    record Borrow(Place target, Place place, boolean unique) implements Statement {
        @Override
        public String toString() {
            return target + " = &" + (unique ? "mut " : "") + place;
        }
    }

    // fold the fields of place into one predicate instance of the given amount
    record Fold(Place place, Amount amount) implements Statement {
        @Override
        public boolean isAction() {
            return true;
        }

        @Override
        public String toString() {
            return "fold acc(" + place + ", " + amount + ")";
        }
    }

    // amount is null when a memory block, rather than an owned predicate instance, is split into its fields
    record Unfold(Place place, @Nullable Amount amount) implements Statement {
        @Override
        public boolean isAction() {
            return true;
        }

        @Override
        public String toString() {
            if (amount == null) return "unfold memory_block(" + place + ")";
            return "unfold acc(" + place + ", " + amount + ")";
        }
    }

    record Restore(Place place) implements Statement {
        @Override
        public boolean isAction() {
            return true;
        }

        @Override
        public String toString() {
            return "restore " + place;
        }
    }

    record IntoMemoryBlock(Place place) implements Statement {
        @Override
        public boolean isAction() {
            return true;
        }

        @Override
        public String toString() {
            return "into_memory_block " + place;
        }
    }
}
