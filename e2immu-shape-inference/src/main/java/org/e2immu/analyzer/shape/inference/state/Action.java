package org.e2immu.analyzer.shape.inference.state;

import org.e2immu.analyzer.shape.cfg.place.Amount;
import org.e2immu.analyzer.shape.cfg.place.Place;
import org.e2immu.analyzer.shape.cfg.statement.Statement;

/**
 * A state transition inserted by the inference. Every action has a statement form, which is what ends up in the
 * rewritten procedure.
 */
public sealed interface Action permits Action.Fold, Action.Unfold, Action.Restore, Action.IntoMemoryBlock {

    Place place();

    Statement toStatement();

    record Fold(Place place, Amount amount) implements Action {
        @Override
        public Statement toStatement() {
            return new Statement.Fold(place, amount);
        }

        @Override
        public String toString() {
            return "Fold(" + place + ")";
        }
    }

    // amount null: split a memory block
    record Unfold(Place place, Amount amount) implements Action {
        @Override
        public Statement toStatement() {
            return new Statement.Unfold(place, amount);
        }

        @Override
        public String toString() {
            return "Unfold(" + place + ")";
        }
    }

    record Restore(Place place) implements Action {
        @Override
        public Statement toStatement() {
            return new Statement.Restore(place);
        }

        @Override
        public String toString() {
            return "Restore(" + place + ")";
        }
    }

    record IntoMemoryBlock(Place place) implements Action {
        @Override
        public Statement toStatement() {
            return new Statement.IntoMemoryBlock(place);
        }

        @Override
        public String toString() {
            return "IntoMemoryBlock(" + place + ")";
        }
    }

    /**
     * @return the action a statement stands for, or null when the statement is not an action statement
     */
    static Action fromStatement(Statement statement) {
        if (statement instanceof Statement.Fold fold) return new Fold(fold.place(), fold.amount());
        if (statement instanceof Statement.Unfold unfold) return new Unfold(unfold.place(), unfold.amount());
        if (statement instanceof Statement.Restore restore) return new Restore(restore.place());
        if (statement instanceof Statement.IntoMemoryBlock into) return new IntoMemoryBlock(into.place());
        return null;
    }
}
