package org.e2immu.analyzer.shape.inference.state;

import org.e2immu.analyzer.shape.cfg.place.Amount;
import org.e2immu.analyzer.shape.cfg.place.Place;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;

import static org.e2immu.analyzer.shape.inference.state.PermissionState.Kind;

/*
Searches for, and performs, the actions that make a requirement hold in a state.
The state is modified in place; the actions are recorded in the order they were performed.
The search is greedy: folds, unfolds and restores are tried in canonical place order, so that
the same state and requirement always produce the same actions.
 */
class Ensurer {
    private static final Logger LOGGER = LoggerFactory.getLogger(Ensurer.class);

    private final PermissionState state;
    private final List<Action> actions = new ArrayList<>();

    Ensurer(PermissionState state) {
        this.state = state;
    }

    PermissionState state() {
        return state;
    }

    List<Action> actions() {
        return List.copyOf(actions);
    }

    private void perform(Action action) {
        LOGGER.debug("Perform {} on {}", action, state);
        state.apply(action);
        actions.add(action);
    }

    void ensure(Requirement requirement) {
        if (state.require(requirement)) return;
        Place place = requirement.place();
        boolean wantsMemoryBlock = requirement.kind() == Requirement.Kind.MEMORY_BLOCK;
        Amount needed = wantsMemoryBlock ? Amount.FULL : requirement.amount();
        if (!needed.isAny()) {
            restoreUnfoldedLendersAbove(place);
        }

        // go down until the place itself is represented in the state
        while (true) {
            PermissionState.Coverage coverage = state.coverage(place);
            Place at = coverage.at();
            if (coverage.kind() == Kind.UNDECLARED) {
                throw new UnsatisfiablePermissionException("Undeclared variable in " + place);
            }
            if (at.equals(place)) break;
            switch (coverage.kind()) {
                case LENT -> restore(at);
                case OWNED -> {
                    // a shared lender keeps its loans while unfolded, as long as its part suffices
                    if (state.hasLoansWithLender(at) && !state.ownedAmount(at).covers(needed)) {
                        restore(at);
                    }
                    perform(new Action.Unfold(at, state.ownedAmount(at)));
                }
                case MEMORY_BLOCK -> {
                    if (!wantsMemoryBlock) {
                        throw new UnsatisfiablePermissionException("Cannot read " + place + ": " + at
                                                                   + " is not initialised");
                    }
                    perform(new Action.Unfold(at, null));
                }
                default -> throw new IllegalStateException("Place " + at + " is " + coverage.kind());
            }
        }

        if (state.coverage(place).kind() == Kind.LENT) {
            restore(place);
        }
        if (wantsMemoryBlock) {
            if (state.coverage(place).kind() != Kind.MEMORY_BLOCK) {
                releaseLoans(place);
            }
        } else {
            Kind kind = state.coverage(place).kind();
            if (kind == Kind.MEMORY_BLOCK) {
                throw new UnsatisfiablePermissionException("Cannot read " + place + ", it is not initialised");
            }
            if (kind == Kind.UNFOLDED) {
                foldSubtree(place);
            }
            Amount held = state.ownedAmount(place);
            if (!held.covers(requirement.amount()) && state.hasLoansWithLender(place)) {
                restore(place);
            }
        }
        if (!state.require(requirement)) {
            throw new UnsatisfiablePermissionException("Cannot obtain " + requirement + " in " + state);
        }
    }

    private void restoreUnfoldedLendersAbove(Place place) {
        Place lender;
        while ((lender = state.lenders().stream()
                .filter(l -> l.isStrictPrefixOf(place) && state.coverage(l).kind() == Kind.UNFOLDED)
                .findFirst().orElse(null)) != null) {
            restore(lender);
        }
    }

    private void releaseLoans(Place place) {
        SortedSet<Place> lenders;
        while (!(lenders = state.lendersIn(place)).isEmpty()) {
            restore(lenders.first());
        }
        List<Loan> borrowed;
        while (!(borrowed = state.loansWithBorrowerIn(place)).isEmpty()) {
            restore(borrowed.get(0).lender());
        }
    }

    /*
    fold all unfolded places below, and including, the given place; lent fields are restored first
     */
    void foldSubtree(Place place) {
        Amount amount = null;
        for (Place field : state.fields(place)) {
            Kind kind = state.coverage(field).kind();
            if (kind == Kind.LENT) {
                restore(field);
            } else if (kind == Kind.UNFOLDED) {
                foldSubtree(field);
            } else if (kind == Kind.MEMORY_BLOCK) {
                throw new UnsatisfiablePermissionException("Cannot fold " + place + ": " + field
                                                           + " is not initialised");
            }
            if (state.hasLoansWithLender(field)) {
                restore(field);
            }
            Amount fieldAmount = state.ownedAmount(field);
            if (amount == null) {
                amount = fieldAmount;
            } else if (!amount.equals(fieldAmount)) {
                throw new UnsatisfiablePermissionException("Cannot fold " + place + ": fields held at "
                                                           + amount + " and " + fieldAmount);
            }
        }
        perform(new Action.Fold(place, amount));
    }

    /*
    end all loans of the lender; borrowers that have lent in turn are restored first,
    an unfolded shared lender is folded first
     */
    void restore(Place lender) {
        if (state.coverage(lender).kind() == Kind.UNFOLDED) {
            foldSubtree(lender);
        }
        for (Loan loan : state.loansOf(lender)) {
            SortedSet<Place> nested;
            while (!(nested = state.lendersIn(loan.borrower())).isEmpty()) {
                restore(nested.first());
            }
        }
        perform(new Action.Restore(lender));
    }

    void intoMemoryBlock(Place place) {
        if (state.coverage(place).kind() == Kind.MEMORY_BLOCK) return;
        releaseLoans(place);
        perform(new Action.IntoMemoryBlock(place));
    }
}
