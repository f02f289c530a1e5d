package org.e2immu.analyzer.shape.inference.state;

import org.e2immu.analyzer.shape.cfg.place.Amount;
import org.e2immu.analyzer.shape.cfg.place.Place;
import org.e2immu.analyzer.shape.cfg.place.Variable;
import org.e2immu.analyzer.shape.cfg.type.TypeDeclarations;
import org.jetbrains.annotations.NotNull;

import java.util.*;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * The permissions held at one program point.
 * <p>
 * Every declared variable is accounted for by exactly one of
 * <ul>
 *     <li><code>owned</code>: a folded predicate instance (or a primitive value), with its amount;</li>
 *     <li><code>unfolded</code>: the place's fields are exposed, and each of them is accounted for in turn;</li>
 *     <li><code>memoryBlocks</code>: allocated, but not initialised: it can be written, not read;</li>
 *     <li>a unique loan: the place has been lent out as a whole, see <code>loans</code>.</li>
 * </ul>
 * A shared loan leaves part of the amount with the lender, so the lender stays in <code>owned</code>, or in
 * <code>unfolded</code> when that part has been unfolded.
 * Loans are keyed by their borrower, which is always a variable.
 * <p>
 * All collections are sorted in the canonical place order, which makes iteration, and therefore the actions
 * derived from a state, deterministic.
 */
public class PermissionState {

    public enum Kind {
        OWNED, UNFOLDED, MEMORY_BLOCK, LENT, UNDECLARED
    }

    /**
     * How a place is represented: <code>at</code> is the place itself, or the ancestor that holds it.
     */
    public record Coverage(Place at, Kind kind) {
    }

    private final TypeDeclarations typeDeclarations;
    private final SortedSet<Place> roots;
    private final TreeMap<Place, Amount> owned;
    private final TreeSet<Place> unfolded;
    private final TreeSet<Place> memoryBlocks;
    private final TreeMap<Place, Loan> loans;

    private PermissionState(TypeDeclarations typeDeclarations, SortedSet<Place> roots) {
        this.typeDeclarations = typeDeclarations;
        this.roots = roots;
        owned = new TreeMap<>();
        unfolded = new TreeSet<>();
        memoryBlocks = new TreeSet<>();
        loans = new TreeMap<>();
    }

    private PermissionState(PermissionState other) {
        typeDeclarations = other.typeDeclarations;
        roots = other.roots;
        owned = new TreeMap<>(other.owned);
        unfolded = new TreeSet<>(other.unfolded);
        memoryBlocks = new TreeSet<>(other.memoryBlocks);
        loans = new TreeMap<>(other.loans);
    }

    public static PermissionState initial(TypeDeclarations typeDeclarations,
                                          List<Variable> parameters,
                                          List<Variable> returns) {
        return initial(typeDeclarations, parameters, returns, List.of());
    }

    /**
     * Parameters are fully owned; return variables and locals are memory blocks, they have not been
     * initialised yet.
     */
    public static PermissionState initial(TypeDeclarations typeDeclarations,
                                          List<Variable> parameters,
                                          List<Variable> returns,
                                          List<Variable> locals) {
        TreeSet<Place> roots = new TreeSet<>();
        PermissionState state = new PermissionState(typeDeclarations, Collections.unmodifiableSortedSet(roots));
        for (Variable parameter : parameters) {
            addRoot(roots, parameter);
            state.owned.put(parameter.place(), Amount.FULL);
        }
        for (Variable variable : returns) {
            addRoot(roots, variable);
            state.memoryBlocks.add(variable.place());
        }
        for (Variable local : locals) {
            addRoot(roots, local);
            state.memoryBlocks.add(local.place());
        }
        assert state.invariantHolds();
        return state;
    }

    private static void addRoot(Set<Place> roots, Variable variable) {
        if (!roots.add(variable.place())) {
            throw new IllegalArgumentException("Variable " + variable.name() + " declared twice");
        }
    }

    public PermissionState copy() {
        return new PermissionState(this);
    }

    // ---------------------------------------------------------------- queries

    public List<Place> fields(Place place) {
        return typeDeclarations.fieldsOf(place.type()).stream().map(place::field).toList();
    }

    public Amount ownedAmount(Place place) {
        return owned.get(place);
    }

    public boolean isUniquelyLent(Place place) {
        return loans.values().stream().anyMatch(loan -> loan.unique() && loan.lender().equals(place));
    }

    public List<Loan> loansOf(Place lender) {
        return loans.values().stream().filter(loan -> loan.lender().equals(lender)).toList();
    }

    public boolean hasLoansWithLender(Place lender) {
        return loans.values().stream().anyMatch(loan -> loan.lender().equals(lender));
    }

    /**
     * @return the lenders of active loans, in canonical order
     */
    public SortedSet<Place> lenders() {
        return loans.values().stream().map(Loan::lender).collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * @return the lenders at or below the given place, in canonical order
     */
    public SortedSet<Place> lendersIn(Place place) {
        return loans.values().stream().map(Loan::lender).filter(place::isPrefixOf)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * @return the loans whose borrower lies at or below the given place, in canonical order of the borrower
     */
    public List<Loan> loansWithBorrowerIn(Place place) {
        return loans.values().stream().filter(loan -> place.isPrefixOf(loan.borrower())).toList();
    }

    @NotNull
    public Coverage coverage(Place place) {
        Place root = Place.of(place.root());
        if (!roots.contains(root)) return new Coverage(root, Kind.UNDECLARED);
        for (int depth = 0; depth <= place.depth(); depth++) {
            Place current = depth == place.depth() ? place : place.ancestorAtDepth(depth);
            if (owned.containsKey(current)) return new Coverage(current, Kind.OWNED);
            if (memoryBlocks.contains(current)) return new Coverage(current, Kind.MEMORY_BLOCK);
            if (isUniquelyLent(current)) return new Coverage(current, Kind.LENT);
            if (!unfolded.contains(current)) {
                throw new IllegalStateException("Place " + current + " is not accounted for in " + this);
            }
            if (depth == place.depth()) return new Coverage(place, Kind.UNFOLDED);
        }
        throw new IllegalStateException("Unreachable");
    }

    public boolean require(Place place, Amount amount) {
        return require(Requirement.owned(place, amount));
    }

    /**
     * Pure query: does the requirement hold in this state, without any further action?
     */
    public boolean require(Requirement requirement) {
        Place place = requirement.place();
        Coverage coverage = coverage(place);
        if (!coverage.at().equals(place)) return false;
        return switch (requirement.kind()) {
            case OWNED -> coverage.kind() == Kind.OWNED && owned.get(place).covers(requirement.amount());
            case MEMORY_BLOCK -> switch (coverage.kind()) {
                case MEMORY_BLOCK -> true;
                case OWNED, UNFOLDED -> isFullyOwnedSubtree(place);
                default -> false;
            };
        };
    }

    /*
    every owned permission at or below the place is full, and nothing at or below it is involved in a loan
     */
    boolean isFullyOwnedSubtree(Place place) {
        Predicate<Place> inSubtree = place::isPrefixOf;
        boolean ownedFull = owned.entrySet().stream().filter(e -> inSubtree.test(e.getKey()))
                .allMatch(e -> e.getValue().isFull());
        return ownedFull && lendersIn(place).isEmpty() && loansWithBorrowerIn(place).isEmpty();
    }

    /*
    all leaves below an unfolded place are owned with exactly the given amount, without loans
     */
    boolean isFoldableTo(Place place, Amount amount) {
        Predicate<Place> inSubtree = place::isStrictPrefixOf;
        boolean noMemoryBlocks = memoryBlocks.stream().noneMatch(inSubtree);
        boolean amounts = owned.entrySet().stream().filter(e -> inSubtree.test(e.getKey()))
                .allMatch(e -> e.getValue().equals(amount));
        return noMemoryBlocks && amounts && lendersIn(place).stream().allMatch(place::equals);
    }

    // ---------------------------------------------------------------- actions

    public List<Action> obtain(Place place, Amount amount) {
        return obtain(Requirement.owned(place, amount));
    }

    /**
     * Performs the actions that make the requirement hold.
     *
     * @return the actions, in the order in which they were performed
     * @throws UnsatisfiablePermissionException when no sequence of actions achieves the requirement
     */
    public List<Action> obtain(Requirement requirement) {
        Ensurer ensurer = new Ensurer(this);
        ensurer.ensure(requirement);
        return ensurer.actions();
    }

    public void apply(Action action) {
        if (action instanceof Action.Unfold unfold) {
            unfold(unfold.place(), unfold.amount());
        } else if (action instanceof Action.Fold fold) {
            fold(fold.place(), fold.amount());
        } else if (action instanceof Action.Restore restore) {
            restore(restore.place());
        } else if (action instanceof Action.IntoMemoryBlock into) {
            intoMemoryBlock(into.place());
        } else {
            throw new UnsupportedOperationException("Unknown action " + action);
        }
        assert invariantHolds() : "Invariant broken after " + action + ": " + this;
    }

    private void unfold(Place place, Amount amount) {
        List<Place> fields = fields(place);
        if (fields.isEmpty()) {
            throw new UnsatisfiablePermissionException("Cannot unfold " + place + " of type " + place.type());
        }
        if (amount == null) {
            if (!memoryBlocks.remove(place)) {
                throw new UnsatisfiablePermissionException("Cannot split " + place + ", not a memory block");
            }
            memoryBlocks.addAll(fields);
        } else {
            Amount held = owned.get(place);
            if (!amount.equals(held)) {
                throw new UnsatisfiablePermissionException("Cannot unfold " + place + " at " + amount + ", holding "
                                                           + held);
            }
            owned.remove(place);
            fields.forEach(field -> owned.put(field, amount));
        }
        unfolded.add(place);
    }

    private void fold(Place place, Amount amount) {
        if (!unfolded.contains(place)) {
            throw new UnsatisfiablePermissionException("Cannot fold " + place + ", it is not unfolded");
        }
        List<Place> fields = fields(place);
        for (Place field : fields) {
            if (!amount.equals(owned.get(field))) {
                throw new UnsatisfiablePermissionException("Cannot fold " + place + " at " + amount + ": field "
                                                           + field + " is " + coverage(field).kind() + " "
                                                           + owned.get(field));
            }
            if (hasLoansWithLender(field)) {
                throw new UnsatisfiablePermissionException("Cannot fold " + place + ": field " + field + " is lent");
            }
        }
        fields.forEach(owned::remove);
        unfolded.remove(place);
        owned.put(place, amount);
    }

    private void restore(Place lender) {
        List<Loan> loansOfLender = loansOf(lender);
        if (loansOfLender.isEmpty()) {
            throw new UnsatisfiablePermissionException("Cannot restore " + lender + ", it has no loans");
        }
        boolean unique = loansOfLender.stream().anyMatch(Loan::unique);
        if (!unique && !owned.containsKey(lender)) {
            throw new UnsatisfiablePermissionException("Cannot restore " + lender + ", it must be folded");
        }
        for (Loan loan : loansOfLender) {
            if (!lendersIn(loan.borrower()).isEmpty()) {
                throw new UnsatisfiablePermissionException("Cannot restore " + lender + ": borrower "
                                                           + loan.borrower() + " has lent in turn");
            }
        }
        Amount amount = owned.get(lender);
        for (Loan loan : loansOfLender) {
            loans.remove(loan.borrower());
            removeSubtree(loan.borrower());
            memoryBlocks.add(loan.borrower());
            amount = amount == null ? loan.amount() : amount.plus(loan.amount());
        }
        owned.put(lender, amount);
    }

    private void intoMemoryBlock(Place place) {
        Kind kind = coverage(place).kind();
        if (kind == Kind.MEMORY_BLOCK) return;
        if (!coverage(place).at().equals(place) || kind != Kind.OWNED && kind != Kind.UNFOLDED) {
            throw new UnsatisfiablePermissionException("Cannot turn " + place + " into a memory block, it is "
                                                       + kind);
        }
        Predicate<Place> inSubtree = place::isPrefixOf;
        boolean full = owned.entrySet().stream().filter(e -> inSubtree.test(e.getKey()))
                .allMatch(e -> e.getValue().isFull());
        if (!full || !lendersIn(place).isEmpty()) {
            throw new UnsatisfiablePermissionException("Cannot turn " + place
                                                       + " into a memory block, it is not fully owned");
        }
        removeSubtree(place);
        memoryBlocks.add(place);
    }

    private void removeSubtree(Place place) {
        Predicate<Place> inSubtree = place::isPrefixOf;
        owned.keySet().removeIf(inSubtree);
        unfolded.removeIf(inSubtree);
        memoryBlocks.removeIf(inSubtree);
    }

    // ---------------------------------------------------------------- statement effects

    /**
     * The value at the place is taken; afterwards the place is uninitialised.
     */
    public void move(Place place) {
        if (!require(Requirement.owned(place, Amount.FULL))) {
            throw new UnsatisfiablePermissionException("Cannot move out of " + place + " in " + this);
        }
        owned.remove(place);
        memoryBlocks.add(place);
        assert invariantHolds();
    }

    /**
     * The place receives a new value, and is fully owned and folded afterwards.
     */
    public void write(Place place) {
        if (!require(Requirement.memoryBlock(place))) {
            throw new UnsatisfiablePermissionException("Cannot write to " + place + " in " + this);
        }
        removeSubtree(place);
        owned.put(place, Amount.FULL);
        assert invariantHolds();
    }

    public void borrow(Place borrower, Place lender, boolean unique) {
        if (!borrower.isRoot()) {
            throw new UnsatisfiablePermissionException("Borrower " + borrower + " must be a variable");
        }
        if (borrower.equals(lender) || lender.root().equals(borrower.root())) {
            throw new UnsatisfiablePermissionException("Cannot borrow " + lender + " into " + borrower);
        }
        if (!require(Requirement.memoryBlock(borrower))
            || !require(Requirement.owned(lender, unique ? Amount.FULL : Amount.ANY))) {
            throw new UnsatisfiablePermissionException("Cannot borrow " + lender + " into " + borrower
                                                       + " in " + this);
        }
        removeSubtree(borrower);
        Amount amount;
        if (unique) {
            amount = owned.remove(lender);
        } else {
            amount = owned.get(lender).half();
            owned.put(lender, amount);
        }
        owned.put(borrower, amount);
        loans.put(borrower, new Loan(lender, borrower, amount, unique));
        assert invariantHolds();
    }

    // ---------------------------------------------------------------- merge

    /**
     * Reconciles two states that reach the same program point.
     * <p>
     * Loans that are not present identically on both sides are restored first. Then every place is joined from
     * the roots down, towards the most folded representation that both sides can reach: an unfolded place meets a
     * folded one by folding; when that is impossible because part of it is uninitialised, or when one side holds
     * a memory block, the place becomes a memory block on both sides.
     *
     * @param other the other state
     * @param label where the states meet, for error messages
     * @return the reconciled state, and the actions that bring this state, and the other state, there
     * @throws UnsatisfiablePermissionException when the states cannot be reconciled
     */
    public MergeResult merge(PermissionState other, Object label) {
        if (!roots.equals(other.roots)) {
            throw new UnsatisfiablePermissionException("Cannot merge states with different variables at " + label);
        }
        Ensurer left = new Ensurer(copy());
        Ensurer right = new Ensurer(other.copy());
        Place lender;
        while ((lender = firstLenderWithDifferentLoans(left.state(), right.state())) != null) {
            if (left.state().hasLoansWithLender(lender)) left.restore(lender);
            if (right.state().hasLoansWithLender(lender)) right.restore(lender);
        }
        for (Place root : roots) {
            join(root, left, right, label);
        }
        if (!left.state().equals(right.state())) {
            throw new UnsatisfiablePermissionException("Cannot reconcile states at " + label + ": "
                                                       + left.state() + " and " + right.state());
        }
        return new MergeResult(left.state(), left.actions(), right.actions());
    }

    private static Place firstLenderWithDifferentLoans(PermissionState left, PermissionState right) {
        TreeSet<Place> lenders = new TreeSet<>(left.lenders());
        lenders.addAll(right.lenders());
        for (Place lender : lenders) {
            if (!left.loansOf(lender).equals(right.loansOf(lender))) return lender;
        }
        return null;
    }

    private static void join(Place place, Ensurer left, Ensurer right, Object label) {
        PermissionState l = left.state();
        PermissionState r = right.state();
        Kind kl = l.coverage(place).kind();
        Kind kr = r.coverage(place).kind();
        if (kl == Kind.UNFOLDED && kr == Kind.UNFOLDED) {
            for (Place field : l.fields(place)) {
                join(field, left, right, label);
            }
            return;
        }
        if (kl == kr) {
            if (kl == Kind.OWNED && !l.ownedAmount(place).equals(r.ownedAmount(place))) {
                throw new UnsatisfiablePermissionException("Different amounts for " + place + " at " + label + ": "
                                                           + l.ownedAmount(place) + " and " + r.ownedAmount(place));
            }
            return;
        }
        if (kl == Kind.LENT || kr == Kind.LENT) {
            throw new UnsatisfiablePermissionException("Place " + place + " is lent on one side only at " + label);
        }
        if (kl == Kind.OWNED && kr == Kind.UNFOLDED && r.isFoldableTo(place, l.ownedAmount(place))) {
            right.foldSubtree(place);
            return;
        }
        if (kl == Kind.UNFOLDED && kr == Kind.OWNED && l.isFoldableTo(place, r.ownedAmount(place))) {
            left.foldSubtree(place);
            return;
        }
        if (kl != Kind.MEMORY_BLOCK) left.intoMemoryBlock(place);
        if (kr != Kind.MEMORY_BLOCK) right.intoMemoryBlock(place);
    }

    // ---------------------------------------------------------------- invariants, equality, printing

    public boolean invariantHolds() {
        if (owned.values().stream().anyMatch(Amount::isAny)) return false;
        Set<Place> present = new HashSet<>(owned.keySet());
        present.addAll(unfolded);
        present.addAll(memoryBlocks);
        loans.values().stream().filter(Loan::unique).map(Loan::lender).forEach(present::add);
        int expectedSize = owned.size() + unfolded.size() + memoryBlocks.size()
                           + (int) loans.values().stream().filter(Loan::unique).count();
        if (present.size() != expectedSize) return false; // not disjoint
        for (Place place : present) {
            if (place.isRoot() ? !roots.contains(place) : !unfolded.contains(place.parent())) return false;
        }
        for (Place root : roots) {
            if (!present.contains(root)) return false;
        }
        for (Place place : unfolded) {
            List<Place> fields = fields(place);
            if (fields.isEmpty() || !present.containsAll(fields)) return false;
        }
        for (Loan loan : loans.values()) {
            if (!loan.borrower().isRoot()) return false;
            if (!loan.unique() && !owned.containsKey(loan.lender()) && !unfolded.contains(loan.lender())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PermissionState that)) return false;
        return roots.equals(that.roots)
               && owned.equals(that.owned)
               && unfolded.equals(that.unfolded)
               && memoryBlocks.equals(that.memoryBlocks)
               && loans.equals(that.loans);
    }

    @Override
    public int hashCode() {
        return Objects.hash(owned, unfolded, memoryBlocks, loans);
    }

    @Override
    public String toString() {
        return "owned=" + owned + ", unfolded=" + unfolded + ", memoryBlocks=" + memoryBlocks + ", loans=" + loans;
    }
}
