package org.e2immu.analyzer.shape.inference.impl;

import org.e2immu.analyzer.shape.cfg.Successor;
import org.e2immu.analyzer.shape.cfg.place.Amount;
import org.e2immu.analyzer.shape.cfg.place.Place;
import org.e2immu.analyzer.shape.cfg.statement.Expression;
import org.e2immu.analyzer.shape.cfg.statement.Statement;
import org.e2immu.analyzer.shape.cfg.type.Field;
import org.e2immu.analyzer.shape.cfg.type.TypeDeclarations;
import org.e2immu.analyzer.shape.inference.state.Action;
import org.e2immu.analyzer.shape.inference.state.PermissionState;
import org.e2immu.analyzer.shape.inference.state.Requirement;
import org.e2immu.analyzer.shape.inference.state.UnsatisfiablePermissionException;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Transfer function: what a statement needs before it executes, and what it does to the permission state.
 */
public class Semantics {
    private final TypeDeclarations typeDeclarations;

    public Semantics(TypeDeclarations typeDeclarations) {
        this.typeDeclarations = typeDeclarations;
    }

    /**
     * @return the requirements of the statement, without duplicates, in canonical order
     */
    public List<Requirement> requirements(Statement statement) {
        List<Requirement> list = new ArrayList<>();
        if (statement instanceof Statement.Comment) {
            return List.of();
        } else if (statement instanceof Statement.Assign assign) {
            reads(assign.value(), list);
            list.add(Requirement.memoryBlock(assign.target()));
        } else if (statement instanceof Statement.Assert anAssert) {
            reads(anAssert.condition(), list);
        } else if (statement instanceof Statement.Call call) {
            call.arguments().forEach(argument -> reads(argument, list));
            if (call.target() != null) list.add(Requirement.memoryBlock(call.target()));
        } else if (statement instanceof Statement.Borrow borrow) {
            checkBorrow(borrow);
            list.add(Requirement.owned(borrow.place(), borrow.unique() ? Amount.FULL : Amount.ANY));
            list.add(Requirement.memoryBlock(borrow.target()));
        } else if (statement instanceof Statement.Fold fold) {
            if (fold.amount() == null) {
                throw new UnsatisfiablePermissionException("Fold of " + fold.place() + " needs an amount");
            }
            List<Field> fields = typeDeclarations.fieldsOf(fold.place().type());
            if (fields.isEmpty()) {
                throw new UnsatisfiablePermissionException("Cannot fold " + fold.place() + ", it has no fields");
            }
            fields.forEach(field -> list.add(Requirement.owned(fold.place().field(field), fold.amount())));
        } else if (statement instanceof Statement.Unfold unfold) {
            list.add(unfold.amount() == null ? Requirement.memoryBlock(unfold.place())
                    : Requirement.owned(unfold.place(), unfold.amount()));
        } else if (statement instanceof Statement.Restore) {
            return List.of();
        } else if (statement instanceof Statement.IntoMemoryBlock into) {
            list.add(Requirement.memoryBlock(into.place()));
        } else {
            throw new UnsupportedOperationException("Unknown statement " + statement);
        }
        return list.stream().distinct().sorted().toList();
    }

    /**
     * @return the read requirements of the guards of a switch, in canonical order
     */
    public List<Requirement> requirements(Successor successor) {
        if (successor instanceof Successor.GotoSwitch gotoSwitch) {
            List<Requirement> list = new ArrayList<>();
            gotoSwitch.switchTargets().forEach(switchTarget -> reads(switchTarget.guard(), list));
            return list.stream().distinct().sorted().toList();
        }
        return List.of();
    }

    private static void reads(Expression expression, List<Requirement> list) {
        if (expression instanceof Expression.Read read) {
            list.add(Requirement.owned(read.place(), Amount.ANY));
        } else if (expression instanceof Expression.Move move) {
            list.add(Requirement.owned(move.place(), Amount.FULL));
        } else if (expression instanceof Expression.UnaryOperation unary) {
            reads(unary.operand(), list);
        } else if (expression instanceof Expression.BinaryOperation binary) {
            reads(binary.left(), list);
            reads(binary.right(), list);
        } else if (!(expression instanceof Expression.Constant)) {
            throw new UnsupportedOperationException("Unknown expression " + expression);
        }
    }

    private static Stream<Place> moves(Expression expression) {
        if (expression instanceof Expression.Move move) return Stream.of(move.place());
        if (expression instanceof Expression.UnaryOperation unary) return moves(unary.operand());
        if (expression instanceof Expression.BinaryOperation binary) {
            return Stream.concat(moves(binary.left()), moves(binary.right()));
        }
        return Stream.empty();
    }

    private static void checkBorrow(Statement.Borrow borrow) {
        if (!borrow.target().isRoot()) {
            throw new UnsatisfiablePermissionException("Cannot borrow into " + borrow.target()
                                                       + ", the target must be a variable");
        }
        if (!borrow.target().type().equals(borrow.place().type())) {
            throw new UnsatisfiablePermissionException("Cannot borrow " + borrow.place() + " of type "
                                                       + borrow.place().type() + " into " + borrow.target()
                                                       + " of type " + borrow.target().type());
        }
    }

    /*
    ensuring one requirement may undo another one, e.g. restoring a loan to read a place;
    all requirements must hold simultaneously
     */
    public void checkAll(PermissionState state, Statement statement, List<Requirement> requirements) {
        for (Requirement requirement : requirements) {
            if (!state.require(requirement)) {
                throw new UnsatisfiablePermissionException("Conflicting requirements for '" + statement + "': "
                                                           + requirement + " does not hold in " + state);
            }
        }
    }

    /**
     * Applies the effects of the statement. The requirements of the statement must hold.
     */
    public void apply(PermissionState state, Statement statement) {
        if (statement instanceof Statement.Assign assign) {
            moves(assign.value()).forEach(state::move);
            state.write(assign.target());
        } else if (statement instanceof Statement.Call call) {
            call.arguments().stream().flatMap(Semantics::moves).forEach(state::move);
            if (call.target() != null) state.write(call.target());
        } else if (statement instanceof Statement.Borrow borrow) {
            state.borrow(borrow.target(), borrow.place(), borrow.unique());
        } else if (statement.isAction()) {
            state.apply(Action.fromStatement(statement));
        } else if (!(statement instanceof Statement.Comment) && !(statement instanceof Statement.Assert)) {
            throw new UnsupportedOperationException("Unknown statement " + statement);
        }
    }
}
