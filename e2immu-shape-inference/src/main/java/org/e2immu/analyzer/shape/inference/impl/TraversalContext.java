package org.e2immu.analyzer.shape.inference.impl;

import org.e2immu.analyzer.shape.cfg.BasicBlockId;
import org.e2immu.analyzer.shape.cfg.Procedure;
import org.e2immu.analyzer.shape.cfg.statement.Statement;
import org.e2immu.analyzer.shape.inference.state.PermissionState;

import java.util.*;

/**
 * The in-progress record of the inference of one procedure: which blocks have been processed, which block is
 * active, the statements emitted so far for that block, and the live permission state.
 * Owned by a single {@link Visitor}; it is read by the {@link CrashReport} when the traversal fails.
 */
public class TraversalContext {
    private final Procedure procedure;
    private final Map<BasicBlockId, BlockStatus> statuses = new TreeMap<>();
    private final Map<BasicBlockId, List<Statement>> processedStatements = new TreeMap<>();
    private BasicBlockId currentLabel;
    private List<Statement> currentStatements = new ArrayList<>();
    private PermissionState state;

    public TraversalContext(Procedure procedure) {
        this.procedure = procedure;
        procedure.blockIds().forEach(id -> statuses.put(id, BlockStatus.UNVISITED));
    }

    public Procedure procedure() {
        return procedure;
    }

    public BlockStatus status(BasicBlockId id) {
        return statuses.getOrDefault(id, BlockStatus.UNVISITED);
    }

    public BasicBlockId currentLabel() {
        return currentLabel;
    }


    public List<Statement> currentStatements() {
        return Collections.unmodifiableList(currentStatements);
    }

    public PermissionState state() {
        return state;
    }

    public List<Statement> processedStatements(BasicBlockId id) {
        return processedStatements.get(id);
    }

    void enter(BasicBlockId id, PermissionState entryState) {
        currentLabel = id;
        currentStatements = new ArrayList<>();
        state = entryState;
        statuses.put(id, BlockStatus.PROCESSING);
    }

    /*
    the block is active again, outside of its processing: edge reconciliation or validation
     */
    void reconcile(BasicBlockId id) {
        currentLabel = id;
        currentStatements = new ArrayList<>();
    }

    void addStatement(Statement statement) {
        currentStatements.add(statement);
    }

    void exit() {
        assert currentLabel != null;
        processedStatements.put(currentLabel, List.copyOf(currentStatements));
        statuses.put(currentLabel, BlockStatus.DONE);
    }

    void reschedule(BasicBlockId id) {
        statuses.put(id, BlockStatus.UNVISITED);
    }
}
