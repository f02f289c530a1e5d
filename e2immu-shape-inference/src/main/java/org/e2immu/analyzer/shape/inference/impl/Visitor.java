package org.e2immu.analyzer.shape.inference.impl;

import org.e2immu.analyzer.shape.cfg.BasicBlock;
import org.e2immu.analyzer.shape.cfg.BasicBlockId;
import org.e2immu.analyzer.shape.cfg.Procedure;
import org.e2immu.analyzer.shape.cfg.statement.Statement;
import org.e2immu.analyzer.shape.cfg.type.TypeDeclarations;
import org.e2immu.analyzer.shape.common.InferenceException;
import org.e2immu.analyzer.shape.inference.state.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Drives the inference over the control-flow graph of one procedure.
 * <p>
 * Blocks are processed from a work-list ordered by reverse post-order. A block with a single predecessor starts
 * in a copy of that predecessor's exit state. The exit states of the predecessors of a join point are merged into
 * the state of a junction; when that state changes, all blocks entered through the junction are scheduled again.
 * Merging only ever folds, restores, or gives up ownership, so the junction states stabilise. Once they have,
 * every predecessor of a join point is extended with the actions that take its exit state to the junction state.
 */
public class Visitor {
    private static final Logger LOGGER = LoggerFactory.getLogger(Visitor.class);

    private final Procedure procedure;
    private final TypeDeclarations typeDeclarations;
    private final Semantics semantics;
    private final int maxIterations;
    private final TraversalContext context;

    public Visitor(Procedure procedure, TypeDeclarations typeDeclarations, int maxIterations,
                   TraversalContext context) {
        this.procedure = procedure;
        this.typeDeclarations = typeDeclarations;
        this.semantics = new Semantics(typeDeclarations);
        this.maxIterations = maxIterations;
        this.context = context;
    }

    public Procedure visit() {
        try {
            return doVisit();
        } catch (InferenceException e) {
            throw e;
        } catch (RuntimeException e) {
            BasicBlockId label = context.currentLabel() == null ? procedure.entry() : context.currentLabel();
            throw new InferenceException(procedure.name(), label.toString(), e);
        }
    }

    private Procedure doVisit() {
        List<BasicBlockId> reversePostOrder = reversePostOrder();
        Map<BasicBlockId, Integer> rpoIndex = new HashMap<>();
        for (BasicBlockId id : reversePostOrder) rpoIndex.put(id, rpoIndex.size());
        Junctions junctions = new Junctions(procedure, rpoIndex.keySet());
        LOGGER.debug("Procedure {}: {} reachable blocks, {} junctions", procedure.name(), reversePostOrder.size(),
                junctions.size());

        PermissionState initial = PermissionState.initial(typeDeclarations, procedure.parameters(),
                procedure.returns(), procedure.locals());
        PermissionState[] junctionStates = new PermissionState[junctions.size()];
        Integer entryJunction = junctions.entryJunction();
        if (entryJunction != null) {
            junctionStates[entryJunction] = initial;
        }

        Map<BasicBlockId, PermissionState> exitStates = new HashMap<>();
        Map<BasicBlockId, Integer> processingCount = new HashMap<>();
        TreeSet<BasicBlockId> workList = new TreeSet<>(Comparator.comparing(rpoIndex::get));
        workList.add(procedure.entry());
        while (!workList.isEmpty()) {
            BasicBlockId id = workList.pollFirst();
            int count = processingCount.merge(id, 1, Integer::sum);
            if (count > maxIterations) {
                throw new InferenceException(procedure.name(), id.toString(), "no fixpoint after " + maxIterations
                                                                             + " iterations");
            }
            PermissionState entryState = entryState(id, junctions, junctionStates, exitStates, initial);
            assert entryState != null;
            PermissionState exitState = processBlock(id, entryState.copy());
            PermissionState previousExit = exitStates.put(id, exitState);

            Integer outgoing = junctions.outgoing(id);
            if (outgoing == null) {
                if (!exitState.equals(previousExit)) {
                    for (BasicBlockId target : procedure.basicBlock(id).successor().targets()) {
                        context.reschedule(target);
                        workList.add(target);
                    }
                }
            } else {
                PermissionState previous = junctionStates[outgoing];
                PermissionState merged = previous == null ? exitState.copy()
                        : previous.merge(exitState, id).state();
                if (!merged.equals(previous)) {
                    LOGGER.debug("State of junction {} after {}: {}", outgoing, id, merged);
                    junctionStates[outgoing] = merged;
                    for (BasicBlockId target : junctions.targets(outgoing)) {
                        context.reschedule(target);
                        workList.add(target);
                    }
                }
            }
        }

        if (entryJunction != null && !initial.merge(junctionStates[entryJunction], procedure.entry())
                .leftActions().isEmpty()) {
            throw new InferenceException(procedure.name(), procedure.entry().toString(),
                    "the entry block is also the target of a back edge, and needs actions on procedure entry");
        }
        return rewrite(junctions, junctionStates, exitStates, processingCount);
    }

    private PermissionState entryState(BasicBlockId id,
                                       Junctions junctions,
                                       PermissionState[] junctionStates,
                                       Map<BasicBlockId, PermissionState> exitStates,
                                       PermissionState initial) {
        Integer incoming = junctions.incoming(id);
        if (incoming != null) return junctionStates[incoming];
        BasicBlockId predecessor = junctions.predecessor(id);
        return predecessor == null ? initial : exitStates.get(predecessor);
    }

    private PermissionState processBlock(BasicBlockId id, PermissionState state) {
        LOGGER.debug("Process block {} of {} in state {}", id, procedure.name(), state);
        context.enter(id, state);
        BasicBlock block = procedure.basicBlock(id);
        for (Statement statement : block.statements()) {
            List<Requirement> requirements = semantics.requirements(statement);
            ensure(state, requirements);
            semantics.checkAll(state, statement, requirements);
            semantics.apply(state, statement);
            context.addStatement(statement);
        }
        List<Requirement> guardRequirements = semantics.requirements(block.successor());
        ensure(state, guardRequirements);
        context.exit();
        return state;
    }

    private void ensure(PermissionState state, List<Requirement> requirements) {
        for (Requirement requirement : requirements) {
            for (Action action : state.obtain(requirement)) {
                context.addStatement(action.toStatement());
            }
        }
    }

    private Procedure rewrite(Junctions junctions,
                              PermissionState[] junctionStates,
                              Map<BasicBlockId, PermissionState> exitStates,
                              Map<BasicBlockId, Integer> processingCount) {
        List<BasicBlock> blocks = new ArrayList<>(procedure.basicBlocks().size());
        for (BasicBlockId id : procedure.blockIds()) {
            BasicBlock block = procedure.basicBlock(id);
            PermissionState exitState = exitStates.get(id);
            if (exitState == null) {
                LOGGER.debug("Block {} of {} is unreachable", id, procedure.name());
                blocks.add(block);
                continue;
            }
            List<Statement> statements = new ArrayList<>(context.processedStatements(id));
            Integer outgoing = junctions.outgoing(id);
            if (outgoing != null) {
                context.reconcile(id);
                MergeResult mergeResult = exitState.merge(junctionStates[outgoing], id);
                if (!mergeResult.rightActions().isEmpty()) {
                    throw new InferenceException(procedure.name(), id.toString(), "state of junction " + outgoing
                                                                                 + " is not stable");
                }
                mergeResult.leftActions().forEach(action -> statements.add(action.toStatement()));
            }
            blocks.add(block.withStatements(statements));
        }
        LOGGER.debug("Procedure {}: block processing counts {}", procedure.name(), processingCount);
        return procedure.withBasicBlocks(blocks);
    }

    /*
    also verifies that all successors of reachable blocks exist
     */
    private List<BasicBlockId> reversePostOrder() {
        BasicBlockId entry = procedure.entry();
        if (!procedure.hasBlock(entry)) {
            throw new InferenceException(procedure.name(), entry.toString(), "entry block does not exist");
        }
        List<BasicBlockId> postOrder = new ArrayList<>();
        Set<BasicBlockId> visited = new HashSet<>();
        Deque<BasicBlockId> stack = new ArrayDeque<>();
        Map<BasicBlockId, Iterator<BasicBlockId>> iterators = new HashMap<>();
        visited.add(entry);
        stack.push(entry);
        while (!stack.isEmpty()) {
            BasicBlockId top = stack.peek();
            Iterator<BasicBlockId> iterator = iterators.computeIfAbsent(top,
                    t -> procedure.basicBlock(t).successor().targets().iterator());
            if (iterator.hasNext()) {
                BasicBlockId target = iterator.next();
                if (!procedure.hasBlock(target)) {
                    context.reconcile(top);
                    throw new InferenceException(procedure.name(), top.toString(),
                            "successor refers to unknown block " + target);
                }
                if (visited.add(target)) stack.push(target);
            } else {
                stack.pop();
                postOrder.add(top);
            }
        }
        Collections.reverse(postOrder);
        return postOrder;
    }
}
