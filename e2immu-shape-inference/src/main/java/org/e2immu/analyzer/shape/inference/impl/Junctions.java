package org.e2immu.analyzer.shape.inference.impl;

import org.e2immu.analyzer.shape.cfg.BasicBlockId;
import org.e2immu.analyzer.shape.cfg.Procedure;

import java.util.*;

/*
Join points are the reachable blocks with more than one reachable predecessor; the entry block counts procedure
entry as a predecessor. The edges into join points are grouped into junctions: two such edges belong to the same
junction when they share their source or their target. Every junction carries one permission state.

A source with an edge into a junction ends in the junction's state, so its other successors enter in that state
as well. Any other block enters in the exit state of its only predecessor.
Junctions are numbered in order of their smallest source block.
 */
class Junctions {
    private final Map<BasicBlockId, Integer> junctionOfSource = new TreeMap<>();
    private final Map<BasicBlockId, Integer> junctionOfTarget = new TreeMap<>();
    private final Map<BasicBlockId, BasicBlockId> singlePredecessor = new TreeMap<>();
    private final List<SortedSet<BasicBlockId>> targets = new ArrayList<>();
    private final Integer entryJunction;

    Junctions(Procedure procedure, Set<BasicBlockId> reachable) {
        Map<BasicBlockId, List<BasicBlockId>> predecessors = new TreeMap<>();
        procedure.predecessors().forEach((target, sources) -> {
            List<BasicBlockId> reachableSources = sources.stream().filter(reachable::contains).toList();
            if (!reachableSources.isEmpty()) predecessors.put(target, reachableSources);
        });
        Set<BasicBlockId> joinPoints = new TreeSet<>();
        predecessors.forEach((target, sources) -> {
            boolean entry = target.equals(procedure.entry());
            if (sources.size() > 1 || entry) joinPoints.add(target);
            else singlePredecessor.put(target, sources.get(0));
        });

        // union-find over nodes 2*i (exit of block i) and 2*i+1 (entry of block i)
        int n = procedure.basicBlocks().size();
        int[] parent = new int[2 * n];
        for (int i = 0; i < parent.length; i++) parent[i] = i;
        for (BasicBlockId target : joinPoints) {
            for (BasicBlockId source : predecessors.get(target)) {
                union(parent, 2 * source.index(), 2 * target.index() + 1);
            }
        }
        Map<Integer, Integer> numbering = new HashMap<>();
        for (BasicBlockId id : procedure.blockIds()) {
            if (!reachable.contains(id)) continue;
            List<BasicBlockId> blockTargets = procedure.basicBlock(id).successor().targets();
            if (blockTargets.stream().noneMatch(joinPoints::contains)) continue;
            int root = find(parent, 2 * id.index());
            int junction = numbering.computeIfAbsent(root, r -> {
                targets.add(new TreeSet<>());
                return targets.size() - 1;
            });
            junctionOfSource.put(id, junction);
            for (BasicBlockId target : blockTargets) {
                junctionOfTarget.put(target, junction);
                singlePredecessor.remove(target);
                targets.get(junction).add(target);
            }
        }
        entryJunction = junctionOfTarget.get(procedure.entry());
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int a, int b) {
        int ra = find(parent, a);
        int rb = find(parent, b);
        if (ra != rb) parent[Math.max(ra, rb)] = Math.min(ra, rb);
    }

    int size() {
        return targets.size();
    }

    // null when none of the block's successors is a join point
    Integer outgoing(BasicBlockId source) {
        return junctionOfSource.get(source);
    }

    // null when the block is entered from a single predecessor without junction, or only on procedure entry
    Integer incoming(BasicBlockId target) {
        return junctionOfTarget.get(target);
    }

    // the block whose exit state is the entry state of the target, when there is no junction in between
    BasicBlockId predecessor(BasicBlockId target) {
        return singlePredecessor.get(target);
    }

    Integer entryJunction() {
        return entryJunction;
    }

    SortedSet<BasicBlockId> targets(int junction) {
        return targets.get(junction);
    }
}
