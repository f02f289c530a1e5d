package org.e2immu.analyzer.shape.cfg;

import org.e2immu.analyzer.shape.cfg.place.Variable;
import org.e2immu.analyzer.shape.cfg.statement.Statement;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * A procedure as a control-flow graph. Block <code>bbN</code> is the N-th element of {@link #basicBlocks()}.
 * Both the input and the output of the shape inference have this form.
 */
public record Procedure(String name,
                        List<Variable> parameters,
                        List<Variable> returns,
                        List<Variable> locals,
                        List<BasicBlock> basicBlocks,
                        BasicBlockId entry) {

    public Procedure {
        parameters = List.copyOf(parameters);
        returns = List.copyOf(returns);
        locals = List.copyOf(locals);
        basicBlocks = List.copyOf(basicBlocks);
    }

    public boolean hasBlock(BasicBlockId id) {
        return id.index() < basicBlocks.size();
    }

    public BasicBlock basicBlock(BasicBlockId id) {
        return basicBlocks.get(id.index());
    }

    public List<BasicBlockId> blockIds() {
        return IntStream.range(0, basicBlocks.size()).mapToObj(BasicBlockId::new).toList();
    }

    /*
    only edges to existing blocks are taken into account
     */
    public Map<BasicBlockId, List<BasicBlockId>> predecessors() {
        Map<BasicBlockId, List<BasicBlockId>> result = new TreeMap<>();
        for (BasicBlockId id : blockIds()) {
            for (BasicBlockId target : basicBlock(id).successor().targets()) {
                if (hasBlock(target)) {
                    List<BasicBlockId> list = result.computeIfAbsent(target, t -> new ArrayList<>());
                    if (!list.contains(id)) list.add(id);
                }
            }
        }
        return result;
    }

    public Procedure withBasicBlocks(List<BasicBlock> newBasicBlocks) {
        if (newBasicBlocks.size() != basicBlocks.size()) {
            throw new IllegalArgumentException("Expected " + basicBlocks.size() + " blocks, got " + newBasicBlocks.size());
        }
        return new Procedure(name, parameters, returns, locals, newBasicBlocks, entry);
    }

    public String signature() {
        return name + "(" + parameters.stream().map(Variable::toString).collect(Collectors.joining(", "))
               + ") returns (" + returns.stream().map(Variable::toString).collect(Collectors.joining(", ")) + ")";
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("procedure ").append(signature()).append('\n');
        if (!locals.isEmpty()) {
            sb.append("locals ").append(locals.stream().map(Variable::toString)
                    .collect(Collectors.joining(", "))).append('\n');
        }
        for (BasicBlockId id : blockIds()) {
            BasicBlock block = basicBlock(id);
            sb.append(id).append(id.equals(entry) ? " (entry)" : "").append(":\n");
            for (Statement statement : block.statements()) {
                sb.append("  ").append(statement).append('\n');
            }
            sb.append("  ").append(block.successor()).append('\n');
        }
        return sb.toString();
    }
}
