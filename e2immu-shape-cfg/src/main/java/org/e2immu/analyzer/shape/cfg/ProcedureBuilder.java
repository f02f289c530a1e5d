package org.e2immu.analyzer.shape.cfg;

import org.e2immu.analyzer.shape.cfg.place.Variable;
import org.e2immu.analyzer.shape.cfg.statement.Statement;
import org.e2immu.analyzer.shape.cfg.type.Type;

import java.util.*;

/**
 * Assembles a procedure block by block, the way a front-end emits it: declare the variables, create the blocks,
 * fill them, and set their successors.
 */
public class ProcedureBuilder {
    private final String name;
    private final List<Variable> parameters = new ArrayList<>();
    private final List<Variable> returns = new ArrayList<>();
    private final List<Variable> locals = new ArrayList<>();
    private final Set<String> variableNames = new HashSet<>();
    private final List<List<Statement>> statements = new ArrayList<>();
    private final List<Successor> successors = new ArrayList<>();
    private BasicBlockId entry;

    public ProcedureBuilder(String name) {
        this.name = name;
    }

    public Variable addParameter(String variableName, Type type) {
        return add(parameters, variableName, type);
    }

    public Variable addReturn(String variableName, Type type) {
        return add(returns, variableName, type);
    }

    public Variable addLocal(String variableName, Type type) {
        return add(locals, variableName, type);
    }

    private Variable add(List<Variable> list, String variableName, Type type) {
        if (!variableNames.add(variableName)) {
            throw new IllegalArgumentException("Variable " + variableName + " declared twice in " + name);
        }
        Variable variable = new Variable(variableName, type);
        list.add(variable);
        return variable;
    }

    /*
    the first block created is the entry block, unless setEntry is called
     */
    public BasicBlockId newBlock() {
        BasicBlockId id = new BasicBlockId(statements.size());
        statements.add(new ArrayList<>());
        successors.add(null);
        if (entry == null) entry = id;
        return id;
    }

    public ProcedureBuilder setEntry(BasicBlockId entry) {
        checkExists(entry);
        this.entry = entry;
        return this;
    }

    public ProcedureBuilder addStatement(BasicBlockId block, Statement statement) {
        checkExists(block);
        statements.get(block.index()).add(Objects.requireNonNull(statement));
        return this;
    }

    public ProcedureBuilder setSuccessor(BasicBlockId block, Successor successor) {
        checkExists(block);
        successors.set(block.index(), Objects.requireNonNull(successor));
        return this;
    }

    private void checkExists(BasicBlockId block) {
        if (block.index() >= statements.size()) {
            throw new IllegalArgumentException("Block " + block + " has not been created in " + name);
        }
    }

    public Procedure build() {
        if (entry == null) throw new IllegalStateException("Procedure " + name + " has no blocks");
        List<BasicBlock> blocks = new ArrayList<>(statements.size());
        for (int i = 0; i < statements.size(); i++) {
            Successor successor = successors.get(i);
            if (successor == null) {
                throw new IllegalStateException("Block bb" + i + " of " + name + " has no successor");
            }
            blocks.add(new BasicBlock(statements.get(i), successor));
        }
        return new Procedure(name, parameters, returns, locals, blocks, entry);
    }
}
