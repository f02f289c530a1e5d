package org.e2immu.analyzer.shape.cfg;

import org.e2immu.analyzer.shape.cfg.statement.Statement;

import java.util.List;

public record BasicBlock(List<Statement> statements, Successor successor) {

    public BasicBlock {
        statements = List.copyOf(statements);
        if (successor == null) throw new IllegalArgumentException("A basic block needs a successor");
    }

    public BasicBlock withStatements(List<Statement> newStatements) {
        return new BasicBlock(newStatements, successor);
    }
}
