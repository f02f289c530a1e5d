package org.e2immu.analyzer.shape.io;

import org.e2immu.analyzer.shape.cfg.BasicBlock;
import org.e2immu.analyzer.shape.cfg.BasicBlockId;
import org.e2immu.analyzer.shape.cfg.Procedure;
import org.e2immu.analyzer.shape.cfg.Successor;
import org.e2immu.analyzer.shape.cfg.place.Variable;
import org.e2immu.analyzer.shape.cfg.statement.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.stream.Collectors;

/**
 * Lowers a procedure to a method body with labelled blocks and explicit jumps, the form in which the
 * verifier-side code generator consumes it. Every block gets the label <code>__viper_NAME_INDEX</code>;
 * a return jumps to <code>__viper_NAME_return</code>, which ends the method.
 * <p>
 * The guards of a switch are tested in order; the exhaustiveness of the switch becomes an explicit
 * <code>assert false</code> after the last test.
 */
public class LabelledProcedureWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(LabelledProcedureWriter.class);
    private static final String INDENT = "  ";

    public String write(Procedure procedure) {
        StringWriter sw = new StringWriter();
        try {
            write(procedure, sw);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return sw.toString();
    }

    public void write(Procedure procedure, Writer writer) throws IOException {
        LOGGER.debug("Lowering {}", procedure.name());
        writer.write("method " + procedure.name() + "("
                     + procedure.parameters().stream().map(Variable::toString).collect(Collectors.joining(", "))
                     + ") returns ("
                     + procedure.returns().stream().map(Variable::toString).collect(Collectors.joining(", "))
                     + ")\n{\n");
        for (Variable local : procedure.locals()) {
            writer.write(INDENT + "var " + local + "\n");
        }
        if (!procedure.entry().equals(new BasicBlockId(0))) {
            writer.write(INDENT + "goto " + label(procedure, procedure.entry()) + "\n");
        }
        for (BasicBlockId id : procedure.blockIds()) {
            BasicBlock block = procedure.basicBlock(id);
            writer.write(INDENT + "label " + label(procedure, id) + "\n");
            for (Statement statement : block.statements()) {
                writer.write(INDENT + statement + "\n");
            }
            writeSuccessor(procedure, block.successor(), writer);
        }
        writer.write(INDENT + "label " + returnLabel(procedure) + "\n}\n");
    }

    private void writeSuccessor(Procedure procedure, Successor successor, Writer writer) throws IOException {
        if (successor instanceof Successor.Return) {
            writer.write(INDENT + "goto " + returnLabel(procedure) + "\n");
        } else if (successor instanceof Successor.Goto g) {
            writer.write(INDENT + "goto " + label(procedure, g.target()) + "\n");
        } else if (successor instanceof Successor.GotoSwitch gotoSwitch) {
            for (Successor.SwitchTarget switchTarget : gotoSwitch.switchTargets()) {
                writer.write(INDENT + "if (" + switchTarget.guard() + ") { goto "
                             + label(procedure, switchTarget.target()) + " }\n");
            }
            writer.write(INDENT + "assert false\n");
        } else {
            throw new UnsupportedOperationException("Unknown successor " + successor);
        }
    }

    public static String label(Procedure procedure, BasicBlockId id) {
        return "__viper_" + procedure.name() + "_" + id.index();
    }

    public static String returnLabel(Procedure procedure) {
        return "__viper_" + procedure.name() + "_return";
    }
}
