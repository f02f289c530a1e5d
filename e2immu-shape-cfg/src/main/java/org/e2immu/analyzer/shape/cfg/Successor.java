package org.e2immu.analyzer.shape.cfg;

import org.e2immu.analyzer.shape.cfg.statement.Expression;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The control-flow continuation of a basic block.
 * <p>
 * The guards of a {@link GotoSwitch} are evaluated in order and the first one that holds is taken; the list is
 * assumed to be exhaustive. A switch with two targets is the usual if-then-else.
 */
public sealed interface Successor permits Successor.Return, Successor.Goto, Successor.GotoSwitch {
    Return RETURN = new Return();

    List<BasicBlockId> targets();

    record Return() implements Successor {
        @Override
        public List<BasicBlockId> targets() {
            return List.of();
        }

        @Override
        public String toString() {
            return "return";
        }
    }

    record Goto(BasicBlockId target) implements Successor {
        @Override
        public List<BasicBlockId> targets() {
            return List.of(target);
        }

        @Override
        public String toString() {
            return "goto " + target;
        }
    }

    record SwitchTarget(Expression guard, BasicBlockId target) {
        @Override
        public String toString() {
            return guard + " -> " + target;
        }
    }

    record GotoSwitch(List<SwitchTarget> switchTargets) implements Successor {
        public GotoSwitch {
            if (switchTargets.isEmpty()) throw new IllegalArgumentException("Switch without targets");
            switchTargets = List.copyOf(switchTargets);
        }

        @Override
        public List<BasicBlockId> targets() {
            return switchTargets.stream().map(SwitchTarget::target).toList();
        }

        @Override
        public String toString() {
            return "switch [" + switchTargets.stream().map(Object::toString).collect(Collectors.joining(", ")) + "]";
        }
    }

    static Goto goTo(BasicBlockId target) {
        return new Goto(target);
    }

    static GotoSwitch goToIf(Expression condition, BasicBlockId thenTarget, BasicBlockId elseTarget) {
        return new GotoSwitch(List.of(new SwitchTarget(condition, thenTarget),
                new SwitchTarget(Expression.Constant.TRUE, elseTarget)));
    }
}
