package org.e2immu.analyzer.shape.inference;

import org.e2immu.analyzer.shape.cfg.Procedure;
import org.e2immu.analyzer.shape.common.InferenceException;

import java.util.List;

/**
 * Makes the permission requirements of a procedure explicit: the result has the same blocks and successors as the
 * input, with fold, unfold, restore and memory block actions inserted before the statements that need them, and at
 * the end of blocks whose exit state has to be reconciled with that of other blocks.
 */
public interface ShapeInference {

    interface Configuration {
        // maximal number of times one block is processed
        int maxIterations();

        boolean storeErrors();

        // report the procedure before and after the inference
        boolean dumpDebugInfo();

        // report the traversal when the inference of a procedure fails
        boolean graphvizOnCrash();

        String sourceFileName();
    }

    interface Output {
        List<Procedure> procedures();

        List<InferenceException> inferenceExceptions();
    }

    /**
     * @throws InferenceException when the requirements cannot be made explicit
     */
    Procedure infer(Procedure procedure);

    /**
     * Infers each procedure in turn. When errors are stored, a failing procedure is left out of the output and its
     * exception is collected; otherwise the first failure is thrown.
     */
    Output go(List<Procedure> procedures);
}
