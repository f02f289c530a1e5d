package org.e2immu.analyzer.shape.common;

/*
Raised at the boundary of the shape inference of one procedure. The block label is the block that was
active when the failure occurred; it is null when the failure is not tied to a block.
 */
public class InferenceException extends RuntimeException {
    private final String procedureName;
    private final String blockLabel;

    public InferenceException(String procedureName, String blockLabel, String message) {
        super(composeMessage(procedureName, blockLabel, message));
        this.procedureName = procedureName;
        this.blockLabel = blockLabel;
    }

    public InferenceException(String procedureName, String blockLabel, Throwable throwable) {
        super(composeMessage(procedureName, blockLabel, throwable.getMessage()), throwable);
        this.procedureName = procedureName;
        this.blockLabel = blockLabel;
    }

    private static String composeMessage(String procedureName, String blockLabel, String message) {
        return "Procedure " + procedureName + (blockLabel == null ? "" : ", block " + blockLabel) + ": " + message;
    }

    public String getProcedureName() {
        return procedureName;
    }

    public String getBlockLabel() {
        return blockLabel;
    }
}
