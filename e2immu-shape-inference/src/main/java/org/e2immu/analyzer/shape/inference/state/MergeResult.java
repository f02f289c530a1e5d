package org.e2immu.analyzer.shape.inference.state;

import java.util.List;

/*
leftActions bring the receiver of merge() to 'state', rightActions the argument.
 */
public record MergeResult(PermissionState state, List<Action> leftActions, List<Action> rightActions) {

    public MergeResult {
        leftActions = List.copyOf(leftActions);
        rightActions = List.copyOf(rightActions);
    }
}
