package org.e2immu.analyzer.shape.inference.state;

/*
no sequence of actions can make a permission requirement hold, or an action's precondition is violated.
For well-typed input this does not happen.
 */
public class UnsatisfiablePermissionException extends RuntimeException {

    public UnsatisfiablePermissionException(String message) {
        super(message);
    }
}
