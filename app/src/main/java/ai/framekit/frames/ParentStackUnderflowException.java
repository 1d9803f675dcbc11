package ai.framekit.frames;

/** Thrown when a nesting scope is exited more often than it was entered. */
public class ParentStackUnderflowException extends IllegalStateException {
    public ParentStackUnderflowException(String message) {
        super(message);
    }
}
