package deckhand.engine.descriptor;

import java.util.List;

/**
 * Thrown when a pipeline descriptor cannot be read or fails validation.
 */
public class DescriptorException extends RuntimeException {

    public enum Reason {
        /** No descriptor at the expected location */
        NOT_FOUND,
        /** Not parseable as YAML */
        MALFORMED,
        /** Missing or mis-specified parameters */
        INVALID,
        /** A stage referenced by name is not declared */
        UNKNOWN_STAGE
    }

    private final Reason reason;
    private final List<String> problems;

    public DescriptorException(Reason reason, String message) {
        this(reason, message, List.of(), null);
    }

    public DescriptorException(Reason reason, String message, Throwable cause) {
        this(reason, message, List.of(), cause);
    }

    public DescriptorException(Reason reason, String message, List<String> problems) {
        this(reason, message, problems, null);
    }

    private DescriptorException(Reason reason, String message, List<String> problems, Throwable cause) {
        super(problems.isEmpty() ? message : message + ": " + String.join("; ", problems), cause);
        this.reason = reason;
        this.problems = List.copyOf(problems);
    }

    public Reason reason() {
        return reason;
    }

    /** Individual validation problems, empty unless reason is INVALID. */
    public List<String> problems() {
        return problems;
    }
}
