package deckhand.engine.graph;

/**
 * Thrown when a stage-dependency expression cannot be turned into a plan.
 */
public class GraphException extends RuntimeException {

    public enum Reason {
        /** Expression is null or blank */
        EMPTY_EXPRESSION,
        /** Two separators with nothing between them */
        EMPTY_STAGE_NAME,
        /** Name has no stage configuration */
        UNKNOWN_STAGE,
        /** Name appears more than once */
        DUPLICATE_STAGE
    }

    private final Reason reason;
    private final String stageName;

    public GraphException(Reason reason, String stageName, String message) {
        super(message);
        this.reason = reason;
        this.stageName = stageName;
    }

    public Reason reason() {
        return reason;
    }

    /** Offending stage name, null for expression-level errors. */
    public String stageName() {
        return stageName;
    }
}
