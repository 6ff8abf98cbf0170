package deckhand.engine.graph;

import deckhand.engine.model.ExecutionStep;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a stage-dependency expression into an ordered list of steps.
 *
 * <pre>
 * "prepare >> train, validate >> serve"
 *   -> [{prepare}, {train, validate}, {serve}]
 * </pre>
 *
 * {@code >>} separates sequential steps, {@code ,} separates stages that run
 * concurrently within a step. Whitespace is ignored. Stateless and thread-safe.
 */
public final class GraphResolver {

    public static final String STEP_SEPARATOR = ">>";
    public static final String STAGE_SEPARATOR = ",";

    private GraphResolver() {
    }

    /**
     * Resolve an expression against the declared stage names.
     *
     * @param dagExpression   the expression
     * @param validStageNames names that have a stage configuration
     * @return steps in execution order, each stage appearing exactly once
     * @throws GraphException if the expression is empty or malformed, or names
     *                        an unknown or repeated stage
     */
    public static List<ExecutionStep> resolve(String dagExpression, Collection<String> validStageNames) {
        if (dagExpression == null || dagExpression.isBlank()) {
            throw new GraphException(GraphException.Reason.EMPTY_EXPRESSION, null,
                    "DAG expression is empty");
        }

        String compact = dagExpression.replaceAll("\\s+", "");
        Set<String> valid = new HashSet<>(validStageNames);
        Set<String> seen = new HashSet<>();
        List<ExecutionStep> steps = new ArrayList<>();

        String[] stepTokens = compact.split(STEP_SEPARATOR, -1);
        for (int i = 0; i < stepTokens.length; i++) {
            Set<String> stages = new LinkedHashSet<>();
            for (String name : stepTokens[i].split(STAGE_SEPARATOR, -1)) {
                if (name.isEmpty()) {
                    throw new GraphException(GraphException.Reason.EMPTY_STAGE_NAME, null,
                            "null stages found in step " + (i + 1) + " of DAG '" + dagExpression + "'");
                }
                if (!valid.contains(name)) {
                    throw new GraphException(GraphException.Reason.UNKNOWN_STAGE, name,
                            "stage '" + name + "' in DAG has no stage configuration");
                }
                if (!seen.add(name)) {
                    throw new GraphException(GraphException.Reason.DUPLICATE_STAGE, name,
                            "stage '" + name + "' appears more than once in DAG");
                }
                stages.add(name);
            }
            steps.add(new ExecutionStep(i, stages));
        }
        return List.copyOf(steps);
    }
}
