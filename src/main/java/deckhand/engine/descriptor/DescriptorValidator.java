package deckhand.engine.descriptor;

import deckhand.engine.graph.GraphResolver;
import deckhand.engine.model.ExecutionStep;
import deckhand.engine.model.PipelineDescriptor;
import deckhand.engine.model.StageConfig;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Cross-reference checks that need the whole descriptor: the DAG must
 * resolve against the declared stages, every declared stage other than the
 * on-failure stage must appear in the DAG, and the on-failure stage must be
 * a batch stage outside the DAG.
 */
public final class DescriptorValidator {

    private DescriptorValidator() {
    }

    /**
     * Validate the descriptor and return its execution plan.
     *
     * @throws deckhand.engine.graph.GraphException if the DAG does not resolve
     * @throws DescriptorException                  if the on-failure stage is
     *                                              unusable or a stage would
     *                                              never run
     */
    public static List<ExecutionStep> validate(PipelineDescriptor descriptor) {
        List<ExecutionStep> plan = GraphResolver.resolve(
                descriptor.dagExpression(), descriptor.stages().keySet());

        Set<String> inDag = new HashSet<>();
        plan.forEach(step -> inDag.addAll(step.stages()));

        descriptor.runOnFailure().ifPresent(name -> {
            StageConfig stage = descriptor.stage(name).orElseThrow(() -> new DescriptorException(
                    DescriptorException.Reason.UNKNOWN_STAGE,
                    "project.run_on_failure names undeclared stage '" + name + "'"));
            if (!stage.isBatch()) {
                throw new DescriptorException(DescriptorException.Reason.INVALID,
                        "project.run_on_failure stage '" + name + "' must be a batch stage");
            }
            if (inDag.contains(name)) {
                throw new DescriptorException(DescriptorException.Reason.INVALID,
                        "project.run_on_failure stage '" + name + "' must not appear in the DAG");
            }
        });

        List<String> unreferenced = new ArrayList<>();
        for (String name : descriptor.stages().keySet()) {
            if (!inDag.contains(name) && !descriptor.runOnFailure().map(name::equals).orElse(false)) {
                unreferenced.add("stage '" + name + "' is declared but not referenced by the DAG");
            }
        }
        if (!unreferenced.isEmpty()) {
            throw new DescriptorException(DescriptorException.Reason.INVALID,
                    "Descriptor declares stages that would never run", unreferenced);
        }
        return plan;
    }
}
