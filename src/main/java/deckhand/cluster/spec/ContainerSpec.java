package deckhand.cluster.spec;

import java.util.List;
import java.util.Objects;

/**
 * Single container of a stage pod.
 *
 * @param name          container name
 * @param image         image reference
 * @param command       entry command
 * @param args          command arguments
 * @param env           environment variables
 * @param resources     resource requests
 * @param containerPort exposed port, null for batch containers
 */
public record ContainerSpec(
        String name,
        String image,
        List<String> command,
        List<String> args,
        List<EnvVarSpec> env,
        ResourceRequests resources,
        Integer containerPort) {

    public ContainerSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(image, "image");
        command = List.copyOf(command);
        args = List.copyOf(args);
        env = List.copyOf(env);
        resources = resources != null ? resources : ResourceRequests.none();
    }
}
