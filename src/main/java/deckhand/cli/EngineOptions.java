package deckhand.cli;

import deckhand.cluster.simulation.SimulatedCluster;
import deckhand.engine.config.Dependencies;
import deckhand.engine.config.EngineConfig;
import picocli.CommandLine.Option;

import java.io.File;

/**
 * Options shared by every command that talks to the cluster.
 */
public class EngineOptions {

    @Option(names = {"-n", "--namespace"}, defaultValue = "default",
            description = "Target namespace (default: ${DEFAULT-VALUE})")
    String namespace;

    @Option(names = {"-c", "--config"}, description = "INI configuration file")
    File configFile;

    @Option(names = "--simulate", description = "Run against an in-memory cluster instead of a real one")
    boolean simulate;

    public String namespace() {
        return namespace;
    }

    public EngineConfig config() {
        return configFile != null ? EngineConfig.load(configFile) : EngineConfig.fromEnv();
    }

    public Dependencies dependencies() {
        EngineConfig config = config();
        if (simulate) {
            return Dependencies.create(config.withHistoryEnabled(false),
                    new SimulatedCluster().withNamespace(namespace));
        }
        return Dependencies.create(config);
    }
}
