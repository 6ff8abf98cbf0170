package deckhand.engine.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, validated pipeline descriptor.
 * Stages keep the order in which they were declared.
 */
public final class PipelineDescriptor {
    private final String version;
    private final String name;
    private final String containerImage;
    private final String dagExpression;
    private final String secretsGroup;
    private final String runOnFailure;
    private final String logLevel;
    private final Map<String, StageConfig> stages;

    private PipelineDescriptor(Builder builder) {
        this.version = builder.version;
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.containerImage = Objects.requireNonNull(builder.containerImage, "containerImage is required");
        this.dagExpression = Objects.requireNonNull(builder.dagExpression, "dagExpression is required");
        this.secretsGroup = builder.secretsGroup;
        this.runOnFailure = builder.runOnFailure;
        this.logLevel = builder.logLevel;
        this.stages = Collections.unmodifiableMap(new LinkedHashMap<>(builder.stages));
    }

    public String version() {
        return version;
    }

    public String name() {
        return name;
    }

    public String containerImage() {
        return containerImage;
    }

    public String dagExpression() {
        return dagExpression;
    }

    public Optional<String> secretsGroup() {
        return Optional.ofNullable(secretsGroup);
    }

    /** Batch stage to run once when the workflow fails. */
    public Optional<String> runOnFailure() {
        return Optional.ofNullable(runOnFailure);
    }

    public String logLevel() {
        return logLevel;
    }

    public Map<String, StageConfig> stages() {
        return stages;
    }

    public Optional<StageConfig> stage(String stageName) {
        return Optional.ofNullable(stages.get(stageName));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "PipelineDescriptor{" +
                "name='" + name + '\'' +
                ", image='" + containerImage + '\'' +
                ", dag='" + dagExpression + '\'' +
                ", stages=" + stages.keySet() +
                '}';
    }

    public static final class Builder {
        private String version;
        private String name;
        private String containerImage;
        private String dagExpression;
        private String secretsGroup;
        private String runOnFailure;
        private String logLevel = "INFO";
        private final Map<String, StageConfig> stages = new LinkedHashMap<>();

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder containerImage(String containerImage) {
            this.containerImage = containerImage;
            return this;
        }

        public Builder dagExpression(String dagExpression) {
            this.dagExpression = dagExpression;
            return this;
        }

        public Builder secretsGroup(String secretsGroup) {
            this.secretsGroup = secretsGroup;
            return this;
        }

        public Builder runOnFailure(String runOnFailure) {
            this.runOnFailure = runOnFailure;
            return this;
        }

        public Builder logLevel(String logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder stage(StageConfig stage) {
            this.stages.put(stage.name(), stage);
            return this;
        }

        public PipelineDescriptor build() {
            return new PipelineDescriptor(this);
        }
    }
}
