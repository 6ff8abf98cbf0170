package deckhand.engine.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration of one pipeline stage.
 * Carries exactly one payload: {@link BatchParams} for BATCH stages,
 * {@link ServiceParams} for SERVICE stages.
 */
public final class StageConfig {
    private final String name;
    private final String entryPoint;
    private final List<String> args;
    private final Double cpuRequest;
    private final Integer memoryRequestMB;
    private final Map<String, String> secrets; // env var -> secret name
    private final List<String> requirements;
    private final StageKind kind;
    private final BatchParams batch;
    private final ServiceParams service;

    private StageConfig(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.entryPoint = Objects.requireNonNull(builder.entryPoint, "entryPoint is required");
        this.args = Collections.unmodifiableList(new ArrayList<>(builder.args));
        this.cpuRequest = builder.cpuRequest;
        this.memoryRequestMB = builder.memoryRequestMB;
        this.secrets = Collections.unmodifiableMap(new LinkedHashMap<>(builder.secrets));
        this.requirements = Collections.unmodifiableList(new ArrayList<>(builder.requirements));
        this.batch = builder.batch;
        this.service = builder.service;

        if (batch != null && service != null) {
            throw new IllegalArgumentException("stage " + name + " cannot be both batch and service");
        }
        if (batch == null && service == null) {
            throw new IllegalArgumentException("stage " + name + " must be either batch or service");
        }
        this.kind = batch != null ? StageKind.BATCH : StageKind.SERVICE;
    }

    public String name() {
        return name;
    }

    public String entryPoint() {
        return entryPoint;
    }

    public List<String> args() {
        return args;
    }

    /** CPU request in cores, or null when not declared. */
    public Double cpuRequest() {
        return cpuRequest;
    }

    /** Memory request in megabytes, or null when not declared. */
    public Integer memoryRequestMB() {
        return memoryRequestMB;
    }

    public Map<String, String> secrets() {
        return secrets;
    }

    public List<String> requirements() {
        return requirements;
    }

    public StageKind kind() {
        return kind;
    }

    /**
     * @throws IllegalStateException if this is not a batch stage
     */
    public BatchParams batch() {
        if (batch == null) {
            throw new IllegalStateException("stage " + name + " is not a batch stage");
        }
        return batch;
    }

    /**
     * @throws IllegalStateException if this is not a service stage
     */
    public ServiceParams service() {
        if (service == null) {
            throw new IllegalStateException("stage " + name + " is not a service stage");
        }
        return service;
    }

    public boolean isBatch() {
        return kind == StageKind.BATCH;
    }

    public boolean isService() {
        return kind == StageKind.SERVICE;
    }

    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .entryPoint(entryPoint)
                .args(args)
                .cpuRequest(cpuRequest)
                .memoryRequestMB(memoryRequestMB)
                .secrets(secrets)
                .requirements(requirements)
                .batch(batch)
                .service(service);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "StageConfig{" +
                "name='" + name + '\'' +
                ", kind=" + kind +
                ", entryPoint='" + entryPoint + '\'' +
                '}';
    }

    public static final class Builder {
        private String name;
        private String entryPoint;
        private List<String> args = List.of();
        private Double cpuRequest;
        private Integer memoryRequestMB;
        private Map<String, String> secrets = Map.of();
        private List<String> requirements = List.of();
        private BatchParams batch;
        private ServiceParams service;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder entryPoint(String entryPoint) {
            this.entryPoint = entryPoint;
            return this;
        }

        public Builder args(List<String> args) {
            this.args = args != null ? args : List.of();
            return this;
        }

        public Builder cpuRequest(Double cpuRequest) {
            this.cpuRequest = cpuRequest;
            return this;
        }

        public Builder memoryRequestMB(Integer memoryRequestMB) {
            this.memoryRequestMB = memoryRequestMB;
            return this;
        }

        public Builder secrets(Map<String, String> secrets) {
            this.secrets = secrets != null ? secrets : Map.of();
            return this;
        }

        public Builder requirements(List<String> requirements) {
            this.requirements = requirements != null ? requirements : List.of();
            return this;
        }

        public Builder batch(BatchParams batch) {
            this.batch = batch;
            return this;
        }

        public Builder service(ServiceParams service) {
            this.service = service;
            return this;
        }

        public StageConfig build() {
            return new StageConfig(this);
        }
    }
}
