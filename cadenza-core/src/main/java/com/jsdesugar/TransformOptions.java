package com.jsdesugar;

/**
 * Switches that decide which suspend constructs get lowered.
 *
 * <pre>{@code
 * TransformOptions options = TransformOptions.builder()
 *     .deferredFunctions(true)
 *     .build();
 * }</pre>
 */
public final class TransformOptions {

    private static final TransformOptions DEFAULTS = builder().build();

    private final boolean generators;
    private final boolean deferredFunctions;

    private TransformOptions(Builder builder) {
        this.generators = builder.generators;
        this.deferredFunctions = builder.deferredFunctions;
    }

    /**
     * Generators lowered, deferred functions left alone.
     */
    public static TransformOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .generators(generators)
            .deferredFunctions(deferredFunctions);
    }

    /**
     * Whether generator functions are compiled to state machines.
     */
    public boolean generators() {
        return generators;
    }

    /**
     * Whether functions suspended only by {@code await} are compiled to state machines.
     */
    public boolean deferredFunctions() {
        return deferredFunctions;
    }

    @Override
    public String toString() {
        return "TransformOptions{generators=" + generators + ", deferredFunctions=" + deferredFunctions + "}";
    }

    public static final class Builder {
        private boolean generators = true;
        private boolean deferredFunctions = false;

        private Builder() {
        }

        public Builder generators(boolean generators) {
            this.generators = generators;
            return this;
        }

        public Builder deferredFunctions(boolean deferredFunctions) {
            this.deferredFunctions = deferredFunctions;
            return this;
        }

        public TransformOptions build() {
            return new TransformOptions(this);
        }
    }
}
