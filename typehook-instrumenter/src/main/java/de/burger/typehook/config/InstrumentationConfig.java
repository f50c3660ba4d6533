package de.burger.typehook.config;

import java.util.Objects;

/**
 * Immutable settings handed to the runtime facility through every hook emitted in one run.
 * Instances compare by identity on purpose: the emitted code refers to a config by the id the
 * {@link ConfigRegistry} assigned to this exact instance.
 */
public final class InstrumentationConfig {

    private static final InstrumentationConfig DEFAULTS = builder().build();

    private final CheckStrategy strategy;
    private final boolean debug;
    private final boolean checkAnnotatedAssignments;
    private final boolean checkTypeAliases;
    private final String label;

    private InstrumentationConfig(Builder builder) {
        this.strategy = builder.strategy;
        this.debug = builder.debug;
        this.checkAnnotatedAssignments = builder.checkAnnotatedAssignments;
        this.checkTypeAliases = builder.checkTypeAliases;
        this.label = builder.label;
    }

    public static InstrumentationConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public CheckStrategy strategy() {
        return strategy;
    }

    /** Log the rendered module after instrumentation. */
    public boolean debug() {
        return debug;
    }

    /** Emit a value check after annotated assignments in module and function scope. */
    public boolean checkAnnotatedAssignments() {
        return checkAnnotatedAssignments;
    }

    /** Hand every {@code type} alias statement to the runtime facility. */
    public boolean checkTypeAliases() {
        return checkTypeAliases;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return "InstrumentationConfig[label=" + label + ", strategy=" + strategy + ", debug=" + debug
            + ", checkAnnotatedAssignments=" + checkAnnotatedAssignments
            + ", checkTypeAliases=" + checkTypeAliases + "]";
    }

    public static final class Builder {
        private CheckStrategy strategy = CheckStrategy.O1;
        private boolean debug;
        private boolean checkAnnotatedAssignments = true;
        private boolean checkTypeAliases = true;
        private String label = "default";

        private Builder() {
        }

        public Builder strategy(CheckStrategy strategy) {
            this.strategy = Objects.requireNonNull(strategy, "strategy");
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public Builder checkAnnotatedAssignments(boolean checkAnnotatedAssignments) {
            this.checkAnnotatedAssignments = checkAnnotatedAssignments;
            return this;
        }

        public Builder checkTypeAliases(boolean checkTypeAliases) {
            this.checkTypeAliases = checkTypeAliases;
            return this;
        }

        public Builder label(String label) {
            Objects.requireNonNull(label, "label");
            if (label.isBlank()) {
                throw new IllegalArgumentException("label must not be blank");
            }
            this.label = label;
            return this;
        }

        public InstrumentationConfig build() {
            return new InstrumentationConfig(this);
        }
    }
}
