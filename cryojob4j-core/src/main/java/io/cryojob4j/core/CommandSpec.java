package io.cryojob4j.core;

import io.cryojob4j.utils.FlagValues;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * One argv: the program followed by flag/value tokens in emission order.
 */
public record CommandSpec(List<String> tokens) implements JobCommand {

    public CommandSpec {
        Objects.requireNonNull(tokens, "tokens must not be null");
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("CommandSpec must contain at least the program token");
        }
        tokens = List.copyOf(tokens);
    }

    public static CommandSpec of(String... tokens) {
        return new CommandSpec(Arrays.asList(tokens));
    }

    public static Builder builder(List<String> seed) {
        return new Builder(seed);
    }

    public static Builder builder(String... seed) {
        return new Builder(Arrays.asList(seed));
    }

    public String program() {
        return tokens.get(0);
    }

    public boolean contains(String token) {
        return tokens.contains(token);
    }

    /**
     * Value token following {@code flag}, or null when the flag is absent or last.
     */
    public String valueOf(String flag) {
        int i = tokens.indexOf(flag);
        if (i < 0 || i + 1 >= tokens.size()) {
            return null;
        }
        return tokens.get(i + 1);
    }

    @Override
    public List<CommandSpec> steps() {
        return List.of(this);
    }

    @Override
    public String toShellString() {
        return String.join(" ", tokens);
    }

    /**
     * Fluent builder; flags land in call order.
     */
    public static final class Builder {
        private final List<String> tokens = new ArrayList<>();

        private Builder(List<String> seed) {
            Objects.requireNonNull(seed, "seed must not be null");
            seed.forEach(this::token);
        }

        public Builder token(String token) {
            Objects.requireNonNull(token, "token must not be null");
            tokens.add(token);
            return this;
        }

        public Builder tokens(Collection<String> more) {
            if (more != null) {
                more.forEach(this::token);
            }
            return this;
        }

        public Builder flag(String flag) {
            return token(flag);
        }

        public Builder flagIf(boolean condition, String flag) {
            if (condition) {
                token(flag);
            }
            return this;
        }

        /**
         * Append {@code flag value}. Numbers are rendered through {@link FlagValues#format(Number)}.
         */
        public Builder arg(String flag, Object value) {
            Objects.requireNonNull(value, () -> "value for " + flag + " must not be null");
            token(flag);
            token(value instanceof Number n ? FlagValues.format(n) : String.valueOf(value));
            return this;
        }

        public Builder argIf(boolean condition, String flag, Object value) {
            if (condition) {
                arg(flag, value);
            }
            return this;
        }

        /**
         * Tokens appended so far, read-only.
         */
        public List<String> peek() {
            return List.copyOf(tokens);
        }

        public CommandSpec build() {
            return new CommandSpec(tokens);
        }
    }
}
