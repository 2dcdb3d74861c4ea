package io.cryojob4j.core;

import java.util.List;
import java.util.stream.Collectors;

/**
 * What a builder produces: either one {@link CommandSpec} or a {@link CommandChain}.
 */
public interface JobCommand {

    /**
     * Invocations in execution order. Never empty.
     */
    List<CommandSpec> steps();

    /**
     * Combine with {@code next} so that {@code next} runs only if this command succeeds.
     */
    default CommandChain and(JobCommand next) {
        return CommandChain.of(this).and(next);
    }

    default boolean isChain() {
        return steps().size() > 1;
    }

    /**
     * Shell form: tokens joined by spaces, steps joined by {@code &&}.
     */
    default String toShellString() {
        return steps().stream()
                .map(CommandSpec::toShellString)
                .collect(Collectors.joining(" && "));
    }
}
