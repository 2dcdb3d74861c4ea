package io.cryojob4j.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Sequential invocations where each step runs only if the previous one exited successfully.
 */
public record CommandChain(List<CommandSpec> steps) implements JobCommand {

    public CommandChain {
        Objects.requireNonNull(steps, "steps must not be null");
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("CommandChain must contain at least one step");
        }
        steps = List.copyOf(steps);
    }

    public static CommandChain of(JobCommand first, JobCommand... rest) {
        List<CommandSpec> all = new ArrayList<>(first.steps());
        for (JobCommand next : rest) {
            all.addAll(next.steps());
        }
        return new CommandChain(all);
    }

    @Override
    public CommandChain and(JobCommand next) {
        Objects.requireNonNull(next, "next must not be null");
        List<CommandSpec> all = new ArrayList<>(steps);
        all.addAll(next.steps());
        return new CommandChain(all);
    }

    public CommandSpec first() {
        return steps.get(0);
    }

    public CommandSpec last() {
        return steps.get(steps.size() - 1);
    }

    public int size() {
        return steps.size();
    }
}
