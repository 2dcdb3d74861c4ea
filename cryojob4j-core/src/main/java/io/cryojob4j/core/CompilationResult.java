package io.cryojob4j.core;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Result of compiling one job.
 *
 * <p>A rejected result carries the failed validation and no command. {@code jobType} is null
 * only when the requested type name was not recognised.
 */
public record CompilationResult(
        JobType jobType,
        ValidationResult validation,
        JobCommand command,
        ExecutionMode executionMode,
        Path outputDir,
        List<String> inputJobIds
) {

    public CompilationResult {
        Objects.requireNonNull(validation, "validation must not be null");
        inputJobIds = inputJobIds == null ? List.of() : List.copyOf(inputJobIds);
        if (validation.valid()) {
            Objects.requireNonNull(command, "command must not be null for a compiled job");
        }
    }

    public static CompilationResult compiled(JobType jobType,
                                             JobCommand command,
                                             ExecutionMode executionMode,
                                             Path outputDir,
                                             List<String> inputJobIds) {
        return new CompilationResult(jobType, ValidationResult.ok(), command, executionMode, outputDir, inputJobIds);
    }

    public static CompilationResult rejected(JobType jobType, ValidationResult validation) {
        if (validation.valid()) {
            throw new IllegalArgumentException("rejected result requires a failed validation");
        }
        return new CompilationResult(jobType, validation, null, null, null, List.of());
    }

    public boolean isCompiled() {
        return validation.valid();
    }

    public String error() {
        return validation.error();
    }

    public String toShellString() {
        if (command == null) {
            throw new IllegalStateException("Job was rejected: " + validation.error());
        }
        return command.toShellString();
    }
}
