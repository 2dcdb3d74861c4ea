package io.cryojob4j;

import io.cryojob4j.core.ExecutionMode;
import io.cryojob4j.core.JobCommand;
import io.cryojob4j.core.JobType;
import io.cryojob4j.core.ValidationResult;

import java.nio.file.Path;
import java.util.List;

/**
 * Builds the command line for one job of a single {@link JobType}.
 *
 * <p>Instances are created per submission and are not shared between threads. Call
 * {@link #validate()} first; {@link #buildCommand(Path, String)} is only defined after a successful
 * validation.
 */
public interface JobCommandBuilder {

    JobType type();

    /**
     * Check required inputs and referenced files. Failures are returned, never thrown.
     */
    ValidationResult validate();

    /**
     * @param outputDir absolute job output directory (e.g. {@code <project>/Class2D/Job004})
     * @param jobName   job directory name (e.g. "Job004")
     * @throws IllegalStateException if {@link #validate()} has not succeeded on this instance
     */
    JobCommand buildCommand(Path outputDir, String jobName);

    ExecutionMode executionMode();

    boolean supportsGpu();

    boolean supportsMpi();

    /**
     * Upstream job names ("Job002", ...) referenced by this job's input files.
     */
    List<String> inputJobIds();
}
