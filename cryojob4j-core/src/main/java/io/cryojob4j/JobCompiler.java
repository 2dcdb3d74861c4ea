package io.cryojob4j;

import io.cryojob4j.core.CompilationResult;
import io.cryojob4j.core.CompileRequest;
import io.cryojob4j.core.JobParameters;
import io.cryojob4j.core.ProjectPaths;

/**
 * Entry point: turns a submitted parameter bag into the command line(s) for one processing stage.
 *
 * <p>Typical usage:
 * <pre>{@code
 * CompilationResult result = compiler.compile(CompileRequest.builder()
 *         .jobType("class2d")
 *         .projectRoot(Path.of("/data/projects/apoferritin"))
 *         .jobName("Job004")
 *         .parameters(params)
 *         .build());
 *
 * if (result.isCompiled()) {
 *     submit(result.toShellString());
 * }
 * }</pre>
 */
public interface JobCompiler {

    /**
     * Validate and build. Unknown job types and failed validations come back as rejected results.
     */
    CompilationResult compile(CompileRequest request);

    /**
     * Create an unvalidated builder for callers that drive the lifecycle themselves.
     *
     * @throws IllegalStateException if {@code jobType} is not a known type or alias
     */
    JobCommandBuilder builderFor(String jobType, JobParameters parameters, ProjectPaths paths);
}
