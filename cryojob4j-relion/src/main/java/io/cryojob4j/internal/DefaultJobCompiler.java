package io.cryojob4j.internal;

import io.cryojob4j.JobCommandBuilder;
import io.cryojob4j.JobCompiler;
import io.cryojob4j.config.CompilerProperties;
import io.cryojob4j.core.CompilationResult;
import io.cryojob4j.core.CompileRequest;
import io.cryojob4j.core.JobCommand;
import io.cryojob4j.core.JobParameters;
import io.cryojob4j.core.JobType;
import io.cryojob4j.core.JobTypeRegistry;
import io.cryojob4j.core.ProjectPaths;
import io.cryojob4j.core.ValidationResult;
import io.cryojob4j.internal.relion.RelionBuilderFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Compiles jobs with the RELION builders.
 *
 * <p>Stateless between calls: every request gets its own builder. The project tree is only read,
 * never written; output directories are derived, not created.
 */
public class DefaultJobCompiler implements JobCompiler {
    private static final Logger log = LoggerFactory.getLogger(DefaultJobCompiler.class);

    private final JobTypeRegistry registry;
    private final RelionBuilderFactory builders;
    private final CompilerProperties props;

    public DefaultJobCompiler(JobTypeRegistry registry, RelionBuilderFactory builders, CompilerProperties props) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.builders = Objects.requireNonNull(builders, "builders must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    @Override
    public CompilationResult compile(CompileRequest request) {
        Objects.requireNonNull(request, "request must not be null");

        Optional<JobType> found = registry.find(request.jobType());
        if (found.isEmpty()) {
            log.warn("Rejecting job {}: unknown job type '{}'", request.jobName(), request.jobType());
            return CompilationResult.rejected(null, ValidationResult.fail("Unknown job type: " + request.jobType()));
        }
        JobType type = found.get();

        ProjectPaths paths = projectPaths(request);
        JobCommandBuilder builder = builders.create(type, request.parameters(), paths);

        ValidationResult validation = builder.validate();
        if (!validation.valid()) {
            return CompilationResult.rejected(type, validation);
        }

        Path outputDir = request.outputDir() != null
                ? paths.resolve(request.outputDir().toString())
                : paths.root().resolve(type.stageName()).resolve(request.jobName());

        JobCommand command = builder.buildCommand(outputDir, request.jobName());
        log.info("Compiled {} job {} into {} step(s)", type.canonicalName(), request.jobName(), command.steps().size());
        return CompilationResult.compiled(type, command, builder.executionMode(), outputDir, builder.inputJobIds());
    }

    @Override
    public JobCommandBuilder builderFor(String jobType, JobParameters parameters, ProjectPaths paths) {
        Objects.requireNonNull(parameters, "parameters must not be null");
        Objects.requireNonNull(paths, "paths must not be null");
        return builders.create(registry.getRequired(jobType), parameters, paths);
    }

    private ProjectPaths projectPaths(CompileRequest request) {
        if (request.projectRoot() != null) {
            return ProjectPaths.rootedAt(request.projectRoot());
        }
        return ProjectPaths.forProject(Path.of(props.getProjectsRoot()), request.folderName(), request.projectName());
    }
}
