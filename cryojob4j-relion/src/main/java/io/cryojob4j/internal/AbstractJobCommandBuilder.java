package io.cryojob4j.internal;

import io.cryojob4j.JobCommandBuilder;
import io.cryojob4j.config.CompilerProperties;
import io.cryojob4j.core.CommandSpec;
import io.cryojob4j.core.ExecutionMode;
import io.cryojob4j.core.JobCommand;
import io.cryojob4j.core.JobParameters;
import io.cryojob4j.core.JobType;
import io.cryojob4j.core.ProjectPaths;
import io.cryojob4j.core.ValidationResult;
import io.cryojob4j.internal.relion.RelionFlags;
import io.cryojob4j.utils.ParameterResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared lifecycle for the RELION stage builders.
 *
 * <p>{@link #validate()} and {@link #buildCommand(Path, String)} are fixed here; subclasses supply
 * {@link #doValidate()} and {@link #doBuildCommand(Path, String)}. Subclasses resolve their
 * parameters once, in the constructor.
 */
public abstract class AbstractJobCommandBuilder implements JobCommandBuilder {
    private static final Logger log = LoggerFactory.getLogger(AbstractJobCommandBuilder.class);

    private static final Pattern JOB_REF = Pattern.compile("Job(\\d{1,9})(?!\\d)", Pattern.CASE_INSENSITIVE);
    private static final Pattern UNSAFE_PATH = Pattern.compile("[;&|`$(){}\\[\\]<>!\\\\*?\"'\\x00]");

    /**
     * Parameters that may reference an upstream job's files.
     */
    private static final List<String> INPUT_FIELDS = List.of(
            "inputStarFile", "inputMovies", "inputMicrographs", "micrographStarFile",
            "inputParticles", "particlesStarFile", "ctfStarFile",
            "refinementStarFile", "refinement_star_file", "continueFrom",
            "referenceMap", "reference", "referenceMask", "solventMask",
            "bodyStarFile", "multibodyMasks",
            "particlesStar", "postProcessStar", "postprocessStar",
            "micrographs", "inputFile", "input_file", "checkpointFile", "consensusMap"
    );

    protected final JobType type;
    protected final JobParameters params;
    protected final ProjectPaths paths;
    protected final CompilerProperties props;

    private boolean validated;

    protected AbstractJobCommandBuilder(JobType type, JobParameters params, ProjectPaths paths, CompilerProperties props) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.params = Objects.requireNonNull(params, "params must not be null");
        this.paths = Objects.requireNonNull(paths, "paths must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    protected abstract ValidationResult doValidate();

    protected abstract JobCommand doBuildCommand(Path outputDir, String jobName);

    @Override
    public JobType type() {
        return type;
    }

    @Override
    public final ValidationResult validate() {
        ValidationResult result = doValidate();
        validated = result.valid();
        if (result.valid()) {
            log.info("[{}] Validation: Passed", type.stageName());
        } else {
            log.warn("[{}] Validation: Failed | {}", type.stageName(), result.error());
        }
        return result;
    }

    @Override
    public final JobCommand buildCommand(Path outputDir, String jobName) {
        Objects.requireNonNull(outputDir, "outputDir must not be null");
        if (jobName == null || jobName.isBlank()) {
            throw new IllegalArgumentException("jobName must not be blank");
        }
        if (!validated) {
            throw new IllegalStateException(
                    type.canonicalName() + ": validate() must succeed before buildCommand()");
        }
        log.info("[{}] Command: Building | job_name: {}", type.stageName(), jobName);
        JobCommand command = doBuildCommand(outputDir, jobName);
        log.info("[{}] Command: Full | {}", type.stageName(), command.toShellString());
        return command;
    }

    @Override
    public ExecutionMode executionMode() {
        return ExecutionMode.of(isContinuation(), effectiveMpiProcs(), usesGpu());
    }

    @Override
    public boolean supportsGpu() {
        return true;
    }

    @Override
    public boolean supportsMpi() {
        return true;
    }

    protected boolean isContinuation() {
        return false;
    }

    protected int effectiveMpiProcs() {
        return supportsMpi() ? ParameterResolver.getMpiProcs(params) : 1;
    }

    protected boolean usesGpu() {
        return supportsGpu() && ParameterResolver.isGpuEnabled(params);
    }

    /**
     * Explicit {@code inputJobIds} (comma separated) when given, else {@code JobNNN} references
     * found in input file parameters, normalized to three digits.
     */
    @Override
    public List<String> inputJobIds() {
        String explicit = ParameterResolver.getString(params, List.of("inputJobIds"), null);
        if (explicit != null && !explicit.isBlank()) {
            return Arrays.stream(explicit.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
        }
        Set<String> jobs = new LinkedHashSet<>();
        for (String field : INPUT_FIELDS) {
            if (params.get(field) instanceof String value) {
                Matcher m = JOB_REF.matcher(value);
                if (m.find()) {
                    jobs.add(String.format("Job%03d", Integer.parseInt(m.group(1))));
                }
            }
        }
        if (!jobs.isEmpty()) {
            log.info("[{}] Extracted input jobs from paths: {}", type.stageName(), jobs);
        }
        return List.copyOf(jobs);
    }

    protected Path resolveInputPath(String ref) {
        return paths.resolve(ref);
    }

    protected String makeRelative(Path path) {
        return paths.relativize(path);
    }

    /**
     * Project-relative form of a parameter file reference.
     */
    protected String relativeInput(String ref) {
        return makeRelative(resolveInputPath(ref.trim()));
    }

    /**
     * Output directory as RELION expects it: project-relative with a trailing slash.
     */
    protected String outputDirArg(Path outputDir) {
        return makeRelative(outputDir) + "/";
    }

    protected ValidationResult validateFileExists(String ref, String label) {
        if (ref == null || ref.isBlank()) {
            return ValidationResult.fail(label + " is required");
        }
        Path resolved = resolveInputPath(ref.trim());
        if (!Files.exists(resolved)) {
            log.warn("[{}] File not found: {}", type.stageName(), resolved);
            return ValidationResult.fail(label + " not found: " + ref);
        }
        return ValidationResult.ok();
    }

    /**
     * Program seed: {@code [binary]} for a single process; otherwise {@code [binary_mpi]} when the
     * scheduler launches the processes, or {@code [launcher, -np, n, binary_mpi]} for local runs.
     */
    protected List<String> buildMpiCommand(String binary, int mpiProcs, boolean gpu) {
        if (mpiProcs <= 1) {
            return List.of(binary);
        }
        String mpiBinary = binary + "_mpi";
        if (ParameterResolver.isSubmitToQueue(params, props.isSubmitToQueue())) {
            log.info("[{}] MPI command (queue): {} (mpi={}, gpu={})", type.stageName(), mpiBinary, mpiProcs, gpu);
            return List.of(mpiBinary);
        }
        List<String> seed = new ArrayList<>();
        seed.add(props.getMpiLauncher());
        if (props.getMpiProcsFlag() != null && !props.getMpiProcsFlag().isBlank()) {
            seed.add(props.getMpiProcsFlag());
        }
        seed.add(String.valueOf(mpiProcs));
        seed.add(mpiBinary);
        log.info("[{}] MPI command (local): {} (gpu={})", type.stageName(), String.join(" ", seed), gpu);
        return seed;
    }

    /**
     * Append the user's extra arguments, split on whitespace, verbatim.
     * Flags the program is not known to accept are reported but kept.
     */
    protected void addAdditionalArguments(CommandSpec.Builder cmd) {
        String raw = ParameterResolver.getAdditionalArguments(params);
        if (raw == null || raw.isBlank()) {
            return;
        }
        String program = cmd.peek().stream()
                .filter(t -> t.startsWith("relion_"))
                .findFirst()
                .orElse(null);
        Set<String> known = RelionFlags.knownFlags(program).orElse(null);
        for (String token : raw.trim().split("\\s+")) {
            if (known != null && token.startsWith("--") && !known.contains(token)) {
                log.warn("[{}] Unknown RELION flag for {}: {} (passing through)", type.stageName(), program, token);
            }
            cmd.token(token);
        }
    }

    protected void addThumbnailFlags(CommandSpec.Builder cmd) {
        cmd.arg("--do_thumbnails", "true")
                .arg("--thumbnail_size", props.getThumbnailSize())
                .arg("--thumbnail_count", -1);
    }

    /**
     * Rejects paths carrying shell metacharacters.
     */
    protected static boolean isSafeExecutablePath(String path) {
        return path != null && !UNSAFE_PATH.matcher(path).find();
    }

    protected boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
