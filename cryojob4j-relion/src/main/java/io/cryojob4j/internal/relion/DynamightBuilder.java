package io.cryojob4j.internal.relion;

import io.cryojob4j.config.CompilerProperties;
import io.cryojob4j.core.CommandChain;
import io.cryojob4j.core.CommandSpec;
import io.cryojob4j.core.JobCommand;
import io.cryojob4j.core.JobParameters;
import io.cryojob4j.core.JobType;
import io.cryojob4j.core.ProjectPaths;
import io.cryojob4j.core.ValidationResult;
import io.cryojob4j.internal.AbstractJobCommandBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static io.cryojob4j.utils.ParameterResolver.getBool;
import static io.cryojob4j.utils.ParameterResolver.getFloat;
import static io.cryojob4j.utils.ParameterResolver.getInt;
import static io.cryojob4j.utils.ParameterResolver.getString;
import static io.cryojob4j.utils.ParameterResolver.getThreads;

/**
 * DynaMight deformation modelling. Trains by default; with a checkpoint, runs the requested
 * post-training tasks in the order explore, inverse deformations, backprojection.
 */
public class DynamightBuilder extends AbstractJobCommandBuilder {
    private static final Logger log = LoggerFactory.getLogger(DynamightBuilder.class);

    enum Task {
        OPTIMIZE_DEFORMATIONS("optimize-deformations"),
        EXPLORE_LATENT_SPACE("explore-latent-space"),
        OPTIMIZE_INVERSE_DEFORMATIONS("optimize-inverse-deformations"),
        DEFORMABLE_BACKPROJECTION("deformable-backprojection");

        private final String subcommand;

        Task(String subcommand) {
            this.subcommand = subcommand;
        }

        String subcommand() {
            return subcommand;
        }
    }

    record Options(
            String executable,
            String inputFile,
            String consensusMap,
            String checkpoint,
            int gaussians,
            String initialThreshold,
            double regularizationFactor,
            int halfSet,
            int epochs,
            boolean saveDeformations,
            int backprojectionBatchSize,
            boolean preloadImages,
            String gpuDevice,
            int threads,
            List<Task> postTrainingTasks
    ) {
        static Options from(JobParameters p, CompilerProperties props) {
            List<Task> tasks = new ArrayList<>();
            if (getBool(p, List.of("doVisulization", "doVisualization", "do_visualization"), false)) {
                tasks.add(Task.EXPLORE_LATENT_SPACE);
            }
            if (getBool(p, List.of("inverseDeformation", "inverse_deformation"), false)) {
                tasks.add(Task.OPTIMIZE_INVERSE_DEFORMATIONS);
            }
            if (getBool(p, List.of("deformedBackProjection", "deformed_back_projection"), false)) {
                tasks.add(Task.DEFORMABLE_BACKPROJECTION);
            }
            return new Options(
                    getString(p, List.of("dynamightExecutable", "dynamight_executable"), props.getDynamightExecutable()),
                    getString(p, List.of("micrographs", "input_file", "inputFile"), null),
                    getString(p, List.of("consensusMap", "consensus_map", "initial_model"), null),
                    getString(p, List.of("checkpointFile", "checkpoint_file"), null),
                    getInt(p, List.of("numGaussians", "num_gaussians", "n_gaussians"), 10000),
                    getString(p, List.of("initialMapThreshold", "initial_map_threshold"), null),
                    getFloat(p, List.of("regularizationFactor", "regularization_factor"), 1),
                    getInt(p, List.of("halfSetToVisualize", "half_set_to_visualize"), 1),
                    getInt(p, List.of("numEpochs", "num_epochs", "n_epochs"), 50),
                    getBool(p, List.of("storeDeformations", "store_deformations", "save_deformations"), false),
                    getInt(p, List.of("backprojBatchsize", "backproj_batchsize", "backprojection_batch_size"), 1),
                    getBool(p, List.of("preloadImages", "preload_images"), false),
                    String.valueOf(getInt(p, List.of("gpuToUse", "gpu_to_use"), 0)),
                    getThreads(p),
                    List.copyOf(tasks)
            );
        }
    }

    private final Options options;

    public DynamightBuilder(JobParameters params, ProjectPaths paths, CompilerProperties props) {
        super(JobType.DYNAMIGHT, params, paths, props);
        this.options = Options.from(params, props);
        log.debug("[{}] Resolved options: {}", type.stageName(), options);
    }

    @Override
    public boolean supportsMpi() {
        return false;
    }

    @Override
    protected boolean isContinuation() {
        return hasText(options.checkpoint());
    }

    /**
     * The tasks this job will run, in execution order.
     */
    List<Task> tasks() {
        if (!options.postTrainingTasks().isEmpty()) {
            if (hasText(options.checkpoint())) {
                return options.postTrainingTasks();
            }
            log.warn("[{}] Tasks {} need a checkpoint file, running training instead",
                    type.stageName(), options.postTrainingTasks());
        }
        return List.of(Task.OPTIMIZE_DEFORMATIONS);
    }

    @Override
    protected ValidationResult doValidate() {
        boolean postTrainingOnly = hasText(options.checkpoint()) && !options.postTrainingTasks().isEmpty();
        if (!postTrainingOnly && !hasText(options.inputFile())) {
            return ValidationResult.fail("Input particles STAR file is required");
        }
        if (!hasText(options.executable())) {
            return ValidationResult.fail("DynaMight executable is not configured");
        }
        return ValidationResult.ok();
    }

    @Override
    protected JobCommand doBuildCommand(Path outputDir, String jobName) {
        String out = outputDirArg(outputDir);
        List<Task> tasks = tasks();

        List<CommandSpec.Builder> steps = new ArrayList<>();
        for (Task task : tasks) {
            steps.add(step(task, out));
        }
        addAdditionalArguments(steps.get(steps.size() - 1));

        List<CommandSpec> built = steps.stream().map(CommandSpec.Builder::build).toList();
        if (built.size() == 1) {
            return built.get(0);
        }
        return new CommandChain(built);
    }

    private CommandSpec.Builder step(Task task, String out) {
        Options o = options;
        CommandSpec.Builder cmd = CommandSpec.builder(o.executable(), task.subcommand());
        switch (task) {
            case OPTIMIZE_DEFORMATIONS -> {
                cmd.arg("--refinement-star-file", relativeInput(o.inputFile()))
                        .arg("--output-directory", out);
                if (hasText(o.consensusMap())) {
                    cmd.arg("--initial-model", relativeInput(o.consensusMap()));
                }
                cmd.arg("--n-gaussians", o.gaussians())
                        .argIf(hasText(o.initialThreshold()), "--initial-threshold", o.initialThreshold())
                        .arg("--regularization-factor", o.regularizationFactor());
                if (hasText(o.checkpoint())) {
                    cmd.arg("--checkpoint-file", relativeInput(o.checkpoint()));
                }
                cmd.arg("--gpu-id", o.gpuDevice())
                        .arg("--n-threads", o.threads());
            }
            case EXPLORE_LATENT_SPACE -> cmd.arg("--output-directory", out)
                    .arg("--checkpoint-file", relativeInput(o.checkpoint()))
                    .arg("--half-set", o.halfSet())
                    .arg("--gpu-id", o.gpuDevice());
            case OPTIMIZE_INVERSE_DEFORMATIONS -> cmd.arg("--output-directory", out)
                    .arg("--checkpoint-file", relativeInput(o.checkpoint()))
                    .arg("--n-epochs", o.epochs())
                    .flagIf(o.saveDeformations(), "--save-deformations")
                    .arg("--gpu-id", o.gpuDevice());
            case DEFORMABLE_BACKPROJECTION -> cmd.arg("--output-directory", out)
                    .arg("--checkpoint-file", relativeInput(o.checkpoint()))
                    .arg("--backprojection-batch-size", o.backprojectionBatchSize())
                    .arg("--gpu-id", o.gpuDevice());
        }
        return cmd.flagIf(o.preloadImages(), "--preload-images")
                .arg("--pipeline-control", out);
    }
}
