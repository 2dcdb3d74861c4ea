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
import java.util.List;

import static io.cryojob4j.utils.ParameterResolver.getBool;
import static io.cryojob4j.utils.ParameterResolver.getFloat;
import static io.cryojob4j.utils.ParameterResolver.getGpuIds;
import static io.cryojob4j.utils.ParameterResolver.getInt;
import static io.cryojob4j.utils.ParameterResolver.getMpiProcs;
import static io.cryojob4j.utils.ParameterResolver.getPooledParticles;
import static io.cryojob4j.utils.ParameterResolver.getString;
import static io.cryojob4j.utils.ParameterResolver.getThreads;
import static io.cryojob4j.utils.ParameterResolver.isGpuEnabled;

/**
 * Multi-body refinement. Always continues a finished auto-refine run with per-body masks,
 * optionally followed by {@code relion_flex_analyse}.
 */
public class MultibodyBuilder extends AbstractJobCommandBuilder {
    private static final Logger log = LoggerFactory.getLogger(MultibodyBuilder.class);

    record Flexibility(
            int eigenvectorMovies,
            boolean selectByEigenvalue,
            int eigenvalue,
            double minEigenvalue,
            double maxEigenvalue
    ) {
        static Flexibility from(JobParameters p) {
            return new Flexibility(
                    getInt(p, List.of("numberOfEigenvectorMovies", "eigenvectorMovies"), 3),
                    getBool(p, List.of("selectParticlesEigenValue", "selectByEigenvalue"), false),
                    getInt(p, List.of("eigenValue", "selectEigenvalue"), 1),
                    getFloat(p, List.of("minEigenValue", "minimumEigenvalue"), -999),
                    getFloat(p, List.of("maxEigenValue", "maximumEigenvalue"), 999)
            );
        }
    }

    record Options(
            String refinementStar,
            String bodyMasks,
            boolean solventCorrectFsc,
            boolean reconstructSubtractedBodies,
            int healpixOrder,
            double offsetRange,
            double offsetStep,
            boolean combineIterations,
            boolean parallelIo,
            boolean blush,
            int pooledParticles,
            int threads,
            int mpiProcs,
            boolean gpu,
            String gpuIds,
            Flexibility flexibility
    ) {
        static Options from(JobParameters p) {
            return new Options(
                    getString(p, List.of("refinementStarFile", "refinement_star_file"), null),
                    getString(p, List.of("multibodyMasks", "bodyStarFile", "body_star_file"), null),
                    getBool(p, List.of("solventCorrectFsc", "solvent_correct_fsc"), true),
                    getBool(p, List.of("reconstructSubtractedBodies", "reconstruct_subtracted_bodies"), true),
                    HealpixOrder.resolve(p, List.of("initialAngularSampling", "initial_angular_sampling"), 1.8),
                    getFloat(p, List.of("initialOffsetRange", "offsetSearchRange", "offset_range"), 3),
                    getFloat(p, List.of("initialOffsetStep", "offsetStep", "offset_step"), 1.5),
                    getBool(p, List.of("combineIterations", "combine_iterations"), false),
                    getBool(p, List.of("Useparalleldisc", "useParallelIO", "use_parallel_io"), true),
                    getBool(p, List.of("useBlushRegularisation", "use_blush_regularisation"), false),
                    getPooledParticles(p),
                    getThreads(p),
                    getMpiProcs(p),
                    isGpuEnabled(p),
                    getGpuIds(p),
                    getBool(p, List.of("runFlexibility", "run_flexibility"), false) ? Flexibility.from(p) : null
            );
        }
    }

    private final Options options;

    public MultibodyBuilder(JobParameters params, ProjectPaths paths, CompilerProperties props) {
        super(JobType.MULTIBODY, params, paths, props);
        this.options = Options.from(params);
        log.debug("[{}] Resolved options: {}", type.stageName(), options);
    }

    @Override
    protected boolean isContinuation() {
        return true;
    }

    @Override
    protected ValidationResult doValidate() {
        if (!hasText(options.refinementStar())) {
            return ValidationResult.fail("Refinement optimiser STAR file is required");
        }
        if (!hasText(options.bodyMasks())) {
            return ValidationResult.fail("Body mask STAR file is required");
        }
        ValidationResult result = validateFileExists(options.refinementStar(), "Refinement optimiser STAR file");
        if (!result.valid()) {
            return result;
        }
        return validateFileExists(options.bodyMasks(), "Body mask STAR file");
    }

    @Override
    protected JobCommand doBuildCommand(Path outputDir, String jobName) {
        Options o = options;
        String out = outputDirArg(outputDir);
        String bodies = relativeInput(o.bodyMasks());

        CommandSpec.Builder refine = CommandSpec.builder(buildMpiCommand("relion_refine", o.mpiProcs(), o.gpu()))
                .arg("--continue", relativeInput(o.refinementStar()))
                .arg("--o", out + "run")
                .flagIf(o.solventCorrectFsc(), "--solvent_correct_fsc")
                .arg("--multibody_masks", bodies)
                .flagIf(o.reconstructSubtractedBodies(), "--reconstruct_subtracted_bodies")
                .arg("--oversampling", 1)
                .arg("--healpix_order", o.healpixOrder())
                .arg("--auto_local_healpix_order", o.healpixOrder())
                .arg("--offset_range", o.offsetRange())
                .arg("--offset_step", o.offsetStep())
                .flagIf(!o.combineIterations(), "--dont_combine_weights_via_disc")
                .arg("--pool", o.pooledParticles())
                .arg("--pad", 2)
                .arg("--j", o.threads())
                .arg("--pipeline_control", out)
                .flagIf(o.blush(), "--blush")
                .argIf(o.gpu(), "--gpu", o.gpuIds())
                .flagIf(!o.parallelIo(), "--no_parallel_disc_io");

        addAdditionalArguments(refine);
        CommandSpec refineStep = refine.build();

        if (o.flexibility() == null) {
            return refineStep;
        }
        log.info("[{}] Appending flexibility analysis", type.stageName());
        return CommandChain.of(refineStep, flexAnalysis(out, bodies, o.flexibility()));
    }

    private static CommandSpec flexAnalysis(String out, String bodies, Flexibility f) {
        CommandSpec.Builder cmd = CommandSpec.builder("relion_flex_analyse")
                .flag("--PCA_orient")
                .arg("--model", out + "run_model.star")
                .arg("--data", out + "run_data.star")
                .arg("--bodies", bodies)
                .arg("--o", out + "analyse")
                .flag("--do_maps")
                .arg("--k", f.eigenvectorMovies());
        if (f.selectByEigenvalue()) {
            cmd.flag("--write_pca_projections")
                    .arg("--select_eigenvalue", f.eigenvalue())
                    .arg("--select_eigenvalue_min", f.minEigenvalue())
                    .arg("--select_eigenvalue_max", f.maxEigenvalue());
        }
        return cmd.arg("--pipeline_control", out).build();
    }
}
