package io.cryojob4j.internal.relion;

import io.cryojob4j.config.CompilerProperties;
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
import static io.cryojob4j.utils.ParameterResolver.getContinueFrom;
import static io.cryojob4j.utils.ParameterResolver.getFloat;
import static io.cryojob4j.utils.ParameterResolver.getGpuIds;
import static io.cryojob4j.utils.ParameterResolver.getInputStarFile;
import static io.cryojob4j.utils.ParameterResolver.getInt;
import static io.cryojob4j.utils.ParameterResolver.getIterations;
import static io.cryojob4j.utils.ParameterResolver.getMaskDiameter;
import static io.cryojob4j.utils.ParameterResolver.getMpiProcs;
import static io.cryojob4j.utils.ParameterResolver.getNumberOfClasses;
import static io.cryojob4j.utils.ParameterResolver.getPooledParticles;
import static io.cryojob4j.utils.ParameterResolver.getScratchDir;
import static io.cryojob4j.utils.ParameterResolver.getThreads;
import static io.cryojob4j.utils.ParameterResolver.isGpuEnabled;

/**
 * 2D classification with {@code relion_refine}.
 *
 * <p>Runs either VDAM mini-batch optimisation (default) or classic EM. Continuation jobs resume
 * from an optimiser file and only carry the I/O and parallelism flags.
 */
public class Class2dBuilder extends AbstractJobCommandBuilder {
    private static final Logger log = LoggerFactory.getLogger(Class2dBuilder.class);

    record Options(
            String inputStarFile,
            String continueFrom,
            boolean vdam,
            int vdamMiniBatches,
            int emIterations,
            double regularisation,
            int maskDiameter,
            int numberOfClasses,
            boolean ctfCorrection,
            boolean ignoreCtfsUntilFirstPeak,
            boolean imageAlignment,
            double psiStep,
            double offsetRange,
            double offsetStep,
            boolean allowCoarserSampling,
            double limitResolutionEStep,
            boolean helical,
            double tubeDiameter,
            boolean bimodalPsi,
            double helicalRise,
            boolean restrictHelicalOffsets,
            boolean prereadImages,
            String scratchDir,
            boolean parallelIo,
            int pooledParticles,
            int threads,
            int mpiProcs,
            boolean gpu,
            String gpuIds
    ) {
        static Options from(JobParameters p) {
            return new Options(
                    getInputStarFile(p),
                    getContinueFrom(p),
                    getBool(p, List.of("useVDAM"), true),
                    getInt(p, List.of("vdamMiniBatches"), 200),
                    getIterations(p, 25),
                    getFloat(p, List.of("regularisationParameter", "regularisationParam", "tau2_fudge"), 2),
                    getMaskDiameter(p),
                    getNumberOfClasses(p),
                    getBool(p, List.of("ctfCorrection"), true),
                    getBool(p, List.of("ignoreCTFs", "ctf_intact_first_peak"), false),
                    getBool(p, List.of("performImageAlignment"), true),
                    getFloat(p, List.of("inPlaneAngularSampling", "psi_step"), 6),
                    getFloat(p, List.of("initialOffsetRange", "offsetSearchRange", "offset_range"), 5),
                    getFloat(p, List.of("initialOffsetStep", "offsetSearchStep", "offset_step"), 1),
                    getBool(p, List.of("allowCoarseSampling"), false),
                    getFloat(p, List.of("limitResolutionEStep", "strict_highres_exp"), -1),
                    getBool(p, List.of("classify2DHelical", "helical"), false),
                    getFloat(p, List.of("tubeDiameter", "helical_outer_diameter"), 200),
                    getBool(p, List.of("doBimodalAngular", "bimodal_psi"), false),
                    getFloat(p, List.of("helicalRise", "helical_rise"), 4.75),
                    getBool(p, List.of("restrictHelicalOffsets"), false),
                    getBool(p, List.of("preReadAllParticles", "preread_images"), false),
                    getScratchDir(p),
                    getBool(p, List.of("useParallelIO"), true),
                    getPooledParticles(p),
                    getThreads(p),
                    getMpiProcs(p),
                    isGpuEnabled(p),
                    getGpuIds(p)
            );
        }

        boolean continuation() {
            return continueFrom != null && !continueFrom.isBlank();
        }

        /**
         * Mini-batch count in VDAM mode, EM iterations otherwise.
         */
        int iterations() {
            return vdam ? vdamMiniBatches : emIterations;
        }
    }

    private final Options options;

    public Class2dBuilder(JobParameters params, ProjectPaths paths, CompilerProperties props) {
        super(JobType.CLASS_2D, params, paths, props);
        this.options = Options.from(params);
        log.debug("[{}] Resolved options: {}", type.stageName(), options);
    }

    @Override
    protected boolean isContinuation() {
        return options.continuation();
    }

    @Override
    protected ValidationResult doValidate() {
        if (options.continuation()) {
            return validateFileExists(options.continueFrom(), "Continue from file");
        }
        if (!hasText(options.inputStarFile())) {
            return ValidationResult.fail("Input star file is required");
        }
        return validateFileExists(options.inputStarFile(), "Input STAR file");
    }

    @Override
    protected JobCommand doBuildCommand(Path outputDir, String jobName) {
        Options o = options;
        String out = outputDirArg(outputDir);
        CommandSpec.Builder cmd = CommandSpec.builder(buildMpiCommand("relion_refine", o.mpiProcs(), o.gpu()));

        if (o.continuation()) {
            log.info("[{}] Continuing from optimiser file: {}", type.stageName(), o.continueFrom());
            cmd.arg("--o", out)
                    .arg("--continue", relativeInput(o.continueFrom()))
                    .flag("--dont_combine_weights_via_disc")
                    .arg("--pool", o.pooledParticles())
                    .arg("--j", o.threads())
                    .arg("--pipeline_control", out);
        } else {
            addNewJobFlags(cmd, out);
        }

        if (o.gpu()) {
            cmd.arg("--gpu", o.gpuIds());
        }
        cmd.flagIf(o.prereadImages(), "--preread_images")
                .argIf(hasText(o.scratchDir()), "--scratch_dir", o.scratchDir())
                .flagIf(!o.parallelIo(), "--no_parallel_disc_io");

        addAdditionalArguments(cmd);
        return cmd.build();
    }

    private void addNewJobFlags(CommandSpec.Builder cmd, String out) {
        Options o = options;
        cmd.arg("--o", out)
                .arg("--i", relativeInput(o.inputStarFile()))
                .flag("--dont_combine_weights_via_disc")
                .arg("--pool", o.pooledParticles())
                .flagIf(o.ctfCorrection(), "--ctf")
                .arg("--iter", o.iterations())
                .arg("--tau2_fudge", o.regularisation())
                .arg("--particle_diameter", o.maskDiameter())
                .arg("--K", o.numberOfClasses())
                .flag("--flatten_solvent");

        if (o.imageAlignment()) {
            cmd.flag("--zero_mask")
                    .flag("--center_classes")
                    .arg("--oversampling", 1)
                    .arg("--psi_step", o.psiStep())
                    .arg("--offset_range", o.offsetRange())
                    .arg("--offset_step", o.offsetStep())
                    .flagIf(o.allowCoarserSampling(), "--allow_coarser_sampling");
        } else {
            cmd.flag("--skip_align");
        }

        cmd.flag("--norm")
                .flag("--scale")
                .arg("--j", o.threads())
                .arg("--pipeline_control", out)
                .flagIf(o.ignoreCtfsUntilFirstPeak(), "--ctf_intact_first_peak");

        if (o.vdam()) {
            cmd.flag("--grad")
                    .arg("--class_inactivity_threshold", 0.1)
                    .arg("--grad_write_iter", 10);
        }

        cmd.argIf(o.limitResolutionEStep() > 0, "--strict_highres_exp", o.limitResolutionEStep());

        if (o.helical()) {
            cmd.arg("--helical_outer_diameter", o.tubeDiameter())
                    .flagIf(o.bimodalPsi(), "--bimodal_psi")
                    .arg("--helical_rise_initial", o.helicalRise())
                    .argIf(o.restrictHelicalOffsets(), "--helical_offset_step", o.offsetStep());
        }
    }
}
