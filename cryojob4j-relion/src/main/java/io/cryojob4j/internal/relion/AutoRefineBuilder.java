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
import static io.cryojob4j.utils.ParameterResolver.getFloat;
import static io.cryojob4j.utils.ParameterResolver.getGpuIds;
import static io.cryojob4j.utils.ParameterResolver.getInputStarFile;
import static io.cryojob4j.utils.ParameterResolver.getInt;
import static io.cryojob4j.utils.ParameterResolver.getMaskDiameter;
import static io.cryojob4j.utils.ParameterResolver.getMpiProcs;
import static io.cryojob4j.utils.ParameterResolver.getPooledParticles;
import static io.cryojob4j.utils.ParameterResolver.getReference;
import static io.cryojob4j.utils.ParameterResolver.getString;
import static io.cryojob4j.utils.ParameterResolver.getSymmetry;
import static io.cryojob4j.utils.ParameterResolver.getThreads;
import static io.cryojob4j.utils.ParameterResolver.isGpuEnabled;

/**
 * Gold-standard 3D auto-refinement with {@code relion_refine --auto_refine --split_random_halves}.
 */
public class AutoRefineBuilder extends AbstractJobCommandBuilder {
    private static final Logger log = LoggerFactory.getLogger(AutoRefineBuilder.class);

    /**
     * One leader plus one worker per half-set.
     */
    static final int MIN_SPLIT_HALVES_MPI = 3;

    record Helical(
            double innerDiameter,
            double outerDiameter,
            int asymmetricalUnits,
            double initialTwist,
            double initialRise,
            double centralZPercent,
            double sigmaTilt,
            double sigmaPsi,
            double sigmaRot,
            double localAveraging,
            boolean keepTiltPriorFixed,
            boolean symmetrySearch,
            double twistMin,
            double twistMax,
            double twistStep,
            double riseMin,
            double riseMax,
            double riseStep
    ) {
        static Helical from(JobParameters p) {
            boolean search = getBool(p, List.of("helicalSymmetry"), true)
                    && getBool(p, List.of("localSearches", "localSearchSymmetry"), false);
            return new Helical(
                    getFloat(p, List.of("tubeDiameter1", "innerDiameter"), -1),
                    getFloat(p, List.of("tubeDiameter2", "outerDiameter"), -1),
                    getInt(p, List.of("numberOfUniqueAsymmetrical", "uniqueAsymmetricalUnits"), 1),
                    getFloat(p, List.of("initialTwist"), 0),
                    getFloat(p, List.of("rise", "initialRise"), 0),
                    getFloat(p, List.of("centralZlength"), 30),
                    getFloat(p, List.of("angularTilt"), 15),
                    getFloat(p, List.of("angularPsi"), 10),
                    getFloat(p, List.of("angularRot"), -1),
                    getFloat(p, List.of("rangeFactorOfLocal", "localAveraging"), -1),
                    getBool(p, List.of("keepTiltPriorFixed", "tiltPrior"), true),
                    search,
                    getFloat(p, List.of("twistSearch1", "twistMin"), 0),
                    getFloat(p, List.of("twistSearch2", "twistMax"), 0),
                    getFloat(p, List.of("twistSearch3", "twistStep"), 0),
                    getFloat(p, List.of("riseSearchMin", "riseMin"), 0),
                    getFloat(p, List.of("riseSearchMax", "riseMax"), 0),
                    getFloat(p, List.of("riseSearchStep", "riseStep"), 0)
            );
        }
    }

    record Options(
            String inputStarFile,
            String reference,
            double initialLowPass,
            String symmetry,
            int maskDiameter,
            int healpixOrder,
            boolean resizeReference,
            String referenceMask,
            double offsetRange,
            double offsetStep,
            boolean finerAngularSampling,
            String relaxSymmetry,
            boolean referenceOnAbsoluteScale,
            boolean ctfCorrection,
            boolean ignoreCtfsUntilFirstPeak,
            boolean maskParticlesWithZeros,
            boolean blush,
            boolean solventFlattenedFsc,
            boolean parallelIo,
            boolean combineIterationsViaDisc,
            int pooledParticles,
            int threads,
            int requestedMpiProcs,
            boolean gpu,
            String gpuIds,
            Helical helical
    ) {
        static Options from(JobParameters p) {
            return new Options(
                    getInputStarFile(p),
                    getReference(p),
                    getFloat(p, List.of("initialLowPassFilter", "lowPassFilter", "ini_high"), 60),
                    getSymmetry(p),
                    getMaskDiameter(p),
                    HealpixOrder.resolve(p, List.of("initialAngularSampling"), 7.5),
                    getBool(p, List.of("resizeReference"), true),
                    getString(p, List.of("referenceMask", "solvent_mask"), null),
                    getFloat(p, List.of("initialOffsetRange", "offSetRange", "offset_range"), 5),
                    getFloat(p, List.of("initialOffsetStep", "offSetStep", "offset_step"), 1),
                    getBool(p, List.of("finerAngularSampling"), false),
                    getString(p, List.of("RelaxSymmetry", "relaxSymmetry"), null),
                    getBool(p, List.of("referenceMapAbsolute", "absoluteGreyscale"), false),
                    getBool(p, List.of("ctfCorrection"), true),
                    getBool(p, List.of("igonreCtf", "ignoreCTFs", "ctf_intact_first_peak"), false),
                    getBool(p, List.of("maskIndividualparticles", "maskParticlesWithZeros"), true),
                    getBool(p, List.of("useBlushRegularisation"), false),
                    getBool(p, List.of("useSolventFlattenedFscs", "solvent_correct_fsc"), false),
                    getBool(p, List.of("Useparalleldisc", "useParallelIO"), true),
                    getBool(p, List.of("combineIterations"), false),
                    getPooledParticles(p),
                    getThreads(p),
                    getMpiProcs(p),
                    isGpuEnabled(p),
                    getGpuIds(p),
                    getBool(p, List.of("helicalReconstruction", "helix"), false) ? Helical.from(p) : null
            );
        }
    }

    private final Options options;

    public AutoRefineBuilder(JobParameters params, ProjectPaths paths, CompilerProperties props) {
        super(JobType.AUTO_REFINE, params, paths, props);
        this.options = Options.from(params);
        log.debug("[{}] Resolved options: {}", type.stageName(), options);
    }

    /**
     * Two processes cannot split random halves, so 2 becomes 3. One process stays single.
     */
    @Override
    protected int effectiveMpiProcs() {
        int requested = options.requestedMpiProcs();
        return (requested > 1 && requested < MIN_SPLIT_HALVES_MPI) ? MIN_SPLIT_HALVES_MPI : requested;
    }

    @Override
    protected ValidationResult doValidate() {
        if (!hasText(options.inputStarFile())) {
            return ValidationResult.fail("Input star file is required");
        }
        if (!hasText(options.reference())) {
            return ValidationResult.fail("Reference map is required");
        }
        ValidationResult result = validateFileExists(options.inputStarFile(), "Input STAR file");
        if (!result.valid()) {
            return result;
        }
        return validateFileExists(options.reference(), "Reference map");
    }

    @Override
    protected JobCommand doBuildCommand(Path outputDir, String jobName) {
        Options o = options;
        String out = outputDirArg(outputDir);

        int mpiProcs = effectiveMpiProcs();
        if (mpiProcs != o.requestedMpiProcs()) {
            log.warn("[{}] MPI procs {} < {}, forcing to {} for split_random_halves",
                    type.stageName(), o.requestedMpiProcs(), MIN_SPLIT_HALVES_MPI, mpiProcs);
        }

        CommandSpec.Builder cmd = CommandSpec.builder(buildMpiCommand("relion_refine", mpiProcs, o.gpu()))
                .arg("--i", relativeInput(o.inputStarFile()))
                .arg("--o", out)
                .flag("--auto_refine")
                .flag("--split_random_halves")
                .arg("--ref", relativeInput(o.reference()))
                .arg("--ini_high", o.initialLowPass())
                .arg("--sym", o.symmetry())
                .arg("--particle_diameter", o.maskDiameter())
                .arg("--healpix_order", o.healpixOrder())
                .arg("--auto_local_healpix_order", 4)
                .flag("--flatten_solvent")
                .flag("--norm")
                .flag("--scale")
                .arg("--oversampling", 1)
                .arg("--pool", o.pooledParticles())
                .arg("--pad", 2)
                .arg("--low_resol_join_halves", 40)
                .arg("--j", o.threads())
                .arg("--pipeline_control", out)
                .flagIf(!o.resizeReference(), "--trust_ref_size");

        if (hasText(o.referenceMask())) {
            cmd.arg("--solvent_mask", relativeInput(o.referenceMask()));
        }

        cmd.arg("--offset_range", o.offsetRange())
                .arg("--offset_step", o.offsetStep());

        if (o.finerAngularSampling()) {
            cmd.flag("--auto_ignore_angles")
                    .flag("--auto_resol_angles");
        }

        cmd.argIf(hasText(o.relaxSymmetry()), "--relax_sym", o.relaxSymmetry())
                .flagIf(!o.referenceOnAbsoluteScale(), "--firstiter_cc")
                .flagIf(o.ctfCorrection(), "--ctf")
                .flagIf(o.ignoreCtfsUntilFirstPeak(), "--ctf_intact_first_peak")
                .flagIf(o.maskParticlesWithZeros(), "--zero_mask")
                .flagIf(o.blush(), "--blush")
                .flagIf(o.solventFlattenedFsc(), "--solvent_correct_fsc")
                .flagIf(!o.parallelIo(), "--no_parallel_disc_io")
                .flagIf(!o.combineIterationsViaDisc(), "--dont_combine_weights_via_disc")
                .argIf(o.gpu(), "--gpu", o.gpuIds());

        if (o.helical() != null) {
            addHelicalFlags(cmd, o.helical());
        }

        addAdditionalArguments(cmd);
        return cmd.build();
    }

    private static void addHelicalFlags(CommandSpec.Builder cmd, Helical h) {
        cmd.flag("--helix")
                .argIf(h.innerDiameter() > 0, "--helical_inner_diameter", h.innerDiameter())
                .arg("--helical_outer_diameter", h.outerDiameter())
                .arg("--helical_nr_asu", h.asymmetricalUnits())
                .arg("--helical_twist_initial", h.initialTwist())
                .arg("--helical_rise_initial", h.initialRise())
                .arg("--helical_z_percentage", h.centralZPercent() / 100.0)
                .argIf(h.sigmaTilt() > 0, "--sigma_tilt", h.sigmaTilt())
                .argIf(h.sigmaPsi() > 0, "--sigma_psi", h.sigmaPsi() / 3.0)
                .argIf(h.sigmaRot() > 0, "--sigma_rot", h.sigmaRot() / 3.0 / 5.0)
                .argIf(h.localAveraging() > 0, "--helical_sigma_distance", h.localAveraging() / 3.0)
                .flagIf(h.keepTiltPriorFixed(), "--helical_keep_tilt_prior_fixed");

        if (h.symmetrySearch()) {
            cmd.flag("--helical_symmetry_search")
                    .arg("--helical_twist_min", h.twistMin())
                    .arg("--helical_twist_max", h.twistMax())
                    .argIf(h.twistStep() > 0, "--helical_twist_inistep", h.twistStep())
                    .arg("--helical_rise_min", h.riseMin())
                    .arg("--helical_rise_max", h.riseMax())
                    .argIf(h.riseStep() > 0, "--helical_rise_inistep", h.riseStep());
        }
    }
}
