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
import java.util.regex.Pattern;

import static io.cryojob4j.utils.ParameterResolver.getBool;
import static io.cryojob4j.utils.ParameterResolver.getFloat;
import static io.cryojob4j.utils.ParameterResolver.getGpuIds;
import static io.cryojob4j.utils.ParameterResolver.getInputStarFile;
import static io.cryojob4j.utils.ParameterResolver.getInt;
import static io.cryojob4j.utils.ParameterResolver.getMpiProcs;
import static io.cryojob4j.utils.ParameterResolver.getString;

/**
 * {@code relion_run_ctffind} with CTFFIND 4/5 or Gctf as the estimation backend.
 */
public class CtfEstimationBuilder extends AbstractJobCommandBuilder {
    private static final Logger log = LoggerFactory.getLogger(CtfEstimationBuilder.class);

    private static final Pattern CTFFIND5 = Pattern.compile("ctffind[-_]?5", Pattern.CASE_INSENSITIVE);

    record Options(
            String inputStarFile,
            int astigmatism,
            boolean useGctf,
            String gctfExecutable,
            String ctffindExecutable,
            int ctfWindow,
            int boxSize,
            double minResolution,
            double maxResolution,
            double minDefocus,
            double maxDefocus,
            double defocusStep,
            boolean usePowerSpectra,
            boolean useNonDoseWeighted,
            boolean exhaustiveSearch,
            boolean estimatePhaseShift,
            double phaseMin,
            double phaseMax,
            double phaseStep,
            int mpiProcs,
            String gpuIds
    ) {
        static Options from(JobParameters p, CompilerProperties props) {
            return new Options(
                    getInputStarFile(p),
                    getInt(p, List.of("astigmatism", "dAst"), 100),
                    getBool(p, List.of("useGctf", "use_gctf"), false),
                    getString(p, List.of("gctfExecutable", "gctf_exe"), props.getGctfExecutable()),
                    getString(p, List.of("ctfFindExecutable", "ctffindExecutable", "ctffind_exe"), props.getCtffindExecutable()),
                    getInt(p, List.of("ctfWindowSize"), -1),
                    getInt(p, List.of("fftBoxSize"), 512),
                    getFloat(p, List.of("minResolution"), 30),
                    getFloat(p, List.of("maxResolution"), 5),
                    getFloat(p, List.of("minDefocus"), 5000),
                    getFloat(p, List.of("maxDefocus"), 50000),
                    getFloat(p, List.of("defocusStepSize"), 500),
                    getBool(p, List.of("usePowerSpectraFromMotionCorr"), false),
                    getBool(p, List.of("useMicrographWithoutDoseWeighting"), false),
                    getBool(p, List.of("useExhaustiveSearch"), true),
                    getBool(p, List.of("estimatePhaseShifts"), false),
                    getFloat(p, List.of("phaseShiftMin"), 0),
                    getFloat(p, List.of("phaseShiftMax"), 180),
                    getFloat(p, List.of("phaseShiftStep"), 10),
                    getMpiProcs(p),
                    getGpuIds(p)
            );
        }

        String executable() {
            return useGctf ? gctfExecutable : ctffindExecutable;
        }
    }

    private final Options options;

    public CtfEstimationBuilder(JobParameters params, ProjectPaths paths, CompilerProperties props) {
        super(JobType.CTF_ESTIMATION, params, paths, props);
        this.options = Options.from(params, props);
        log.debug("[{}] Resolved options: {}", type.stageName(), options);
    }

    /**
     * GPU only with Gctf; CTFFIND is CPU-only.
     */
    @Override
    public boolean supportsGpu() {
        return options.useGctf();
    }

    @Override
    protected boolean usesGpu() {
        return options.useGctf();
    }

    @Override
    protected ValidationResult doValidate() {
        if (!hasText(options.inputStarFile())) {
            return ValidationResult.fail("Input STAR file is required");
        }
        ValidationResult exists = validateFileExists(options.inputStarFile(), "Input STAR file");
        if (!exists.valid()) {
            return exists;
        }
        if (!isSafeExecutablePath(options.executable())) {
            return ValidationResult.fail("Invalid " + (options.useGctf() ? "Gctf" : "CTFFIND")
                    + " executable path: contains unsafe characters");
        }
        return ValidationResult.ok();
    }

    @Override
    protected JobCommand doBuildCommand(Path outputDir, String jobName) {
        Options o = options;
        String out = outputDirArg(outputDir);

        CommandSpec.Builder cmd = CommandSpec.builder(buildMpiCommand("relion_run_ctffind", o.mpiProcs(), o.useGctf()))
                .arg("--i", relativeInput(o.inputStarFile()))
                .arg("--o", out)
                .arg("--dAst", o.astigmatism());

        if (o.useGctf()) {
            cmd.flag("--use_gctf")
                    .arg("--gctf_exe", o.gctfExecutable());
        } else {
            cmd.arg("--ctffind_exe", o.ctffindExecutable())
                    .flagIf(!CTFFIND5.matcher(o.ctffindExecutable()).find(), "--is_ctffind4");
        }

        double dfMin = o.minDefocus();
        double dfMax = o.maxDefocus();
        if (dfMin > dfMax) {
            log.warn("[{}] Defocus range inverted: min={} > max={}, swapping", type.stageName(), dfMin, dfMax);
            double t = dfMin;
            dfMin = dfMax;
            dfMax = t;
        }

        cmd.arg("--ctfWin", o.ctfWindow())
                .arg("--Box", o.boxSize())
                .arg("--ResMin", o.minResolution())
                .arg("--ResMax", o.maxResolution())
                .arg("--dFMin", dfMin)
                .arg("--dFMax", dfMax)
                .arg("--FStep", o.defocusStep())
                .arg("--pipeline_control", out)
                .flagIf(o.usePowerSpectra(), "--use_given_ps")
                .flagIf(o.useNonDoseWeighted(), "--use_noDW")
                .flagIf(!o.exhaustiveSearch(), "--fast_search");

        if (o.estimatePhaseShift()) {
            cmd.flag("--do_phaseshift")
                    .arg("--phase_min", o.phaseMin())
                    .arg("--phase_max", o.phaseMax())
                    .arg("--phase_step", o.phaseStep());
        }

        cmd.argIf(o.useGctf(), "--gpu", o.gpuIds());
        addThumbnailFlags(cmd);
        addAdditionalArguments(cmd);
        return cmd.build();
    }
}
