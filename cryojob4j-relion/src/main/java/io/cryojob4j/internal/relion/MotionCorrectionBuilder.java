package io.cryojob4j.internal.relion;

import io.cryojob4j.config.CompilerProperties;
import io.cryojob4j.core.CommandSpec;
import io.cryojob4j.core.JobCommand;
import io.cryojob4j.core.JobParameters;
import io.cryojob4j.core.JobType;
import io.cryojob4j.core.ProjectPaths;
import io.cryojob4j.core.ValidationResult;
import io.cryojob4j.internal.AbstractJobCommandBuilder;
import io.cryojob4j.utils.FlagValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import static io.cryojob4j.utils.ParameterResolver.getBool;
import static io.cryojob4j.utils.ParameterResolver.getFloat;
import static io.cryojob4j.utils.ParameterResolver.getGpuIds;
import static io.cryojob4j.utils.ParameterResolver.getInt;
import static io.cryojob4j.utils.ParameterResolver.getMpiProcs;
import static io.cryojob4j.utils.ParameterResolver.getString;
import static io.cryojob4j.utils.ParameterResolver.getThreads;

/**
 * {@code relion_run_motioncorr}, using RELION's own implementation or MotionCor2.
 *
 * <p>Only the MotionCor2 path runs on GPUs; float16 output and power spectra are only available
 * with RELION's implementation.
 */
public class MotionCorrectionBuilder extends AbstractJobCommandBuilder {
    private static final Logger log = LoggerFactory.getLogger(MotionCorrectionBuilder.class);

    private static final Pattern SHELL_CHARS = Pattern.compile("[;|&`$()<>{}!\\\\\\n\\r]");

    record Options(
            String inputMovies,
            int firstFrame,
            int lastFrame,
            int binFactor,
            int bfactor,
            double dosePerFrame,
            double preExposure,
            int patchX,
            int patchY,
            int eerGrouping,
            String gainReference,
            int gainRotation,
            int gainFlip,
            String defectFile,
            boolean float16,
            boolean doseWeighting,
            boolean saveNonDoseWeighted,
            boolean savePowerSpectra,
            int powerSpectraGrouping,
            boolean useRelionImplementation,
            String motioncor2Executable,
            String otherMotionArgs,
            int threads,
            int mpiProcs,
            String gpuIds
    ) {
        static Options from(JobParameters p, CompilerProperties props) {
            return new Options(
                    getString(p, List.of("inputMovies"), null),
                    getInt(p, List.of("firstFrame"), 1),
                    getInt(p, List.of("lastFrame"), -1),
                    getInt(p, List.of("binningFactor"), 1),
                    getInt(p, List.of("bfactor"), 150),
                    getFloat(p, List.of("dosePerFrame"), 1.0),
                    getFloat(p, List.of("preExposure"), 0.0),
                    getInt(p, List.of("patchesX"), 1),
                    getInt(p, List.of("patchesY"), 1),
                    getInt(p, List.of("eerFractionation"), 32),
                    trimToNull(getString(p, List.of("gainReferenceImage"), null)),
                    FlagValues.labelCode(p.get("gainRotation"), Options::rotationKeyword),
                    FlagValues.labelCode(p.get("gainFlip"), Options::flipKeyword),
                    trimToNull(getString(p, List.of("defectFile"), null)),
                    getBool(p, List.of("float16Output"), false),
                    getBool(p, List.of("doseWeighting"), false),
                    getBool(p, List.of("nonDoseWeighted"), false),
                    getBool(p, List.of("savePowerSpectra"), false),
                    getInt(p, List.of("sumPowerSpectra", "powerSpectraEvery"), 4),
                    getBool(p, List.of("useRelionImplementation"), true),
                    getString(p, List.of("motioncor2Executable"), props.getMotioncor2Executable()),
                    getString(p, List.of("otherMotion"), null),
                    getThreads(p),
                    getMpiProcs(p),
                    getGpuIds(p)
            );
        }

        private static int rotationKeyword(String label) {
            if (label.contains("270")) return 3;
            if (label.contains("180")) return 2;
            if (label.contains("90")) return 1;
            return 0;
        }

        private static int flipKeyword(String label) {
            if (label.contains("upside") || label.contains("horizontal")) return 1;
            if (label.contains("left") || label.contains("vertical")) return 2;
            return 0;
        }

        boolean usesMotionCor2() {
            return !useRelionImplementation;
        }
    }

    private final Options options;

    public MotionCorrectionBuilder(JobParameters params, ProjectPaths paths, CompilerProperties props) {
        super(JobType.MOTION_CORRECTION, params, paths, props);
        this.options = Options.from(params, props);
        log.debug("[{}] Resolved options: {}", type.stageName(), options);
    }

    /**
     * GPU only with MotionCor2; RELION's implementation is CPU-only.
     */
    @Override
    public boolean supportsGpu() {
        return options.usesMotionCor2();
    }

    @Override
    protected boolean usesGpu() {
        return options.usesMotionCor2();
    }

    @Override
    protected ValidationResult doValidate() {
        if (!hasText(options.inputMovies())) {
            return ValidationResult.fail("Input movies STAR file is required");
        }
        ValidationResult exists = validateFileExists(options.inputMovies(), "Input movies STAR file");
        if (!exists.valid()) {
            return exists;
        }
        if (options.usesMotionCor2() && hasText(options.motioncor2Executable())
                && !isSafeExecutablePath(options.motioncor2Executable().trim())) {
            return ValidationResult.fail("Invalid MotionCor2 executable path: contains unsafe characters");
        }
        if (options.binFactor() > 1) {
            return validateBinningDimensions();
        }
        return ValidationResult.ok();
    }

    /**
     * RELION requires even micrograph dimensions after binning. Unreadable inputs skip the check.
     */
    private ValidationResult validateBinningDimensions() {
        int bin = options.binFactor();
        try {
            Optional<String> movie = StarFiles.firstMoviePath(resolveInputPath(options.inputMovies()));
            if (movie.isEmpty()) {
                log.warn("[{}] Could not read movie path from STAR file, skipping bin validation", type.stageName());
                return ValidationResult.ok();
            }
            MrcHeader header = MrcHeader.read(resolveInputPath(movie.get()));
            if (!header.evenAfterBinning(bin)) {
                return ValidationResult.fail(String.format(
                        "Movie dimensions %dx%d with bin_factor %d produce %sx%s; RELION requires even dimensions "
                                + "after binning. Use bin_factor 1 instead.",
                        header.nx(), header.ny(), bin,
                        FlagValues.format(header.nx() / (double) bin), FlagValues.format(header.ny() / (double) bin)));
            }
            log.info("[{}] Bin validation: OK | {}x{} / {}", type.stageName(), header.nx(), header.ny(), bin);
            return ValidationResult.ok();
        } catch (IOException e) {
            log.warn("[{}] Bin validation skipped: {}", type.stageName(), e.getMessage());
            return ValidationResult.ok();
        }
    }

    @Override
    protected JobCommand doBuildCommand(Path outputDir, String jobName) {
        Options o = options;
        String out = outputDirArg(outputDir);
        boolean motionCor2 = o.usesMotionCor2();

        CommandSpec.Builder cmd = CommandSpec.builder(buildMpiCommand("relion_run_motioncorr", o.mpiProcs(), motionCor2))
                .arg("--i", relativeInput(o.inputMovies()))
                .arg("--o", out)
                .arg("--first_frame_sum", o.firstFrame())
                .arg("--last_frame_sum", o.lastFrame())
                .arg("--bin_factor", o.binFactor())
                .arg("--bfactor", o.bfactor())
                .arg("--dose_per_frame", o.dosePerFrame())
                .arg("--preexposure", o.preExposure())
                .arg("--patch_x", o.patchX())
                .arg("--patch_y", o.patchY())
                .arg("--eer_grouping", o.eerGrouping())
                .arg("--pipeline_control", out);

        if (o.gainReference() != null) {
            cmd.arg("--gainref", relativeInput(o.gainReference()))
                    .argIf(o.gainRotation() != 0, "--gain_rot", o.gainRotation())
                    .argIf(o.gainFlip() != 0, "--gain_flip", o.gainFlip());
        }
        if (o.defectFile() != null) {
            cmd.arg("--defect_file", relativeInput(o.defectFile()));
        }

        boolean float16 = !motionCor2 && o.float16();
        cmd.flagIf(float16, "--float16")
                .flagIf(o.doseWeighting(), "--dose_weighting")
                .flagIf(o.saveNonDoseWeighted(), "--save_noDW")
                .argIf(!motionCor2 && (o.savePowerSpectra() || float16), "--grouping_for_ps", o.powerSpectraGrouping())
                .argIf(o.threads() > 1, "--j", o.threads());

        if (!motionCor2) {
            cmd.flag("--use_own");
        } else {
            addMotionCor2Flags(cmd);
        }

        addThumbnailFlags(cmd);
        addAdditionalArguments(cmd);
        return cmd.build();
    }

    private void addMotionCor2Flags(CommandSpec.Builder cmd) {
        cmd.flag("--use_motioncor2");
        String exe = options.motioncor2Executable();
        if (hasText(exe)) {
            cmd.arg("--motioncor2_exe", exe.trim());
        } else {
            log.warn("[{}] MotionCor2 executable not configured", type.stageName());
        }
        cmd.argIf(hasText(options.gpuIds()), "--gpu", options.gpuIds());

        String other = options.otherMotionArgs();
        if (!hasText(other)) {
            return;
        }
        if (SHELL_CHARS.matcher(other).find()) {
            log.warn("[{}] Ignoring MotionCor2 arguments with shell characters: {}", type.stageName(), other);
            return;
        }
        for (String token : other.trim().split("\\s+")) {
            cmd.token(token);
        }
    }

    private static String trimToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
