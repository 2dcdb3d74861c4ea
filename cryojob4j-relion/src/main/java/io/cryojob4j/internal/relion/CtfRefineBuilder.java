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

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static io.cryojob4j.utils.ParameterResolver.getBool;
import static io.cryojob4j.utils.ParameterResolver.getFloat;
import static io.cryojob4j.utils.ParameterResolver.getMpiProcs;
import static io.cryojob4j.utils.ParameterResolver.getString;
import static io.cryojob4j.utils.ParameterResolver.getThreads;

/**
 * Per-particle CTF refinement with {@code relion_ctf_refine}. CPU only.
 */
public class CtfRefineBuilder extends AbstractJobCommandBuilder {
    private static final Logger log = LoggerFactory.getLogger(CtfRefineBuilder.class);

    static final String MASK_FIELD = "_rlnMaskName";

    record Options(
            String particlesStar,
            String postProcessStar,
            double minResolution,
            boolean anisotropicMagnification,
            boolean ctfParameters,
            String fitMode,
            boolean beamTilt,
            boolean trefoil,
            boolean fourthOrderAberrations,
            int threads,
            int mpiProcs
    ) {
        static Options from(JobParameters p) {
            return new Options(
                    getString(p, List.of("particlesStar"), null),
                    getString(p, List.of("postProcessStar", "postprocessStar"), null),
                    getFloat(p, List.of("minResolutionFits"), 30),
                    getBool(p, List.of("estimateMagnification"), false),
                    getBool(p, List.of("ctfParameter"), false),
                    FitMode.encode(
                            FitMode.fromLabel(p.get("fitPhaseShift")),
                            FitMode.fromLabel(p.get("fitDefocus")),
                            FitMode.fromLabel(p.get("fitAstigmatism")),
                            FitMode.fromLabel(p.get("fitBFactor"))),
                    getBool(p, List.of("estimateBeamtilt"), false),
                    getBool(p, List.of("estimateTreFoil"), false),
                    getBool(p, List.of("aberrations"), false),
                    getThreads(p),
                    getMpiProcs(p)
            );
        }

        boolean anyRefinement() {
            return anisotropicMagnification || ctfParameters || beamTilt || fourthOrderAberrations;
        }
    }

    private final Options options;

    public CtfRefineBuilder(JobParameters params, ProjectPaths paths, CompilerProperties props) {
        super(JobType.CTF_REFINE, params, paths, props);
        this.options = Options.from(params);
        log.debug("[{}] Resolved options: {}", type.stageName(), options);
    }

    @Override
    public boolean supportsGpu() {
        return false;
    }

    @Override
    protected ValidationResult doValidate() {
        ValidationResult result = validateFileExists(options.particlesStar(), "Input particles STAR file");
        if (!result.valid()) {
            return result;
        }
        if (!hasText(options.postProcessStar())) {
            return ValidationResult.fail("Post-process STAR file is required for FSC-weighting");
        }
        result = validateFileExists(options.postProcessStar(), "Post-process STAR file");
        if (!result.valid()) {
            return result;
        }
        result = validateMaskedPostProcess();
        if (!result.valid()) {
            return result;
        }
        if (!options.anyRefinement()) {
            return ValidationResult.fail(
                    "At least one refinement mode must be enabled (magnification, defocus, beam tilt, or aberrations)");
        }
        return ValidationResult.ok();
    }

    /**
     * ctf_refine needs the unfiltered half maps and FSC that only a masked PostProcess run records.
     */
    private ValidationResult validateMaskedPostProcess() {
        Path postProcess = resolveInputPath(options.postProcessStar());
        try {
            if (!StarFiles.containsField(postProcess, MASK_FIELD)) {
                return ValidationResult.fail("The PostProcess job was run without a solvent mask. CTF Refinement "
                        + "requires a masked PostProcess run; re-run PostProcess with a solvent mask first.");
            }
            return ValidationResult.ok();
        } catch (IOException e) {
            log.warn("[{}] Could not read post-process STAR file {}: {}", type.stageName(), postProcess, e.getMessage());
            return ValidationResult.fail("Post-process STAR file could not be read to check for a solvent mask: "
                    + options.postProcessStar());
        }
    }

    @Override
    protected JobCommand doBuildCommand(Path outputDir, String jobName) {
        Options o = options;
        String out = outputDirArg(outputDir);

        CommandSpec.Builder cmd = CommandSpec.builder(buildMpiCommand("relion_ctf_refine", o.mpiProcs(), false))
                .arg("--i", relativeInput(o.particlesStar()))
                .arg("--o", out)
                .arg("--f", relativeInput(o.postProcessStar()))
                .arg("--j", o.threads())
                .arg("--pipeline_control", out);

        if (o.anisotropicMagnification()) {
            cmd.flag("--fit_aniso")
                    .arg("--kmin_mag", o.minResolution());
        }
        if (o.ctfParameters()) {
            cmd.flag("--fit_defocus")
                    .arg("--kmin_defocus", o.minResolution())
                    .arg("--fit_mode", o.fitMode());
        }
        if (o.beamTilt()) {
            cmd.flag("--fit_beamtilt")
                    .arg("--kmin_tilt", o.minResolution())
                    .argIf(o.trefoil(), "--odd_aberr_max_n", 3);
        } else if (o.trefoil()) {
            log.warn("[{}] Trefoil estimation ignored without beam tilt estimation", type.stageName());
        }
        cmd.flagIf(o.fourthOrderAberrations(), "--fit_aberr");

        addAdditionalArguments(cmd);
        return cmd.build();
    }
}
