package io.cryojob4j.internal.relion;

import io.cryojob4j.core.CommandSpec;
import io.cryojob4j.core.JobParameters;
import io.cryojob4j.core.ValidationResult;
import io.cryojob4j.internal.TestProject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static io.cryojob4j.internal.TestProject.params;
import static io.cryojob4j.internal.TestProject.with;
import static org.assertj.core.api.Assertions.assertThat;

class CtfRefineBuilderTest {

    private static final String MASKED_POSTPROCESS = """
            data_general
            _rlnFinalResolution 3.12
            _rlnMaskName MaskCreate/Job009/mask.mrc
            _rlnRandomiseFrom 7.9
            """;

    private static final String UNMASKED_POSTPROCESS = """
            data_general
            _rlnFinalResolution 3.80
            _rlnRandomiseFrom 7.9
            """;

    private static final JobParameters BASE = params(
            "particlesStar", "Refine3D/Job010/run_data.star",
            "postProcessStar", "PostProcess/Job011/postprocess.star",
            "ctfParameter", "Yes",
            "submitToQueue", "Yes");

    @TempDir
    Path tmp;

    private TestProject project;

    @BeforeEach
    void setUp() throws IOException {
        project = new TestProject(tmp)
                .touch("Refine3D/Job010/run_data.star")
                .file("PostProcess/Job011/postprocess.star", MASKED_POSTPROCESS)
                .file("PostProcess/Job012/postprocess.star", UNMASKED_POSTPROCESS);
    }

    @Test
    void shouldBuildDefocusRefinement() {
        CommandSpec cmd = build(with(BASE, "numberOfThreads", 6));

        assertThat(cmd.tokens()).containsExactly(
                "relion_ctf_refine",
                "--i", "Refine3D/Job010/run_data.star",
                "--o", "CtfRefine/Job001/",
                "--f", "PostProcess/Job011/postprocess.star",
                "--j", "6",
                "--pipeline_control", "CtfRefine/Job001/",
                "--fit_defocus",
                "--kmin_defocus", "30",
                "--fit_mode", "fffff");
    }

    @Test
    void fitModeShouldEncodeEachSelection() {
        CommandSpec cmd = build(with(BASE,
                "fitDefocus", "Per-particle",
                "fitAstigmatism", "Per-micrograph",
                "fitBFactor", "Per-particle",
                "fitPhaseShift", "No"));

        assertThat(cmd.valueOf("--fit_mode")).isEqualTo("fpmfp");
    }

    @Test
    void magnificationAndAberrationsShouldHaveTheirOwnFlags() {
        CommandSpec cmd = build(with(BASE,
                "ctfParameter", "No",
                "estimateMagnification", "Yes",
                "aberrations", "Yes",
                "minResolutionFits", 25));

        assertThat(cmd.contains("--fit_defocus")).isFalse();
        assertThat(cmd.contains("--fit_aniso")).isTrue();
        assertThat(cmd.valueOf("--kmin_mag")).isEqualTo("25");
        assertThat(cmd.contains("--fit_aberr")).isTrue();
    }

    @Test
    void trefoilShouldFollowBeamTilt() {
        CommandSpec cmd = build(with(BASE, "estimateBeamtilt", "Yes", "estimateTreFoil", "Yes"));

        assertThat(cmd.contains("--fit_beamtilt")).isTrue();
        assertThat(cmd.valueOf("--kmin_tilt")).isEqualTo("30");
        assertThat(cmd.valueOf("--odd_aberr_max_n")).isEqualTo("3");
    }

    @Test
    void trefoilWithoutBeamTiltShouldBeIgnored() {
        CommandSpec cmd = build(with(BASE, "estimateTreFoil", "Yes"));

        assertThat(cmd.contains("--fit_beamtilt")).isFalse();
        assertThat(cmd.contains("--odd_aberr_max_n")).isFalse();
    }

    @Test
    void gpuRequestShouldNeverReachTheCommand() {
        CtfRefineBuilder builder = builder(with(BASE, "gpuAcceleration", "Yes", "gpuToUse", "0"));

        assertThat(builder.supportsGpu()).isFalse();
        assertThat(builder.executionMode().usesGpu()).isFalse();
        assertThat(((CommandSpec) project.build(builder)).contains("--gpu")).isFalse();
    }

    @Test
    void mpiShouldUseTheMpiBinary() {
        assertThat(build(with(BASE, "mpiProcs", 4)).program()).isEqualTo("relion_ctf_refine_mpi");
    }

    @Test
    void unmaskedPostProcessShouldFail() {
        ValidationResult result = builder(with(BASE, "postProcessStar", "PostProcess/Job012/postprocess.star")).validate();

        assertThat(result.valid()).isFalse();
        assertThat(result.error()).contains("solvent mask");
    }

    @Test
    void noRefinementModeShouldFail() {
        ValidationResult result = builder(with(BASE, "ctfParameter", "No")).validate();

        assertThat(result.valid()).isFalse();
        assertThat(result.error()).startsWith("At least one refinement mode must be enabled");
    }

    @Test
    void missingPostProcessShouldFail() {
        ValidationResult result = builder(params(
                "particlesStar", "Refine3D/Job010/run_data.star",
                "ctfParameter", "Yes")).validate();

        assertThat(result.error()).isEqualTo("Post-process STAR file is required for FSC-weighting");
    }

    @Test
    void absentPostProcessShouldFail() {
        ValidationResult result = builder(with(BASE, "postProcessStar", "PostProcess/Job020/postprocess.star")).validate();

        assertThat(result.error()).isEqualTo("Post-process STAR file not found: PostProcess/Job020/postprocess.star");
    }

    @Test
    void missingParticlesShouldFail() {
        ValidationResult result = builder(params("postProcessStar", "PostProcess/Job011/postprocess.star")).validate();

        assertThat(result.error()).isEqualTo("Input particles STAR file is required");
    }

    private CtfRefineBuilder builder(JobParameters p) {
        return new CtfRefineBuilder(p, project.paths(), project.props());
    }

    private CommandSpec build(JobParameters p) {
        return (CommandSpec) project.build(builder(p));
    }
}
