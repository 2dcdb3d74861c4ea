package io.cryojob4j.internal.relion;

import io.cryojob4j.core.CommandChain;
import io.cryojob4j.core.CommandSpec;
import io.cryojob4j.core.JobCommand;
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

class MultibodyBuilderTest {

    private static final JobParameters BASE = params(
            "refinementStarFile", "Refine3D/Job010/run_it025_optimiser.star",
            "multibodyMasks", "Multibody/bodies.star",
            "submitToQueue", "Yes");

    @TempDir
    Path tmp;

    private TestProject project;

    @BeforeEach
    void setUp() throws IOException {
        project = new TestProject(tmp).touch(
                "Refine3D/Job010/run_it025_optimiser.star",
                "Multibody/bodies.star");
    }

    @Test
    void shouldContinueThePriorRefinement() {
        CommandSpec cmd = (CommandSpec) build(BASE);

        assertThat(cmd.tokens()).containsExactly(
                "relion_refine",
                "--continue", "Refine3D/Job010/run_it025_optimiser.star",
                "--o", "Multibody/Job001/run",
                "--solvent_correct_fsc",
                "--multibody_masks", "Multibody/bodies.star",
                "--reconstruct_subtracted_bodies",
                "--oversampling", "1",
                "--healpix_order", "4",
                "--auto_local_healpix_order", "4",
                "--offset_range", "3",
                "--offset_step", "1.5",
                "--dont_combine_weights_via_disc",
                "--pool", "3",
                "--pad", "2",
                "--j", "1",
                "--pipeline_control", "Multibody/Job001/");
    }

    @Test
    void shouldNeverStartAFreshRefinement() {
        CommandSpec cmd = (CommandSpec) build(with(BASE, "inputStarFile", "Select/Job008/particles.star"));

        assertThat(cmd.contains("--i")).isFalse();
        assertThat(cmd.contains("--auto_refine")).isFalse();
        assertThat(cmd.contains("--split_random_halves")).isFalse();
        assertThat(builder(BASE).executionMode().continuation()).isTrue();
    }

    @Test
    void optionalFlagsShouldBeSwitchable() {
        CommandSpec cmd = (CommandSpec) build(with(BASE,
                "solventCorrectFsc", "No",
                "reconstructSubtractedBodies", "No",
                "combineIterations", "Yes",
                "useBlushRegularisation", "Yes",
                "useParallelIO", "No",
                "initialAngularSampling", "3.7"));

        assertThat(cmd.contains("--solvent_correct_fsc")).isFalse();
        assertThat(cmd.contains("--reconstruct_subtracted_bodies")).isFalse();
        assertThat(cmd.contains("--dont_combine_weights_via_disc")).isFalse();
        assertThat(cmd.contains("--blush")).isTrue();
        assertThat(cmd.contains("--no_parallel_disc_io")).isTrue();
        assertThat(cmd.valueOf("--healpix_order")).isEqualTo("3");
    }

    @Test
    void gpuShouldFollowAcceleration() {
        CommandSpec on = (CommandSpec) build(with(BASE, "gpuAcceleration", "Yes", "useGPU", "0,1"));
        CommandSpec off = (CommandSpec) build(with(BASE, "gpuAcceleration", "No", "useGPU", "0,1"));

        assertThat(on.valueOf("--gpu")).isEqualTo("0,1");
        assertThat(off.contains("--gpu")).isFalse();
    }

    @Test
    void mpiShouldUseTheMpiBinary() {
        assertThat(((CommandSpec) build(with(BASE, "mpiProcs", 5))).program()).isEqualTo("relion_refine_mpi");
    }

    @Test
    void flexibilityAnalysisShouldBeChained() {
        JobCommand command = build(with(BASE, "runFlexibility", "Yes", "additionalArguments", "--maxsig 200"));

        assertThat(command.isChain()).isTrue();
        CommandChain chain = (CommandChain) command;
        assertThat(chain.size()).isEqualTo(2);
        assertThat(chain.first().program()).isEqualTo("relion_refine");
        assertThat(chain.first().tokens()).endsWith("--maxsig", "200");
        assertThat(chain.last().tokens()).containsExactly(
                "relion_flex_analyse",
                "--PCA_orient",
                "--model", "Multibody/Job001/run_model.star",
                "--data", "Multibody/Job001/run_data.star",
                "--bodies", "Multibody/bodies.star",
                "--o", "Multibody/Job001/analyse",
                "--do_maps",
                "--k", "3",
                "--pipeline_control", "Multibody/Job001/");
        assertThat(command.toShellString()).contains(" && relion_flex_analyse --PCA_orient");
    }

    @Test
    void eigenvalueSelectionShouldWriteProjections() {
        CommandChain chain = (CommandChain) build(with(BASE,
                "runFlexibility", "Yes",
                "numberOfEigenvectorMovies", 2,
                "selectParticlesEigenValue", "Yes",
                "eigenValue", 1,
                "minEigenValue", -15,
                "maxEigenValue", 10.5));

        CommandSpec flex = chain.last();
        assertThat(flex.valueOf("--k")).isEqualTo("2");
        assertThat(flex.contains("--write_pca_projections")).isTrue();
        assertThat(flex.valueOf("--select_eigenvalue")).isEqualTo("1");
        assertThat(flex.valueOf("--select_eigenvalue_min")).isEqualTo("-15");
        assertThat(flex.valueOf("--select_eigenvalue_max")).isEqualTo("10.5");
    }

    @Test
    void withoutFlexibilityTheResultShouldBeASingleCommand() {
        assertThat(build(BASE).isChain()).isFalse();
        assertThat(build(BASE).steps()).hasSize(1);
    }

    @Test
    void missingRefinementShouldFail() {
        ValidationResult result = builder(params("multibodyMasks", "Multibody/bodies.star")).validate();

        assertThat(result.valid()).isFalse();
        assertThat(result.error()).containsIgnoringCase("refinement");
    }

    @Test
    void missingBodyMasksShouldFail() {
        ValidationResult result = builder(params("refinementStarFile", "Refine3D/Job010/run_it025_optimiser.star")).validate();

        assertThat(result.valid()).isFalse();
        assertThat(result.error()).containsIgnoringCase("mask");
    }

    @Test
    void absentBodyMaskFileShouldFail() {
        ValidationResult result = builder(with(BASE, "multibodyMasks", "Multibody/other_bodies.star")).validate();

        assertThat(result.error()).isEqualTo("Body mask STAR file not found: Multibody/other_bodies.star");
    }

    private MultibodyBuilder builder(JobParameters p) {
        return new MultibodyBuilder(p, project.paths(), project.props());
    }

    private JobCommand build(JobParameters p) {
        return project.build(builder(p));
    }
}
