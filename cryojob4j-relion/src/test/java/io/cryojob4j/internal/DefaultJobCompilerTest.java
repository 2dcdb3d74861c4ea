package io.cryojob4j.internal;

import io.cryojob4j.JobCommandBuilder;
import io.cryojob4j.JobCompiler;
import io.cryojob4j.config.CompilerProperties;
import io.cryojob4j.core.CommandSpec;
import io.cryojob4j.core.CompilationResult;
import io.cryojob4j.core.CompileRequest;
import io.cryojob4j.core.JobParameters;
import io.cryojob4j.core.JobType;
import io.cryojob4j.core.JobTypeRegistry;
import io.cryojob4j.core.ProjectPaths;
import io.cryojob4j.core.ValidationResult;
import io.cryojob4j.internal.relion.Class2dBuilder;
import io.cryojob4j.internal.relion.RelionBuilderFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static io.cryojob4j.internal.TestProject.params;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class DefaultJobCompilerTest {

    private static final JobParameters CLASS_2D = params(
            "inputStarFile", "Extract/Job005/particles.star",
            "numberOfClasses", 50,
            "submitToQueue", "Yes");

    @TempDir
    Path tmp;

    private TestProject project;
    private CompilerProperties props;
    private JobCompiler compiler;

    @BeforeEach
    void setUp() throws IOException {
        project = new TestProject(tmp.resolve("Apoferritin_2024")).touch("Extract/Job005/particles.star");
        props = project.props();
        props.setProjectsRoot(tmp.toString());
        compiler = new DefaultJobCompiler(new JobTypeRegistry(), new RelionBuilderFactory(props), props);
    }

    @Test
    void shouldCompileByAliasIntoTheStageDirectory() {
        CompilationResult result = compiler.compile(request("class2d").projectRoot(project.root()).build());

        assertThat(result.isCompiled()).isTrue();
        assertThat(result.jobType()).isEqualTo(JobType.CLASS_2D);
        assertThat(result.outputDir()).isEqualTo(project.root().resolve("Class2D").resolve("Job004"));
        assertThat(result.inputJobIds()).containsExactly("Job005");
        assertThat(result.executionMode().usesMpi()).isFalse();
        assertThat(((CommandSpec) result.command()).valueOf("--o")).isEqualTo("Class2D/Job004/");
        assertThat(result.toShellString()).startsWith("relion_refine --o Class2D/Job004/ --i Extract/Job005/particles.star");
    }

    @Test
    void shouldNotCreateTheOutputDirectory() {
        compiler.compile(request("class_2d").projectRoot(project.root()).build());

        assertThat(Files.exists(project.root().resolve("Class2D"))).isFalse();
    }

    @Test
    void shouldLocateTheProjectByName() {
        CompilationResult result = compiler.compile(request("class_2d").projectName("Apoferritin 2024").build());

        assertThat(result.isCompiled()).isTrue();
        assertThat(result.outputDir()).isEqualTo(project.root().resolve("Class2D").resolve("Job004"));
    }

    @Test
    void explicitOutputDirShouldResolveAgainstTheProject() {
        CompilationResult result = compiler.compile(request("class_2d")
                .projectRoot(project.root())
                .outputDir(Path.of("Class2D/Job004_rerun"))
                .build());

        assertThat(result.outputDir()).isEqualTo(project.root().resolve("Class2D/Job004_rerun"));
        assertThat(((CommandSpec) result.command()).valueOf("--o")).isEqualTo("Class2D/Job004_rerun/");
    }

    @Test
    void unknownJobTypeShouldBeRejected() {
        RelionBuilderFactory factory = mock(RelionBuilderFactory.class);
        JobCompiler withMock = new DefaultJobCompiler(new JobTypeRegistry(), factory, props);

        CompilationResult result = withMock.compile(request("tomography").projectRoot(project.root()).build());

        assertThat(result.isCompiled()).isFalse();
        assertThat(result.jobType()).isNull();
        assertThat(result.error()).isEqualTo("Unknown job type: tomography");
        verifyNoInteractions(factory);
    }

    @Test
    void failedValidationShouldBeRejectedWithoutBuilding() {
        RelionBuilderFactory factory = mock(RelionBuilderFactory.class);
        JobCommandBuilder builder = mock(JobCommandBuilder.class);
        when(factory.create(eq(JobType.CTF_REFINE), any(), any())).thenReturn(builder);
        when(builder.validate()).thenReturn(ValidationResult.fail("Input particles STAR file is required"));
        JobCompiler withMock = new DefaultJobCompiler(new JobTypeRegistry(), factory, props);

        CompilationResult result = withMock.compile(request("ctfrefine").projectRoot(project.root()).build());

        assertThat(result.isCompiled()).isFalse();
        assertThat(result.jobType()).isEqualTo(JobType.CTF_REFINE);
        assertThat(result.error()).isEqualTo("Input particles STAR file is required");
        assertThat(result.command()).isNull();
        verify(builder, never()).buildCommand(any(), any());
        assertThatThrownBy(result::toShellString)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Input particles STAR file is required");
    }

    @Test
    void builderForShouldReturnAnUnvalidatedBuilder() {
        JobCommandBuilder builder = compiler.builderFor("CLASS2D", CLASS_2D, ProjectPaths.rootedAt(project.root()));

        assertThat(builder).isInstanceOf(Class2dBuilder.class);
        assertThatThrownBy(() -> builder.buildCommand(project.outputDir("Class2D"), "Job004"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void builderForShouldRejectUnknownTypes() {
        assertThatThrownBy(() -> compiler.builderFor("tomography", CLASS_2D, ProjectPaths.rootedAt(project.root())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("No job type registered for alias: tomography");
    }

    @Test
    void everyJobTypeShouldHaveABuilder() {
        RelionBuilderFactory factory = new RelionBuilderFactory(props);
        ProjectPaths paths = ProjectPaths.rootedAt(project.root());

        for (JobType type : JobType.values()) {
            assertThat(factory.create(type, JobParameters.empty(), paths).type()).isEqualTo(type);
        }
    }

    private static CompileRequest.Builder request(String jobType) {
        return CompileRequest.builder()
                .jobType(jobType)
                .jobName("Job004")
                .parameters(CLASS_2D);
    }
}
