package io.cryojob4j.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobTypeRegistryTest {

    private final JobTypeRegistry registry = new JobTypeRegistry();

    @Test
    void canonicalNamesAndAliasesShouldResolveToTheSameType() {
        assertEquals(JobType.CLASS_2D, registry.getRequired("class_2d"));
        assertEquals(JobType.CLASS_2D, registry.getRequired("class2d"));
        assertEquals(JobType.CLASS_2D, registry.getRequired("classification_2d"));
        assertEquals(JobType.AUTO_REFINE, registry.getRequired("refine3d"));
        assertEquals(JobType.MULTIBODY, registry.getRequired("multi_body"));
        assertEquals(JobType.MOTION_CORRECTION, registry.getRequired("motioncorr"));
    }

    @Test
    void lookupShouldIgnoreCaseAndWhitespace() {
        assertEquals(JobType.CTF_ESTIMATION, registry.getRequired("  CTF "));
    }

    @Test
    void unknownAliasShouldThrowFromGetRequired() {
        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> registry.getRequired("polish"));
        assertTrue(ex.getMessage().contains("polish"));
        assertFalse(registry.find("polish").isPresent());
        assertFalse(registry.find(null).isPresent());
    }

    @Test
    void everyTypeShouldBeReachableByCanonicalName() {
        for (JobType type : JobType.values()) {
            assertEquals(type, registry.getRequired(type.canonicalName()));
        }
        assertEquals(15, registry.allAliases().size());
    }

    @Test
    void stageNamesShouldMatchProjectLayout() {
        assertEquals("MotionCorr", JobType.MOTION_CORRECTION.stageName());
        assertEquals("CtfFind", JobType.CTF_ESTIMATION.stageName());
        assertEquals("Multibody", registry.stageNames().get(JobType.MULTIBODY));
        assertEquals(ComputeTier.MPI, JobType.CTF_REFINE.computeTier());
        assertEquals(ComputeTier.GPU, JobType.DYNAMIGHT.computeTier());
    }
}
