package io.cryojob4j.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandSpecTest {

    @Test
    void builderShouldKeepCallOrderAndFormatNumbers() {
        CommandSpec spec = CommandSpec.builder("relion_refine_mpi")
                .arg("--o", "Class2D/Job004/run")
                .arg("--tau2_fudge", 2.0)
                .flagIf(false, "--skip_align")
                .flagIf(true, "--zero_mask")
                .argIf(true, "--offset_step", 1.5)
                .build();

        assertEquals(List.of("relion_refine_mpi", "--o", "Class2D/Job004/run", "--tau2_fudge", "2",
                "--zero_mask", "--offset_step", "1.5"), spec.tokens());
        assertEquals("relion_refine_mpi", spec.program());
        assertEquals("2", spec.valueOf("--tau2_fudge"));
        assertNull(spec.valueOf("--skip_align"));
    }

    @Test
    void emptyCommandShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new CommandSpec(List.of()));
    }

    @Test
    void singleCommandShouldRenderTokensJoinedBySpace() {
        CommandSpec spec = CommandSpec.of("relion_run_ctffind", "--i", "in.star");
        assertFalse(spec.isChain());
        assertEquals("relion_run_ctffind --i in.star", spec.toShellString());
    }

    @Test
    void andShouldProduceChainRenderedWithLogicalAnd() {
        CommandSpec refine = CommandSpec.of("relion_refine", "--continue", "opt.star");
        CommandSpec flex = CommandSpec.of("relion_flex_analyse", "--k", "3");

        CommandChain chain = refine.and(flex);

        assertTrue(chain.isChain());
        assertEquals(2, chain.size());
        assertEquals(refine, chain.first());
        assertEquals(flex, chain.last());
        assertEquals("relion_refine --continue opt.star && relion_flex_analyse --k 3", chain.toShellString());
    }

    @Test
    void chainingAChainShouldFlattenSteps() {
        CommandChain chain = CommandSpec.of("a").and(CommandSpec.of("b")).and(CommandSpec.of("c").and(CommandSpec.of("d")));
        assertEquals(List.of("a", "b", "c", "d"), chain.steps().stream().map(CommandSpec::program).toList());
    }
}
