package io.cryojob4j.internal.relion;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static io.cryojob4j.internal.TestProject.params;
import static org.assertj.core.api.Assertions.assertThat;

class HealpixOrderTest {

    @ParameterizedTest
    @CsvSource({
            "30, 0",
            "15, 1",
            "7.5, 2",
            "3.7, 3",
            "1.8, 4",
            "0.9, 5",
            "0.5, 6",
            "0.2, 7",
            "0.1, 8"
    })
    void ladderRungsShouldMapExactly(double degrees, int order) {
        assertThat(HealpixOrder.fromDegrees(degrees)).isEqualTo(order);
        assertThat(HealpixOrder.degrees(order)).isEqualTo(degrees);
    }

    @ParameterizedTest
    @CsvSource({
            "45, 0",
            "20, 1",
            "10, 2",
            "2, 4",
            "0.05, 8"
    })
    void valuesBetweenRungsShouldTakeTheCoarserRung(double degrees, int order) {
        assertThat(HealpixOrder.fromDegrees(degrees)).isEqualTo(order);
    }

    @Test
    void unusableValuesShouldFallBackToTheDefault() {
        assertThat(HealpixOrder.fromDegrees(0)).isEqualTo(HealpixOrder.DEFAULT_ORDER);
        assertThat(HealpixOrder.fromDegrees(-7.5)).isEqualTo(HealpixOrder.DEFAULT_ORDER);
        assertThat(HealpixOrder.fromDegrees(Double.NaN)).isEqualTo(HealpixOrder.DEFAULT_ORDER);
    }

    @Test
    void resolveShouldReadDropdownLabels() {
        List<String> aliases = List.of("initialAngularSampling");

        assertThat(HealpixOrder.resolve(params("initialAngularSampling", "1.8 degrees"), aliases, 7.5)).isEqualTo(4);
        assertThat(HealpixOrder.resolve(params("initialAngularSampling", "fine"), aliases, 7.5)).isEqualTo(2);
        assertThat(HealpixOrder.resolve(params(), aliases, 1.8)).isEqualTo(4);
    }
}
