package io.cryojob4j.internal.relion;

import io.cryojob4j.core.JobParameters;
import io.cryojob4j.utils.ParameterResolver;

import java.util.List;

/**
 * Maps an angular sampling in degrees to RELION's discrete healpix order.
 *
 * <p>30, 15, 7.5, 3.7, 1.8, 0.9, 0.5, 0.2 and 0.1 degrees are orders 0 to 8. Other values take the
 * first rung, coarse to fine, whose step does not exceed the request.
 */
final class HealpixOrder {

    private static final double[] LADDER = {30, 15, 7.5, 3.7, 1.8, 0.9, 0.5, 0.2, 0.1};

    static final int DEFAULT_ORDER = 2;

    private HealpixOrder() {
    }

    static int fromDegrees(double degrees) {
        if (Double.isNaN(degrees) || degrees <= 0) {
            return DEFAULT_ORDER;
        }
        for (int order = 0; order < LADDER.length; order++) {
            if (LADDER[order] <= degrees) {
                return order;
            }
        }
        return LADDER.length - 1;
    }

    /**
     * Reads values such as {@code "1.8 degrees"} or {@code 7.5}; unreadable input uses {@code defaultDegrees}.
     */
    static int resolve(JobParameters params, List<String> aliases, double defaultDegrees) {
        return fromDegrees(ParameterResolver.getFloat(params, aliases, defaultDegrees));
    }

    static double degrees(int order) {
        return LADDER[order];
    }
}
