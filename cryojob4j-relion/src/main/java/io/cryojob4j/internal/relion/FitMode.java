package io.cryojob4j.internal.relion;

import java.util.Locale;

/**
 * Per-parameter fit mode of {@code relion_ctf_refine --fit_mode}.
 */
enum FitMode {
    OFF('f'),
    PER_MICROGRAPH('m'),
    PER_PARTICLE('p');

    private final char code;

    FitMode(char code) {
        this.code = code;
    }

    char code() {
        return code;
    }

    /**
     * "Per-micrograph" and "Per-particle" (any case); anything else is off.
     */
    static FitMode fromLabel(Object label) {
        if (label == null) {
            return OFF;
        }
        String s = label.toString().toLowerCase(Locale.ROOT);
        if (s.contains("micrograph")) {
            return PER_MICROGRAPH;
        }
        if (s.contains("particle")) {
            return PER_PARTICLE;
        }
        return OFF;
    }

    /**
     * Five characters: phase shift, defocus, astigmatism, an unused slot fixed to 'f', B-factor.
     */
    static String encode(FitMode phaseShift, FitMode defocus, FitMode astigmatism, FitMode bFactor) {
        return new String(new char[]{phaseShift.code, defocus.code, astigmatism.code, OFF.code, bFactor.code});
    }
}
