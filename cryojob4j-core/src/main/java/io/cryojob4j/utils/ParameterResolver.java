package io.cryojob4j.utils;

import io.cryojob4j.core.JobParameters;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Alias-tolerant typed accessors over a {@link JobParameters} bag.
 *
 * <p>Aliases are tried in order; the first key whose value is non-null and not the empty string
 * wins. Numeric accessors never throw: input that does not start with a number yields the
 * supplied default.
 */
public final class ParameterResolver {

    private static final Pattern LEADING_INT = Pattern.compile("^\\s*([+-]?\\d+)");
    private static final Pattern LEADING_DECIMAL =
            Pattern.compile("^\\s*([+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?)");
    private static final Pattern GPU_ID_LIST = Pattern.compile("^[\\d,]+$");

    private static final List<String> MPI_PROCS = List.of("mpiProcs", "runningmpi", "numberOfMpiProcs");
    private static final List<String> THREADS = List.of("numberOfThreads", "threads");
    private static final List<String> GPU_TOGGLE = List.of("gpuAcceleration", "GpuAcceleration");
    private static final List<String> GPU_DEVICES = List.of("gpuToUse", "useGPU");
    private static final List<String> GPU_IDS = List.of("gpuToUse", "useGPU", "gpu");
    private static final List<String> POOLED = List.of("pooledParticles", "numberOfPooledParticle");
    private static final List<String> ITERATIONS = List.of("numberOfIterations", "numberEMIterations");
    private static final List<String> SCRATCH = List.of("copyParticlesToScratch", "copyParticles", "copyParticle");
    private static final List<String> SUBMIT_TO_QUEUE = List.of("submitToQueue", "SubmitToQueue");
    private static final List<String> ADDITIONAL_ARGUMENTS = List.of("additionalArguments", "arguments");

    private ParameterResolver() {
    }

    /**
     * First present value among {@code aliases}.
     */
    public static Optional<Object> find(JobParameters params, List<String> aliases) {
        for (String alias : aliases) {
            Object value = params.get(alias);
            if (isPresent(value)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    public static Object get(JobParameters params, List<String> aliases, Object defaultValue) {
        return find(params, aliases).orElse(defaultValue);
    }

    /**
     * String form of the first present value; numbers are rendered via {@link FlagValues#format(Number)}.
     */
    public static String getString(JobParameters params, List<String> aliases, String defaultValue) {
        return find(params, aliases).map(ParameterResolver::asString).orElse(defaultValue);
    }

    /**
     * Yes/true (any case) and non-zero numbers are true; other strings are false.
     */
    public static boolean getBool(JobParameters params, List<String> aliases, boolean defaultValue) {
        return find(params, aliases).map(ParameterResolver::truthy).orElse(defaultValue);
    }

    public static int getInt(JobParameters params, List<String> aliases, int defaultValue) {
        return find(params, aliases).map(v -> parseInt(v, defaultValue)).orElse(defaultValue);
    }

    public static double getFloat(JobParameters params, List<String> aliases, double defaultValue) {
        return find(params, aliases).map(v -> parseFloat(v, defaultValue)).orElse(defaultValue);
    }

    public static int getMpiProcs(JobParameters params) {
        return Math.max(1, getInt(params, MPI_PROCS, 1));
    }

    public static int getThreads(JobParameters params) {
        return Math.max(1, getInt(params, THREADS, 1));
    }

    /**
     * Explicit acceleration toggle first, then a device list such as {@code "0,1"} or {@code "Yes"}.
     */
    public static boolean isGpuEnabled(JobParameters params) {
        Optional<Object> toggle = find(params, GPU_TOGGLE);
        if (toggle.isPresent()) {
            Object v = toggle.get();
            if (v instanceof Boolean b) {
                return b;
            }
            if (v instanceof String s) {
                return isYes(s);
            }
        }
        Optional<Object> devices = find(params, GPU_DEVICES);
        if (devices.isPresent()) {
            String s = asString(devices.get());
            if ("No".equals(s)) {
                return false;
            }
            return GPU_ID_LIST.matcher(s).matches() || "yes".equalsIgnoreCase(s);
        }
        return false;
    }

    /**
     * Device ids for {@code --gpu}, whitespace removed. Yes/No answers map to device 0.
     */
    public static String getGpuIds(JobParameters params) {
        String ids = getString(params, GPU_IDS, "0");
        if ("Yes".equals(ids) || "No".equals(ids)) {
            ids = "0";
        }
        return ids.replaceAll("\\s", "");
    }

    public static String getInputStarFile(JobParameters params) {
        return getString(params, List.of("inputStarFile"), null);
    }

    public static String getContinueFrom(JobParameters params) {
        return getString(params, List.of("continueFrom"), null);
    }

    public static int getMaskDiameter(JobParameters params) {
        return getInt(params, List.of("maskDiameter"), 200);
    }

    public static int getNumberOfClasses(JobParameters params) {
        return getInt(params, List.of("numberOfClasses"), 1);
    }

    public static int getIterations(JobParameters params, int defaultValue) {
        return getInt(params, ITERATIONS, defaultValue);
    }

    public static int getPooledParticles(JobParameters params) {
        return Math.max(1, getInt(params, POOLED, 3));
    }

    public static String getSymmetry(JobParameters params) {
        return getString(params, List.of("symmetry", "Symmetry"), "C1");
    }

    public static String getReference(JobParameters params) {
        return getString(params, List.of("referenceMap", "reference"), null);
    }

    public static String getScratchDir(JobParameters params) {
        return getString(params, SCRATCH, null);
    }

    public static boolean isSubmitToQueue(JobParameters params, boolean defaultValue) {
        return getBool(params, SUBMIT_TO_QUEUE, defaultValue);
    }

    public static String getAdditionalArguments(JobParameters params) {
        return getString(params, ADDITIONAL_ARGUMENTS, null);
    }

    static boolean isPresent(Object value) {
        return value != null && !(value instanceof String s && s.isEmpty());
    }

    private static String asString(Object value) {
        return value instanceof Number n ? FlagValues.format(n) : value.toString();
    }

    private static boolean truthy(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return isYes(s);
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0;
        }
        return true;
    }

    private static boolean isYes(String s) {
        String v = s.toLowerCase(Locale.ROOT);
        return v.equals("yes") || v.equals("true");
    }

    private static int parseInt(Object value, int defaultValue) {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d) || d > Integer.MAX_VALUE || d < Integer.MIN_VALUE) {
                return defaultValue;
            }
            return (int) d;
        }
        if (!(value instanceof String s)) {
            return defaultValue;
        }
        Matcher m = LEADING_INT.matcher(s);
        if (!m.find()) {
            return defaultValue;
        }
        String digits = m.group(1);
        if (digits.length() > 11) {
            return defaultValue;
        }
        long parsed = Long.parseLong(digits.startsWith("+") ? digits.substring(1) : digits);
        if (parsed > Integer.MAX_VALUE || parsed < Integer.MIN_VALUE) {
            return defaultValue;
        }
        return (int) parsed;
    }

    private static double parseFloat(Object value, double defaultValue) {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return Double.isNaN(d) ? defaultValue : d;
        }
        if (!(value instanceof String s)) {
            return defaultValue;
        }
        Matcher m = LEADING_DECIMAL.matcher(s);
        if (!m.find()) {
            return defaultValue;
        }
        return Double.parseDouble(m.group(1));
    }
}
