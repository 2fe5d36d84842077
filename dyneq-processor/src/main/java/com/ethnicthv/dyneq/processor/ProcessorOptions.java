package com.ethnicthv.dyneq.processor;

import java.util.Locale;
import java.util.Map;

/**
 * Options passed with {@code -A<key>=<value>}. Invalid values are reported and replaced by
 * the default.
 *
 * @param verbose       {@code dyneq.verbose}: emit progress notes
 * @param boxes         {@code dyneq.boxes}: allow owning box generation at all
 * @param hashCodeCheck {@code dyneq.hashCodeCheck}: how to report {@code equals} without {@code hashCode}
 */
public record ProcessorOptions(boolean verbose, boolean boxes, HashCodeCheck hashCodeCheck) {

    public static final String VERBOSE = "dyneq.verbose";
    public static final String BOXES = "dyneq.boxes";
    public static final String HASH_CODE_CHECK = "dyneq.hashCodeCheck";

    public static final ProcessorOptions DEFAULTS = new ProcessorOptions(false, true, HashCodeCheck.WARN);

    public enum HashCodeCheck { OFF, WARN, ERROR }

    @FunctionalInterface
    public interface Reporter {
        void report(String fmt, Object... args);
    }

    public static ProcessorOptions parse(Map<String, String> raw, Reporter reporter) {
        boolean verbose = parseBoolean(raw, VERBOSE, DEFAULTS.verbose, reporter);
        boolean boxes = parseBoolean(raw, BOXES, DEFAULTS.boxes, reporter);
        HashCodeCheck check = DEFAULTS.hashCodeCheck;
        if (raw.containsKey(HASH_CODE_CHECK)) {
            String v = raw.get(HASH_CODE_CHECK);
            try {
                check = HashCodeCheck.valueOf(String.valueOf(v).trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                reporter.report("Invalid value '%s' for option %s (expected off|warn|error), using %s",
                        v, HASH_CODE_CHECK, check.name().toLowerCase(Locale.ROOT));
            }
        }
        return new ProcessorOptions(verbose, boxes, check);
    }

    private static boolean parseBoolean(Map<String, String> raw, String key, boolean def, Reporter reporter) {
        if (!raw.containsKey(key)) return def;
        String v = raw.get(key);
        // -Akey alone arrives with a null value and means true
        if (v == null || v.isBlank() || v.equalsIgnoreCase("true")) return true;
        if (v.equalsIgnoreCase("false")) return false;
        reporter.report("Invalid value '%s' for option %s (expected true|false), using %s", v, key, def);
        return def;
    }
}
