package me.golemcore.tokens.domain.model;

import java.util.regex.Pattern;

/**
 * Display names for model ids.
 */
public final class ModelNames {

    private static final String VENDOR_PREFIX = "claude-";
    private static final Pattern DATE_SUFFIX = Pattern.compile("(?<=.)-\\d{8}$");

    private ModelNames() {
    }

    /**
     * Strips the {@code claude-} prefix and a trailing {@code -YYYYMMDD} date,
     * e.g. {@code claude-sonnet-4-5-20250929} becomes {@code sonnet-4-5}.
     */
    public static String shortName(String model) {
        if (model == null) {
            return "";
        }
        String name = model.startsWith(VENDOR_PREFIX) ? model.substring(VENDOR_PREFIX.length()) : model;
        return DATE_SUFFIX.matcher(name).replaceFirst("");
    }
}
