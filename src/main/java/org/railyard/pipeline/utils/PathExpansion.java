package org.railyard.pipeline.utils;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands environment-variable references in file system paths.
 * <p>
 * Supports {@code $NAME} and {@code ${NAME}}. References to variables that are not
 * defined are left untouched, so a path never silently collapses to a different location.
 */
public final class PathExpansion {

    private static final Pattern VARIABLE = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}|\\$([A-Za-z_][A-Za-z0-9_]*)");

    private PathExpansion() {
    }

    /**
     * Expands variables in the given path using the process environment.
     *
     * @param path the raw path, may be {@code null}
     * @return the expanded path, or {@code null} if {@code path} was {@code null}
     */
    public static String expandPath(String path) {
        return expandPath(path, System.getenv());
    }

    /**
     * Expands variables in the given path using an explicit variable table.
     *
     * @param path      the raw path, may be {@code null}
     * @param variables variable name to value mapping
     * @return the expanded path, or {@code null} if {@code path} was {@code null}
     */
    public static String expandPath(String path, Map<String, String> variables) {
        if (path == null || path.indexOf('$') < 0) {
            return path;
        }
        Matcher matcher = VARIABLE.matcher(path);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
            String value = variables.get(name);
            String replacement = value != null ? value : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
