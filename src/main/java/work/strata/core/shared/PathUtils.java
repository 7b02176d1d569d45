package work.strata.core.shared;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Slash-separated path helpers for in-container paths; independent of the host filesystem.
 */
public final class PathUtils {
    private PathUtils() {}

    /**
     * Collapses {@code .}, {@code ..} and repeated slashes. The result never starts or ends with a
     * slash; the root is the empty string. {@code ..} never climbs above the root.
     */
    public static String normalize(String path) {
        if (path == null || path.isEmpty()) {
            return "";
        }
        Deque<String> parts = new ArrayDeque<>();
        for (String part : path.split("/")) {
            if (part.isEmpty() || part.equals(".")) {
                continue;
            }
            if (part.equals("..")) {
                parts.pollLast();
                continue;
            }
            parts.addLast(part);
        }
        return String.join("/", parts);
    }

    /**
     * Joins {@code child} under {@code parent}; an absolute {@code child} still stays under
     * {@code parent}.
     */
    public static String join(String parent, String child) {
        String base = normalize(parent);
        String rest = normalize(child);
        if (base.isEmpty()) {
            return rest;
        }
        return rest.isEmpty() ? base : base + "/" + rest;
    }

    /**
     * Resolves {@code path} against {@code cwd} when it is relative.
     */
    public static String resolve(String cwd, String path) {
        if (path != null && path.startsWith("/")) {
            return normalize(path);
        }
        return join(cwd, path);
    }

    /**
     * Path of {@code path} relative to {@code prefix}, or {@code null} when it is not beneath it.
     */
    public static String relativize(String prefix, String path) {
        String base = normalize(prefix);
        String target = normalize(path);
        if (base.isEmpty()) {
            return target;
        }
        if (target.equals(base)) {
            return "";
        }
        return target.startsWith(base + "/") ? target.substring(base.length() + 1) : null;
    }
}
