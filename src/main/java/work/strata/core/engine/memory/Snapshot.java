package work.strata.core.engine.memory;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import work.strata.core.shared.PathUtils;

/**
 * Immutable evaluated filesystem: normalized relative path to file content. Directories exist
 * implicitly through the files beneath them.
 */
public final class Snapshot {
    public static final Snapshot EMPTY = new Snapshot(new TreeMap<>());

    private final SortedMap<String, byte[]> files;

    private Snapshot(SortedMap<String, byte[]> files) {
        this.files = Collections.unmodifiableSortedMap(files);
    }

    public static Snapshot of(Map<String, byte[]> files) {
        var copy = new TreeMap<String, byte[]>();
        files.forEach((path, content) -> copy.put(PathUtils.normalize(path), content.clone()));
        return new Snapshot(copy);
    }

    public static Snapshot ofText(Map<String, String> files) {
        var copy = new TreeMap<String, byte[]>();
        files.forEach((path, content) -> copy.put(PathUtils.normalize(path), content.getBytes(StandardCharsets.UTF_8)));
        return new Snapshot(copy);
    }

    public Optional<byte[]> read(String path) {
        byte[] content = files.get(PathUtils.normalize(path));
        return content == null ? Optional.empty() : Optional.of(content.clone());
    }

    public boolean exists(String path) {
        String normalized = PathUtils.normalize(path);
        if (normalized.isEmpty() || files.containsKey(normalized)) {
            return true;
        }
        String prefix = normalized + "/";
        var tail = files.tailMap(prefix);
        return !tail.isEmpty() && tail.firstKey().startsWith(prefix);
    }

    public Snapshot with(String path, byte[] content) {
        var copy = new TreeMap<>(files);
        copy.put(PathUtils.normalize(path), content.clone());
        return new Snapshot(copy);
    }

    /**
     * Files beneath {@code prefix}, re-rooted at it.
     */
    public Snapshot subtree(String prefix) {
        var result = new TreeMap<String, byte[]>();
        files.forEach((path, content) -> {
            String relative = PathUtils.relativize(prefix, path);
            if (relative != null && !relative.isEmpty()) {
                result.put(relative, content);
            }
        });
        return new Snapshot(result);
    }

    /**
     * Replaces everything beneath {@code prefix} with {@code content}.
     */
    public Snapshot graft(String prefix, Snapshot content) {
        var result = new TreeMap<String, byte[]>();
        files.forEach((path, bytes) -> {
            String relative = PathUtils.relativize(prefix, path);
            if (relative == null) {
                result.put(path, bytes);
            }
        });
        content.files.forEach((path, bytes) -> result.put(PathUtils.join(prefix, path), bytes));
        return new Snapshot(result);
    }

    public Set<String> paths() {
        return files.keySet();
    }

    public int size() {
        return files.size();
    }

    SortedMap<String, byte[]> files() {
        return files;
    }

    @Override
    public String toString() {
        return "Snapshot" + files.keySet();
    }
}
