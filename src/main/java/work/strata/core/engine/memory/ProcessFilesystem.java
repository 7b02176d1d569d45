package work.strata.core.engine.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import work.strata.core.shared.PathUtils;

/**
 * The filesystem a simulated process sees: the root filesystem with every mount laid over its
 * target. Paths are absolute. A path belongs to the mount with the longest matching target; when
 * several mounts share a target, the one declared last wins.
 */
final class ProcessFilesystem {
    private final Layer root;
    private final List<Layer> mounts = new ArrayList<>();

    ProcessFilesystem(Snapshot rootfs) {
        this.root = new Layer("", rootfs, "");
    }

    void mount(String target, Snapshot source, String sourcePath) {
        mounts.add(new Layer(PathUtils.normalize(target), source, PathUtils.normalize(sourcePath)));
    }

    Optional<byte[]> read(String path) {
        var route = route(path);
        byte[] content = route.layer().view.get(route.relative());
        return content == null ? Optional.empty() : Optional.of(content.clone());
    }

    boolean exists(String path) {
        var route = route(path);
        if (route.relative().isEmpty() || route.layer().view.containsKey(route.relative())) {
            return true;
        }
        String prefix = route.relative() + "/";
        var tail = route.layer().view.tailMap(prefix);
        return !tail.isEmpty() && tail.firstKey().startsWith(prefix);
    }

    void write(String path, byte[] content) {
        var route = route(path);
        if (route.relative().isEmpty()) {
            throw new IllegalArgumentException("cannot write to directory " + path);
        }
        route.layer().view.put(route.relative(), content.clone());
    }

    boolean delete(String path) {
        var route = route(path);
        return route.layer().view.remove(route.relative()) != null;
    }

    Snapshot rootOutput() {
        return Snapshot.of(root.view);
    }

    /**
     * Full source of mount {@code index} with the process's changes applied beneath its source path.
     */
    Snapshot mountOutput(int index) {
        var layer = mounts.get(index);
        return layer.source.graft(layer.sourcePath, Snapshot.of(layer.view));
    }

    private Route route(String path) {
        String normalized = PathUtils.normalize(path);
        Layer best = null;
        String bestRelative = null;
        for (Layer layer : mounts) {
            String relative = PathUtils.relativize(layer.target, normalized);
            if (relative == null) {
                continue;
            }
            if (best == null || layer.target.length() >= best.target.length()) {
                best = layer;
                bestRelative = relative;
            }
        }
        if (best == null) {
            return new Route(root, normalized);
        }
        return new Route(best, bestRelative);
    }

    private record Route(Layer layer, String relative) {}

    private static final class Layer {
        private final String target;
        private final Snapshot source;
        private final String sourcePath;
        private final TreeMap<String, byte[]> view;

        Layer(String target, Snapshot source, String sourcePath) {
            this.target = target;
            this.source = source;
            this.sourcePath = sourcePath;
            this.view = new TreeMap<>(source.subtree(sourcePath).files());
        }
    }
}
