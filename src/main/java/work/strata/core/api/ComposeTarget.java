package work.strata.core.api;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Represents the compose argument (local file or remote URL).
 */
public record ComposeTarget(Optional<Path> localPath, Optional<URI> remoteUri) {
    public ComposeTarget {
        Objects.requireNonNull(localPath, "localPath");
        Objects.requireNonNull(remoteUri, "remoteUri");
        if (localPath.isEmpty() && remoteUri.isEmpty()) {
            throw new IllegalArgumentException("Either localPath or remoteUri must be present.");
        }
    }

    public static ComposeTarget forLocal(Path path) {
        return new ComposeTarget(Optional.of(path), Optional.empty());
    }

    public static ComposeTarget forRemote(URI uri) {
        return new ComposeTarget(Optional.empty(), Optional.of(uri));
    }

    /**
     * Interprets an HTTP(S) URL as remote and anything else as a local path that must exist.
     */
    public static ComposeTarget detect(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Compose location is required.");
        }
        if (value.startsWith("http://") || value.startsWith("https://")) {
            return forRemote(URI.create(value));
        }
        Path path = Path.of(value).toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Compose file not found: " + path);
        }
        return forLocal(path);
    }

    public boolean isRemote() {
        return remoteUri.isPresent();
    }

    public String display() {
        return localPath.map(Path::toString).or(() -> remoteUri.map(URI::toString)).orElse("unknown");
    }
}
