package work.strata.core.model;

import java.util.regex.Pattern;
import work.strata.core.error.InvalidReferenceException;

/**
 * Docker image reference normalized the way the docker CLI does: {@code alpine} becomes
 * {@code docker.io/library/alpine}, and {@link #withDefaultTag()} adds {@code :latest} when the
 * reference names neither a tag nor a digest.
 */
public record ImageReference(String domain, String path, String tag, String digest) {
    public static final String DEFAULT_DOMAIN = "docker.io";
    public static final String DEFAULT_TAG = "latest";

    private static final String LEGACY_DOMAIN = "index.docker.io";
    private static final String OFFICIAL_PREFIX = "library/";
    private static final int NAME_MAX = 255;
    private static final Pattern DOMAIN = Pattern.compile(
        "(?:[a-zA-Z0-9](?:[a-zA-Z0-9-]*[a-zA-Z0-9])?)(?:\\.(?:[a-zA-Z0-9](?:[a-zA-Z0-9-]*[a-zA-Z0-9])?))*(?::[0-9]+)?"
    );
    private static final Pattern COMPONENT = Pattern.compile("[a-z0-9]+(?:(?:[._]|__|-+)[a-z0-9]+)*");
    private static final Pattern TAG = Pattern.compile("[\\w][\\w.-]{0,127}");
    private static final Pattern DIGEST = Pattern.compile(
        "[A-Za-z][A-Za-z0-9]*(?:[-_+.][A-Za-z][A-Za-z0-9]*)*:[0-9a-fA-F]{32,}"
    );
    private static final Pattern HEX_IDENTIFIER = Pattern.compile("[a-f0-9]{64}");

    public static ImageReference parse(String address) {
        if (address == null || address.isBlank()) {
            throw new InvalidReferenceException(String.valueOf(address), "repository name must have at least one component");
        }
        if (HEX_IDENTIFIER.matcher(address).matches()) {
            throw new InvalidReferenceException(address, "cannot specify 64-byte hexadecimal strings");
        }
        String remainder = address;
        String digest = null;
        int at = remainder.indexOf('@');
        if (at >= 0) {
            digest = remainder.substring(at + 1);
            remainder = remainder.substring(0, at);
            if (!DIGEST.matcher(digest).matches()) {
                throw new InvalidReferenceException(address, "invalid digest format");
            }
        }
        String tag = null;
        int colon = remainder.lastIndexOf(':');
        if (colon > remainder.lastIndexOf('/')) {
            tag = remainder.substring(colon + 1);
            remainder = remainder.substring(0, colon);
            if (!TAG.matcher(tag).matches()) {
                throw new InvalidReferenceException(address, "invalid tag format");
            }
        }

        String domain = DEFAULT_DOMAIN;
        String path = remainder;
        int slash = remainder.indexOf('/');
        if (slash >= 0) {
            String first = remainder.substring(0, slash);
            if (first.contains(".") || first.contains(":") || first.equals("localhost") || !first.equals(first.toLowerCase())) {
                domain = first;
                path = remainder.substring(slash + 1);
            }
        }
        if (!DOMAIN.matcher(domain).matches()) {
            throw new InvalidReferenceException(address, "invalid domain " + domain);
        }
        if (!path.equals(path.toLowerCase())) {
            throw new InvalidReferenceException(address, "repository name must be lowercase");
        }
        if (LEGACY_DOMAIN.equals(domain)) {
            domain = DEFAULT_DOMAIN;
        }
        if (DEFAULT_DOMAIN.equals(domain) && path.indexOf('/') < 0) {
            path = OFFICIAL_PREFIX + path;
        }
        for (String component : path.split("/", -1)) {
            if (!COMPONENT.matcher(component).matches()) {
                throw new InvalidReferenceException(address, "invalid reference format");
            }
        }
        if (domain.length() + 1 + path.length() > NAME_MAX) {
            throw new InvalidReferenceException(address, "repository name must not be more than " + NAME_MAX + " characters");
        }
        return new ImageReference(domain, path, tag, digest);
    }

    public ImageReference withDefaultTag() {
        if (tag != null || digest != null) {
            return this;
        }
        return new ImageReference(domain, path, DEFAULT_TAG, null);
    }

    public String name() {
        return domain + "/" + path;
    }

    @Override
    public String toString() {
        var builder = new StringBuilder(name());
        if (tag != null) {
            builder.append(':').append(tag);
        }
        if (digest != null) {
            builder.append('@').append(digest);
        }
        return builder.toString();
    }
}
