package uma.model;

import java.util.Comparator;
import java.util.Optional;
import uma.errors.ErrorCode;
import uma.errors.UmaException;

/**
 * A protocol version of the form {@code major.minor}, ordered by major then minor.
 */
public record Version(
    int major,
    int minor
) implements Comparable<Version> {

    private static final Comparator<Version> ORDER = Comparator.comparingInt(Version::major)
        .thenComparingInt(Version::minor);

    /**
     * @throws UmaException with {@link ErrorCode#INVALID_INPUT} unless the text is exactly two numeric parts
     */
    public static Version parse(String version) {
        return tryParse(version)
            .orElseThrow(() -> new UmaException(ErrorCode.INVALID_INPUT, "Invalid version: " + version));
    }

    public static Optional<Version> tryParse(String version) {
        if (version == null) {
            return Optional.empty();
        }
        final String[] parts = version.split("\\.", -1);
        if (parts.length != 2) {
            return Optional.empty();
        }
        try {
            return Optional.of(new Version(Integer.parseInt(parts[0]), Integer.parseInt(parts[1])));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public static Version min(Version a, Version b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    @Override
    public int compareTo(Version other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return major + "." + minor;
    }
}
