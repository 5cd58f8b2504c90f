package uma.services;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import uma.errors.UnsupportedVersionException;
import uma.model.Version;

/**
 * Knows which protocol versions this VASP speaks: the current one plus one canonical version per older major.
 */
public class VersionNegotiator {

    public static final int MAJOR_VERSION = 1;
    public static final int MINOR_VERSION = 0;
    public static final String UMA_VERSION_STRING = MAJOR_VERSION + "." + MINOR_VERSION;

    private static final Version CURRENT = new Version(MAJOR_VERSION, MINOR_VERSION);

    private final List<Version> backCompatVersions;
    private final Set<Integer> supportedMajorVersions;

    /**
     * @param backCompatVersions such as {@code 0.3}
     */
    public VersionNegotiator(List<String> backCompatVersions) {
        this.backCompatVersions = backCompatVersions.stream().map(Version::parse).toList();
        final Set<Integer> majors = new TreeSet<>();
        majors.add(MAJOR_VERSION);
        this.backCompatVersions.forEach(version -> majors.add(version.major()));
        supportedMajorVersions = Collections.unmodifiableSet(majors);
    }

    public Set<Integer> supportedMajorVersions() {
        return supportedMajorVersions;
    }

    /**
     * @return false for anything that is not a {@code major.minor} version of a supported major
     */
    public boolean isVersionSupported(String version) {
        return Version.tryParse(version)
            .map(parsed -> supportedMajorVersions.contains(parsed.major()))
            .orElse(false);
    }

    /**
     * @throws UnsupportedVersionException unless {@link #isVersionSupported(String)}
     */
    public void requireSupported(String version) {
        if (!isVersionSupported(version)) {
            throw new UnsupportedVersionException(version, supportedMajorVersions);
        }
    }

    /**
     * @param otherMajorVersions the majors the other VASP supports
     * @return the highest version both sides support, empty when they share no major
     */
    public Optional<String> selectHighestSupportedVersion(Collection<Integer> otherMajorVersions) {
        return otherMajorVersions.stream()
            .filter(supportedMajorVersions::contains)
            .max(Integer::compare)
            .flatMap(this::versionForMajor);
    }

    /**
     * The version to respond with: the requested one or the current one, whichever is lower.
     */
    public String selectResponseVersion(String requestedVersion) {
        return Version.min(Version.parse(requestedVersion), CURRENT).toString();
    }

    public int umaMajorVersion(String version) {
        return Version.parse(version).major();
    }

    private Optional<String> versionForMajor(int major) {
        if (major == MAJOR_VERSION) {
            return Optional.of(UMA_VERSION_STRING);
        }
        return backCompatVersions.stream()
            .filter(version -> version.major() == major)
            .findFirst()
            .map(Version::toString);
    }
}
