package uma.errors;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Raised when a counterparty asks for a protocol version whose major this VASP cannot speak.
 */
public class UnsupportedVersionException extends UmaException {

    private final String unsupportedVersion;
    private final Set<Integer> supportedMajorVersions;

    public UnsupportedVersionException(String unsupportedVersion, Set<Integer> supportedMajorVersions) {
        super(
            ErrorCode.UNSUPPORTED_UMA_VERSION,
            "Unsupported version: %s. Supported major versions: %s".formatted(
                unsupportedVersion, new TreeSet<>(supportedMajorVersions))
        );
        this.unsupportedVersion = unsupportedVersion;
        this.supportedMajorVersions = Set.copyOf(supportedMajorVersions);
    }

    public String getUnsupportedVersion() {
        return unsupportedVersion;
    }

    public Set<Integer> getSupportedMajorVersions() {
        return supportedMajorVersions;
    }

    @Override
    public Map<String, Object> getAdditionalParams() {
        return Map.of(
            "supportedMajorVersions", new TreeSet<>(supportedMajorVersions),
            "unsupportedVersion", unsupportedVersion
        );
    }
}
