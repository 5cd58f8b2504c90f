package uma.messages;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Pattern;
import lombok.Builder;
import org.springframework.lang.Nullable;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;
import uma.errors.ErrorCode;
import uma.errors.MissingRequiredFieldsException;
import uma.errors.UmaException;
import uma.model.BackingSignature;

/**
 * The first request of a payment, sent by the sending VASP as a GET to
 * {@code /.well-known/lnurlp/{user}} of the receiving VASP. Every UMA field is optional here so that plain
 * LNURL requests parse too; {@link #toUmaRequest()} narrows to the signed UMA form.
 *
 * @param receiverAddress       such as {@code $bob@vasp2.com}
 * @param nonce
 * @param signature             sender VASP's signature over {@code receiverAddress|nonce|timestamp}
 * @param isSubjectToTravelRule whether the sending VASP must exchange travel rule information
 * @param vaspDomain            where the sending VASP publishes its keys
 * @param timestamp             unix seconds
 * @param umaVersion
 * @param backingSignatures
 */
@Builder(toBuilder = true)
public record LnurlpRequest(
    String receiverAddress,
    @Nullable
    String nonce,
    @Nullable
    String signature,
    @Nullable
    Boolean isSubjectToTravelRule,
    @Nullable
    String vaspDomain,
    @Nullable
    Long timestamp,
    @Nullable
    String umaVersion,
    @Nullable
    List<BackingSignature> backingSignatures
) {

    public static final String PARAM_VASP_DOMAIN = "vaspDomain";
    public static final String PARAM_NONCE = "nonce";
    public static final String PARAM_SIGNATURE = "signature";
    public static final String PARAM_UMA_VERSION = "umaVersion";
    public static final String PARAM_TIMESTAMP = "timestamp";
    public static final String PARAM_IS_SUBJECT_TO_TRAVEL_RULE = "isSubjectToTravelRule";
    public static final String PARAM_BACKING_SIGNATURES = "backingSignatures";

    private static final Pattern USERNAME = Pattern.compile("^[A-Za-z0-9._$+-]+$");

    public boolean isUmaRequest() {
        return missingUmaFields().isEmpty();
    }

    /**
     * @throws MissingRequiredFieldsException naming each absent UMA field
     */
    public UmaLnurlpRequest toUmaRequest() {
        final List<String> missing = missingUmaFields();
        if (!missing.isEmpty()) {
            throw new MissingRequiredFieldsException("Lnurlp request", missing);
        }
        return new UmaLnurlpRequest(
            receiverAddress,
            nonce,
            signature,
            isSubjectToTravelRule != null && isSubjectToTravelRule,
            vaspDomain,
            timestamp,
            umaVersion,
            backingSignatures
        );
    }

    private List<String> missingUmaFields() {
        final List<String> missing = new ArrayList<>();
        if (nonce == null) {
            missing.add(PARAM_NONCE);
        }
        if (signature == null) {
            missing.add(PARAM_SIGNATURE);
        }
        if (vaspDomain == null) {
            missing.add(PARAM_VASP_DOMAIN);
        }
        if (timestamp == null) {
            missing.add(PARAM_TIMESTAMP);
        }
        if (umaVersion == null) {
            missing.add(PARAM_UMA_VERSION);
        }
        return missing;
    }

    /**
     * @throws UmaException with {@link ErrorCode#INVALID_INPUT} unless the receiver address is {@code user@domain}
     */
    public String encodeToUrl() {
        final String[] addressParts = receiverAddress.split("@");
        if (addressParts.length != 2) {
            throw new UmaException(ErrorCode.INVALID_INPUT, "Invalid receiverAddress: " + receiverAddress);
        }
        final String domain = addressParts[1];

        final Map<String, String> params = new LinkedHashMap<>();
        putIfPresent(params, PARAM_VASP_DOMAIN, vaspDomain);
        putIfPresent(params, PARAM_NONCE, nonce);
        putIfPresent(params, PARAM_SIGNATURE, signature);
        putIfPresent(params, PARAM_UMA_VERSION, umaVersion);
        putIfPresent(params, PARAM_TIMESTAMP, timestamp);
        putIfPresent(params, PARAM_IS_SUBJECT_TO_TRAVEL_RULE, isSubjectToTravelRule);

        final StringJoiner query = new StringJoiner("&");
        params.forEach((name, value) ->
            query.add(name + "=" + UriUtils.encodeQueryParam(value, StandardCharsets.UTF_8)));
        if (backingSignatures != null) {
            final StringJoiner pairs = new StringJoiner(",");
            backingSignatures.forEach(backing ->
                pairs.add(UriUtils.encode(backing.domain() + ":" + backing.signature(), StandardCharsets.UTF_8)));
            query.add(PARAM_BACKING_SIGNATURES + "=" + pairs);
        }

        final StringBuilder url = new StringBuilder()
            .append(UmaUrls.schemeFor(domain))
            .append("://")
            .append(domain)
            .append(UmaUrls.LNURLP_PATH)
            .append(UriUtils.encodePathSegment(addressParts[0], StandardCharsets.UTF_8));
        if (query.length() > 0) {
            url.append('?').append(query);
        }
        return url.toString();
    }

    private static void putIfPresent(Map<String, String> params, String name, @Nullable Object value) {
        if (value != null) {
            params.put(name, value.toString());
        }
    }

    /**
     * Parses the URL shape only; whether the version is supported is for the caller to decide.
     *
     * @throws UmaException with {@link ErrorCode#PARSE_LNURLP_REQUEST_ERROR} for anything but a
     *                      {@code /.well-known/lnurlp/{user}} URL with well-formed parameters
     */
    public static LnurlpRequest decodeFromUrl(String url) {
        final UriComponents components;
        try {
            components = UriComponentsBuilder.fromUriString(url).build();
        } catch (IllegalArgumentException e) {
            throw new UmaException(ErrorCode.PARSE_LNURLP_REQUEST_ERROR, "Invalid URL: " + url, e);
        }
        if (!"http".equals(components.getScheme()) && !"https".equals(components.getScheme())) {
            throw new UmaException(ErrorCode.PARSE_LNURLP_REQUEST_ERROR, "Invalid URL scheme: " + url);
        }
        final List<String> segments = components.getPathSegments();
        if (segments.size() != 3 || !segments.get(0).equals(".well-known") || !segments.get(1).equals("lnurlp")) {
            throw new UmaException(ErrorCode.PARSE_LNURLP_REQUEST_ERROR, "Invalid UMA request path: " + url);
        }
        final String username = decode(segments.get(2));
        if (!USERNAME.matcher(username).matches()) {
            throw new UmaException(ErrorCode.PARSE_LNURLP_REQUEST_ERROR,
                "Invalid username. Only alphanumeric characters and ._$+- are allowed.");
        }
        final int port = components.getPort();
        final String portSuffix = port != -1 && port != 80 && port != 443 ? ":" + port : "";

        final MultiValueMap<String, String> params = components.getQueryParams();
        final String timestamp = decodedParam(params, PARAM_TIMESTAMP);
        final String isSubjectToTravelRule = decodedParam(params, PARAM_IS_SUBJECT_TO_TRAVEL_RULE);
        try {
            return new LnurlpRequest(
                username + "@" + components.getHost() + portSuffix,
                decodedParam(params, PARAM_NONCE),
                decodedParam(params, PARAM_SIGNATURE),
                isSubjectToTravelRule != null ? Boolean.parseBoolean(isSubjectToTravelRule) : null,
                decodedParam(params, PARAM_VASP_DOMAIN),
                timestamp != null ? Long.parseLong(timestamp) : null,
                decodedParam(params, PARAM_UMA_VERSION),
                decodeBackingSignatures(params.getFirst(PARAM_BACKING_SIGNATURES))
            );
        } catch (NumberFormatException e) {
            throw new UmaException(ErrorCode.PARSE_LNURLP_REQUEST_ERROR, "Invalid timestamp: " + timestamp, e);
        }
    }

    /**
     * Each pair is split on its last colon, so a domain with a port keeps it.
     */
    private static List<BackingSignature> decodeBackingSignatures(@Nullable String raw) {
        if (raw == null) {
            return null;
        }
        final List<BackingSignature> backingSignatures = new ArrayList<>();
        for (String encodedPair : raw.split(",")) {
            final String pair = decode(encodedPair);
            final int lastColon = pair.lastIndexOf(':');
            if (lastColon == -1) {
                throw new UmaException(ErrorCode.PARSE_LNURLP_REQUEST_ERROR, "Invalid backing signature format");
            }
            backingSignatures.add(new BackingSignature(pair.substring(0, lastColon), pair.substring(lastColon + 1)));
        }
        return backingSignatures;
    }

    private static String decodedParam(MultiValueMap<String, String> params, String name) {
        final String raw = params.getFirst(name);
        return raw != null ? decode(raw) : null;
    }

    private static String decode(String raw) {
        try {
            return UriUtils.decode(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new UmaException(ErrorCode.PARSE_LNURLP_REQUEST_ERROR, "Invalid URL encoding: " + raw, e);
        }
    }
}
