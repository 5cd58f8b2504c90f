package uma.messages;

import java.util.Locale;

/**
 * Well-known locations every UMA VASP serves.
 */
public final class UmaUrls {

    public static final String LNURLP_PATH = "/.well-known/lnurlp/";
    public static final String PUBKEY_PATH = "/.well-known/lnurlpubkey";

    private UmaUrls() {
    }

    /**
     * Loopback hosts and the {@code .local}/{@code .internal} TLDs are reached over plain http.
     */
    public static boolean isDomainLocalhost(String domain) {
        final String host = domain.split(":", 2)[0].toLowerCase(Locale.ROOT);
        if (host.equals("localhost") || host.equals("127.0.0.1")) {
            return true;
        }
        final int lastDot = host.lastIndexOf('.');
        final String tld = lastDot == -1 ? "" : host.substring(lastDot + 1);
        return tld.equals("local") || tld.equals("internal");
    }

    public static String schemeFor(String domain) {
        return isDomainLocalhost(domain) ? "http" : "https";
    }

    public static String pubKeyUrl(String domain) {
        return schemeFor(domain) + "://" + domain + PUBKEY_PATH;
    }
}
