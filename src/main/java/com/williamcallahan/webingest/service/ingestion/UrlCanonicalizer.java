package com.williamcallahan.webingest.service.ingestion;

import com.williamcallahan.webingest.support.TextStatistics;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Canonicalizes source URLs so incidental query and fragment variation maps to one stable form.
 *
 * <p>This is a pure function of its input: identity hashes are derived from its output,
 * so any change to these rules changes the identity of previously stored records.</p>
 */
@Component
public class UrlCanonicalizer {
    private static final String HTTP_SCHEME = "http";
    private static final String HTTPS_SCHEME = "https";
    private static final int HTTP_DEFAULT_PORT = 80;
    private static final int HTTPS_DEFAULT_PORT = 443;
    private static final String TRACKING_PREFIX = "utm_";
    private static final Set<String> TRACKING_PARAMETERS = Set.of(
        "utm", "fbclid", "gclid", "dclid", "msclkid", "mc_cid", "mc_eid", "igshid", "ref_src"
    );

    /**
     * Returns the canonical form of a URL.
     *
     * @param url raw URL, may be null
     * @return null for null or blank input, the trimmed input when it is not an absolute URI,
     *     otherwise the normalized URL
     */
    public String canonicalize(String url) {
        String trimmed = TextStatistics.trimToNull(url);
        if (trimmed == null) {
            return null;
        }

        URI parsed;
        try {
            parsed = new URI(trimmed);
        } catch (URISyntaxException e) {
            return trimmed;
        }
        if (!parsed.isAbsolute() || parsed.isOpaque() || parsed.getRawAuthority() == null) {
            return trimmed;
        }

        String scheme = TextStatistics.toLowerAscii(parsed.getScheme());
        String host = parsed.getHost();
        if (host == null) {
            return trimmed;
        }

        StringBuilder canonical = new StringBuilder(trimmed.length());
        canonical.append(scheme).append("://").append(TextStatistics.toLowerAscii(host));
        int port = parsed.getPort();
        if (port >= 0 && !isDefaultPort(scheme, port)) {
            canonical.append(':').append(port);
        }

        String rawPath = parsed.getRawPath();
        canonical.append(rawPath == null || rawPath.isEmpty() ? "/" : rawPath);

        String query = stripTrackingParameters(parsed.getRawQuery());
        if (!query.isEmpty()) {
            canonical.append('?').append(query);
        }
        return canonical.toString();
    }

    /**
     * Returns true when the canonical form is an absolute http(s) URL with a host.
     */
    public boolean isWebUrl(String canonicalUrl) {
        if (canonicalUrl == null) {
            return false;
        }
        try {
            URI parsed = new URI(canonicalUrl);
            String scheme = parsed.getScheme();
            return (HTTP_SCHEME.equals(scheme) || HTTPS_SCHEME.equals(scheme)) && parsed.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return (HTTP_SCHEME.equals(scheme) && port == HTTP_DEFAULT_PORT)
            || (HTTPS_SCHEME.equals(scheme) && port == HTTPS_DEFAULT_PORT);
    }

    private static String stripTrackingParameters(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return "";
        }
        List<String> kept = new ArrayList<>();
        for (String parameter : rawQuery.split("&")) {
            if (parameter.isEmpty()) {
                continue;
            }
            int equalsIndex = parameter.indexOf('=');
            String name = equalsIndex < 0 ? parameter : parameter.substring(0, equalsIndex);
            if (!isTrackingParameter(TextStatistics.toLowerAscii(name))) {
                kept.add(parameter);
            }
        }
        return String.join("&", kept);
    }

    private static boolean isTrackingParameter(String lowerName) {
        return lowerName.startsWith(TRACKING_PREFIX) || TRACKING_PARAMETERS.contains(lowerName);
    }
}
