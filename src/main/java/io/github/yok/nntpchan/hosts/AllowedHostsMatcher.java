package io.github.yok.nntpchan.hosts;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.commons.lang3.StringUtils;

/**
 * Decides whether a request's {@code Host} value is one the front-end serves.
 *
 * <p>
 * Pattern forms:
 * </p>
 * <ul>
 * <li>{@code *} matches any host.</li>
 * <li>{@code .example.com} matches {@code example.com} and every subdomain of it.</li>
 * <li>Anything else matches that host exactly.</li>
 * </ul>
 *
 * <p>
 * Matching is case-insensitive. The port and a trailing dot are removed from the host before
 * matching. In debug mode an empty pattern list admits the loopback names.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class AllowedHostsMatcher {

    /**
     * Hosts admitted in debug mode when no pattern is configured.
     */
    public static final List<String> DEBUG_LOOPBACK_HOSTS =
            ImmutableList.of("localhost", "127.0.0.1", "[::1]");

    private final List<String> patterns;

    /**
     * Creates a matcher.
     *
     * @param allowedHosts configured patterns; {@code null} is treated as empty
     * @param debug whether debug mode is on
     */
    public AllowedHostsMatcher(List<String> allowedHosts, boolean debug) {
        List<String> normalized = new ArrayList<>();
        if (allowedHosts != null) {
            for (String raw : allowedHosts) {
                if (StringUtils.isBlank(raw)) {
                    continue;
                }
                normalized.add(raw.trim().toLowerCase(Locale.ROOT));
            }
        }
        if (normalized.isEmpty() && debug) {
            normalized.addAll(DEBUG_LOOPBACK_HOSTS);
        }
        this.patterns = ImmutableList.copyOf(normalized);
    }

    /**
     * Returns the effective patterns, including the debug loopback defaults when they apply.
     *
     * @return immutable pattern list
     */
    public List<String> getPatterns() {
        return patterns;
    }

    /**
     * Returns whether the given {@code Host} value is allowed.
     *
     * @param hostHeader raw host, optionally with port (e.g. {@code board.ebin.tld:8080})
     * @return {@code true} if a pattern matches
     */
    public boolean isAllowed(String hostHeader) {
        String host = stripPort(hostHeader);
        if (host == null) {
            return false;
        }
        for (String pattern : patterns) {
            if (matches(pattern, host)) {
                return true;
            }
        }
        return false;
    }

    private boolean matches(String pattern, String host) {
        if ("*".equals(pattern)) {
            return true;
        }
        if (pattern.startsWith(".")) {
            return host.endsWith(pattern) || host.equals(pattern.substring(1));
        }
        return host.equals(pattern);
    }

    /**
     * Removes the port and a trailing dot, and lower-cases the host.
     *
     * @param hostHeader raw host value
     * @return bare host, or {@code null} if nothing usable remains
     */
    static String stripPort(String hostHeader) {
        if (StringUtils.isBlank(hostHeader)) {
            return null;
        }
        String host = hostHeader.trim().toLowerCase(Locale.ROOT);
        if (host.startsWith("[")) {
            // IPv6 literal; keep the brackets, drop anything after them
            int close = host.indexOf(']');
            if (close < 0) {
                return null;
            }
            return host.substring(0, close + 1);
        }
        int colon = host.lastIndexOf(':');
        if (colon >= 0) {
            host = host.substring(0, colon);
        }
        if (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        return host.isEmpty() ? null : host;
    }
}
