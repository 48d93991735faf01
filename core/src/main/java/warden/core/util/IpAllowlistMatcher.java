package warden.core.util;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import warden.core.redaction.SanitizingLogger;

/**
 * Matches client IP addresses against credential allowlists.
 *
 * <p>Allowlist entries are either exact IP literals or CIDR ranges; an exact
 * literal is treated as a range covering the whole address. Parsed entries are
 * cached since the same allowlists are checked on every request; the cache is
 * bounded and drops the least recently used pattern once full, so patterns of
 * revoked or swept credentials age out. Hostnames are never resolved.
 */
@ApplicationScoped
public class IpAllowlistMatcher {

    private static final SanitizingLogger LOG = SanitizingLogger.getLogger(IpAllowlistMatcher.class);

    static final int DEFAULT_CACHE_SIZE = 4096;

    private final Map<String, Optional<AllowlistEntry>> entries;

    private record AllowlistEntry(byte[] network, int prefixLength) {

        boolean contains(byte[] address) {
            if (address.length != network.length) {
                return false;
            }
            var remaining = prefixLength;
            for (var i = 0; i < network.length && remaining > 0; i++) {
                final var bits = Math.min(8, remaining);
                final var mask = (0xFF << (8 - bits)) & 0xFF;
                if ((network[i] & mask) != (address[i] & mask)) {
                    return false;
                }
                remaining -= bits;
            }
            return true;
        }
    }

    public IpAllowlistMatcher() {
        this(DEFAULT_CACHE_SIZE);
    }

    IpAllowlistMatcher(int cacheSize) {
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("Cache size must be positive");
        }
        this.entries = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Optional<AllowlistEntry>> eldest) {
                return size() > cacheSize;
            }
        });
    }

    /**
     * Check whether the client IP is permitted by the allowlist.
     *
     * <p>An empty allowlist permits every client. A missing or unparseable
     * client IP never matches a non-empty allowlist.
     *
     * @param clientIp  the caller's IP address
     * @param allowlist exact IPs and CIDR ranges
     * @return true if the client is allowed
     */
    public boolean isAllowed(String clientIp, Collection<String> allowlist) {
        if (allowlist == null || allowlist.isEmpty()) {
            return true;
        }
        final var address = toBytes(clientIp == null ? null : clientIp.trim());
        if (address.isEmpty()) {
            return false;
        }
        for (final var pattern : allowlist) {
            if (pattern == null) {
                continue;
            }
            final var entry = entries.computeIfAbsent(pattern.trim(), IpAllowlistMatcher::parseEntry);
            if (entry.isPresent() && entry.get().contains(address.get())) {
                return true;
            }
        }
        return false;
    }

    int cachedPatternCount() {
        return entries.size();
    }

    private static Optional<AllowlistEntry> parseEntry(String pattern) {
        final var slash = pattern.indexOf('/');
        final var addressPart = slash < 0 ? pattern : pattern.substring(0, slash);
        final var network = toBytes(addressPart);
        if (network.isEmpty()) {
            LOG.warnf("Ignoring allowlist entry with invalid address: %s", pattern);
            return Optional.empty();
        }
        final var maxPrefix = network.get().length * 8;
        if (slash < 0) {
            return Optional.of(new AllowlistEntry(network.get(), maxPrefix));
        }
        final int prefixLength;
        try {
            prefixLength = Integer.parseInt(pattern.substring(slash + 1));
        } catch (NumberFormatException e) {
            LOG.warnf("Ignoring allowlist entry with invalid prefix length: %s", pattern);
            return Optional.empty();
        }
        if (prefixLength < 0 || prefixLength > maxPrefix) {
            LOG.warnf("Ignoring allowlist entry with prefix length outside 0-%d: %s", maxPrefix, pattern);
            return Optional.empty();
        }
        return Optional.of(new AllowlistEntry(network.get(), prefixLength));
    }

    private static Optional<byte[]> toBytes(String ip) {
        if (!looksLikeIpLiteral(ip)) {
            return Optional.empty();
        }
        try {
            // only literals reach here, so getByName never performs a lookup
            return Optional.of(InetAddress.getByName(ip).getAddress());
        } catch (UnknownHostException e) {
            return Optional.empty();
        }
    }

    private static boolean looksLikeIpLiteral(String input) {
        if (input == null || input.isEmpty()) {
            return false;
        }
        if (input.indexOf(':') >= 0) {
            return input.chars().allMatch(c -> c == ':' || c == '.' || Character.digit(c, 16) >= 0);
        }
        return input.chars().allMatch(c -> c == '.' || Character.isDigit(c));
    }
}
