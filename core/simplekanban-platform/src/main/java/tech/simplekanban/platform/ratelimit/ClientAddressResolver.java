package tech.simplekanban.platform.ratelimit;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.simplekanban.platform.common.errors.ConfigurationException;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Works out the client address of a request.
 *
 * <p>X-Forwarded-For is only believed when the direct peer is a trusted proxy. The header
 * is then walked right to left, skipping trusted proxies; the first other hop is the client.
 */
@ApplicationScoped
public class ClientAddressResolver {

    private static final Logger LOG = Logger.getLogger(ClientAddressResolver.class);
    private static final Pattern IPV4_LITERAL = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");

    @Inject
    RateLimitConfig config;

    private List<AddressRange> trustedProxies = List.of();

    public ClientAddressResolver() {
    }

    public ClientAddressResolver(Collection<String> trustedProxies) {
        this.trustedProxies = parseRanges(trustedProxies);
    }

    @PostConstruct
    void init() {
        this.trustedProxies = parseRanges(config.trustedProxies().orElse(List.of()));
        if (!trustedProxies.isEmpty()) {
            LOG.infof("Trusting X-Forwarded-For from %d proxy range(s)", trustedProxies.size());
        }
    }

    /**
     * @param remoteAddress  the socket peer address
     * @param forwardedFor   the X-Forwarded-For header, may be null
     */
    public String resolve(String remoteAddress, String forwardedFor) {
        if (remoteAddress == null || !isTrusted(remoteAddress) || forwardedFor == null || forwardedFor.isBlank()) {
            return remoteAddress;
        }

        String[] hops = forwardedFor.split(",");
        String candidate = remoteAddress;
        for (int i = hops.length - 1; i >= 0; i--) {
            String hop = hops[i].trim();
            if (parseLiteral(hop).isEmpty()) {
                // Unparseable entry: stop at the last address we could vouch for
                return candidate;
            }
            candidate = hop;
            if (!isTrusted(hop)) {
                return hop;
            }
        }
        return candidate;
    }

    boolean isTrusted(String address) {
        if (trustedProxies.isEmpty()) {
            return false;
        }
        Optional<InetAddress> parsed = parseLiteral(address);
        return parsed.isPresent() && trustedProxies.stream().anyMatch(range -> range.contains(parsed.get()));
    }

    private static List<AddressRange> parseRanges(Collection<String> entries) {
        List<AddressRange> ranges = new ArrayList<>();
        for (String entry : entries) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            ranges.add(AddressRange.parse(trimmed));
        }
        return List.copyOf(ranges);
    }

    /**
     * Parse an IP literal without ever doing a DNS lookup.
     */
    static Optional<InetAddress> parseLiteral(String value) {
        if (value == null || value.isEmpty()) {
            return Optional.empty();
        }
        String literal = value.startsWith("[") && value.endsWith("]") ? value.substring(1, value.length() - 1) : value;
        if (!IPV4_LITERAL.matcher(literal).matches() && !literal.contains(":")) {
            return Optional.empty();
        }
        try {
            return Optional.of(InetAddress.getByName(literal));
        } catch (UnknownHostException e) {
            return Optional.empty();
        }
    }

    /**
     * A single address or a CIDR block.
     */
    record AddressRange(byte[] network, int prefixLength) {

        static AddressRange parse(String entry) {
            String[] parts = entry.split("/", 2);
            InetAddress address = parseLiteral(parts[0])
                .orElseThrow(() -> new ConfigurationException("Invalid trusted proxy address: " + entry));
            byte[] bytes = address.getAddress();
            int prefix = bytes.length * 8;
            if (parts.length == 2) {
                try {
                    prefix = Integer.parseInt(parts[1]);
                } catch (NumberFormatException e) {
                    throw new ConfigurationException("Invalid trusted proxy prefix length: " + entry, e);
                }
                if (prefix < 0 || prefix > bytes.length * 8) {
                    throw new ConfigurationException("Invalid trusted proxy prefix length: " + entry);
                }
            }
            return new AddressRange(bytes, prefix);
        }

        boolean contains(InetAddress address) {
            byte[] candidate = address.getAddress();
            if (candidate.length != network.length) {
                return false;
            }
            int fullBytes = prefixLength / 8;
            for (int i = 0; i < fullBytes; i++) {
                if (candidate[i] != network[i]) {
                    return false;
                }
            }
            int remainingBits = prefixLength % 8;
            if (remainingBits == 0) {
                return true;
            }
            int mask = (0xFF << (8 - remainingBits)) & 0xFF;
            return (candidate[fullBytes] & mask) == (network[fullBytes] & mask);
        }
    }
}
