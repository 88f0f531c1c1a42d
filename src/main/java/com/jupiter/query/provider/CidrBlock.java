package com.jupiter.query.provider;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * IPv4 or IPv6 network in CIDR notation ({@code 192.168.0.0/16},
 * {@code 2001:db8::/32}). A bare address is treated as a host route.
 *
 * Only numeric address literals are accepted, so parsing never triggers a
 * DNS lookup.
 */
public final class CidrBlock {

    private static final Pattern IPV4_LITERAL = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");
    private static final Pattern IPV6_LITERAL = Pattern.compile("^[0-9A-Fa-f:.]*:[0-9A-Fa-f:.]*$");

    private final byte[] network;
    private final int prefixLength;
    private final String text;

    private CidrBlock(byte[] network, int prefixLength, String text) {
        this.network = network;
        this.prefixLength = prefixLength;
        this.text = text;
    }

    /**
     * Parse CIDR text. Empty when the text is not a valid IPv4/IPv6 network.
     */
    public static Optional<CidrBlock> parse(String cidr) {
        if (cidr == null) {
            return Optional.empty();
        }
        String trimmed = cidr.trim();
        int slash = trimmed.indexOf('/');
        String addressPart = slash >= 0 ? trimmed.substring(0, slash) : trimmed;
        Optional<byte[]> address = parseAddress(addressPart);
        if (address.isEmpty()) {
            return Optional.empty();
        }
        int maxPrefix = address.get().length * 8;
        int prefix = maxPrefix;
        if (slash >= 0) {
            String prefixPart = trimmed.substring(slash + 1);
            if (!prefixPart.matches("\\d{1,3}")) {
                return Optional.empty();
            }
            prefix = Integer.parseInt(prefixPart);
            if (prefix > maxPrefix) {
                return Optional.empty();
            }
        }
        return Optional.of(new CidrBlock(address.get(), prefix, trimmed));
    }

    /**
     * Parse a numeric IPv4 or IPv6 address literal.
     */
    public static Optional<byte[]> parseAddress(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String candidate = value.trim();
        if (!IPV4_LITERAL.matcher(candidate).matches() && !IPV6_LITERAL.matcher(candidate).matches()) {
            return Optional.empty();
        }
        if (IPV4_LITERAL.matcher(candidate).matches()) {
            for (String octet : candidate.split("\\.")) {
                if (Integer.parseInt(octet) > 255) {
                    return Optional.empty();
                }
            }
        }
        try {
            return Optional.of(InetAddress.getByName(candidate).getAddress());
        } catch (UnknownHostException e) {
            return Optional.empty();
        }
    }

    /**
     * Whether the address falls inside this network. Addresses of the other
     * IP family, and non-address text, never match.
     */
    public boolean contains(String ip) {
        Optional<byte[]> parsed = parseAddress(ip);
        if (parsed.isEmpty() || parsed.get().length != network.length) {
            return false;
        }
        byte[] address = parsed.get();
        int fullBytes = prefixLength / 8;
        for (int i = 0; i < fullBytes; i++) {
            if (address[i] != network[i]) {
                return false;
            }
        }
        int remainingBits = prefixLength % 8;
        if (remainingBits == 0) {
            return true;
        }
        int mask = (0xFF << (8 - remainingBits)) & 0xFF;
        return (address[fullBytes] & mask) == (network[fullBytes] & mask);
    }

    public int getPrefixLength() {
        return prefixLength;
    }

    public boolean isIpv6() {
        return network.length == 16;
    }

    @Override
    public String toString() {
        return text;
    }
}
