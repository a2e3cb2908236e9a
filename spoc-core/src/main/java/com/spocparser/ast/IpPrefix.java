package com.spocparser.ast;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * IP address with prefix length, as used in {@code any:[ip = 10.1.0.0/16 & ...]}.
 */
public record IpPrefix(InetAddress address, int prefixLength) {

    private static final Pattern IPV4 = Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");
    private static final Pattern IPV6 = Pattern.compile("(?=.*:)[0-9A-Fa-f:][0-9A-Fa-f:.]*");

    public int bits() {
        return address instanceof Inet4Address ? 32 : 128;
    }

    /**
     * Parses a textual IPv4 or IPv6 address without ever doing a name lookup.
     *
     * @return the address or null if {@code text} is no address literal
     */
    public static InetAddress parseAddress(String text) {
        if (IPV4.matcher(text).matches()) {
            String[] parts = text.split("\\.");
            byte[] bytes = new byte[4];
            for (int i = 0; i < 4; i++) {
                int octet = Integer.parseInt(parts[i]);
                if (octet > 255) {
                    return null;
                }
                bytes[i] = (byte) octet;
            }
            return toAddress(bytes);
        }
        if (IPV6.matcher(text).matches()) {
            try {
                // Only literals reach this point, so no lookup happens.
                return InetAddress.getByName(text);
            } catch (UnknownHostException e) {
                return null;
            }
        }
        return null;
    }

    private static InetAddress toAddress(byte[] bytes) {
        try {
            return InetAddress.getByAddress(bytes);
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("Invalid address length: " + bytes.length, e);
        }
    }

    /**
     * Parses {@code address/len}.
     *
     * @throws IllegalArgumentException if text is no valid prefix
     */
    public static IpPrefix parse(String text) {
        int slash = text.indexOf('/');
        if (slash != -1) {
            InetAddress address = parseAddress(text.substring(0, slash));
            if (address != null) {
                String len = text.substring(slash + 1);
                int bits = address instanceof Inet4Address ? 32 : 128;
                if (len.matches("\\d{1,3}") && Integer.parseInt(len) <= bits) {
                    return new IpPrefix(address, Integer.parseInt(len));
                }
            }
        }
        throw new IllegalArgumentException("Invalid IP prefix: " + text);
    }

    @Override
    public String toString() {
        return addressString() + "/" + prefixLength;
    }

    /**
     * Dotted quad for IPv4, RFC 5952 style for IPv6.
     */
    public String addressString() {
        if (address instanceof Inet4Address) {
            return address.getHostAddress();
        }
        byte[] b = address.getAddress();
        int[] groups = new int[8];
        for (int i = 0; i < 8; i++) {
            groups[i] = ((b[2 * i] & 0xff) << 8) | (b[2 * i + 1] & 0xff);
        }
        // Longest run of zero groups, at least two long, is replaced by "::".
        int bestStart = -1;
        int bestLen = 1;
        for (int i = 0; i < 8; ) {
            if (groups[i] != 0) {
                i++;
                continue;
            }
            int j = i;
            while (j < 8 && groups[j] == 0) {
                j++;
            }
            if (j - i > bestLen) {
                bestStart = i;
                bestLen = j - i;
            }
            i = j;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 8; i++) {
            if (i == bestStart) {
                sb.append("::");
                i += bestLen - 1;
                continue;
            }
            if (sb.length() > 0 && sb.charAt(sb.length() - 1) != ':') {
                sb.append(':');
            }
            sb.append(Integer.toHexString(groups[i]));
        }
        return sb.toString();
    }
}
