package com.spocparser.printer;

import com.spocparser.ast.*;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonical order of element and protocol lists.
 *
 * <p>Elements are grouped by category
 * {@code user < group < area < any < network < interface < host}.
 * Inside a category, elements without an IPv4 address in their name come
 * first, ordered by name. Elements with an address follow, ordered by that
 * address. The order is only cosmetic.</p>
 */
public final class ElementOrder {

    // Four octets separated by "." or "_", optionally followed by
    // "-" and a second address or a prefix length.
    private static final Pattern IP_IN_NAME = Pattern.compile(
        "(?<!\\d)(\\d{1,3})[._](\\d{1,3})[._](\\d{1,3})[._](\\d{1,3})"
        + "(?:-(\\d{1,3})[._](\\d{1,3})[._](\\d{1,3})[._](\\d{1,3})|-(\\d{1,2}))?(?!\\d)");

    private static final Pattern NUMBER = Pattern.compile("\\d+");

    /**
     * Sort key inside a category. {@code ip} is -1 if the name contains no
     * address, {@code tail} is -1 if the address has no suffix.
     */
    record SortKey(String name, long ip, long tail) {

        boolean hasIp() {
            return ip >= 0;
        }
    }

    private static final Comparator<SortKey> KEY_ORDER = (a, b) -> {
        if (a.hasIp() != b.hasIp()) {
            return a.hasIp() ? 1 : -1;
        }
        if (a.hasIp()) {
            int c = Long.compare(a.ip(), b.ip());
            if (c != 0) {
                return c;
            }
            c = Long.compare(a.tail(), b.tail());
            if (c != 0) {
                return c;
            }
        }
        return a.name().compareTo(b.name());
    };

    private record Keyed<T>(T node, int category, SortKey key) {}

    private ElementOrder() {
        // Utility class
    }

    // ========================================================================
    // Elements
    // ========================================================================

    public static List<Element> sort(List<Element> list) {
        List<Keyed<Element>> keyed = new ArrayList<>(list.size());
        for (Element el : list) {
            keyed.add(new Keyed<>(el, category(el), key(el)));
        }
        keyed.sort(Comparator.<Keyed<Element>>comparingInt(Keyed::category)
            .thenComparing(Keyed::key, KEY_ORDER));
        List<Element> result = new ArrayList<>(list.size());
        for (Keyed<Element> k : keyed) {
            result.add(k.node());
        }
        return result;
    }

    static int category(Element el) {
        if (el instanceof Intersection x) {
            return category(x.list().get(0));
        }
        if (el instanceof Complement x) {
            return category(x.element());
        }
        if (el instanceof User) {
            return 0;
        }
        return switch (kind(el)) {
            case "group" -> 1;
            case "area" -> 2;
            case "any" -> 3;
            case "network" -> 4;
            case "interface" -> 5;
            case "host" -> 6;
            default -> 7;
        };
    }

    private static String kind(Element el) {
        if (el instanceof NamedRef x) {
            return x.kind();
        }
        if (el instanceof IntfRef x) {
            return x.kind();
        }
        if (el instanceof AutoGroup x) {
            return x.kind();
        }
        return "";
    }

    /**
     * Single line text of an element, e.g. {@code interface:r1.[all]}.
     */
    static String text(Element el) {
        if (el instanceof User) {
            return "user";
        }
        if (el instanceof Intersection x) {
            StringBuilder sb = new StringBuilder();
            for (Element member : x.list()) {
                if (sb.length() > 0) {
                    sb.append('&');
                }
                sb.append(text(member));
            }
            return sb.toString();
        }
        if (el instanceof Complement x) {
            return "!" + text(x.element());
        }
        return kind(el) + ":" + name(el);
    }

    /**
     * Text of an element without its type prefix.
     */
    static String name(Element el) {
        if (el instanceof NamedRef x) {
            return x.name();
        }
        if (el instanceof IntfRef x) {
            if (x.hasSelector()) {
                return x.router() + ".[" + x.extension() + "]";
            }
            String ext = x.extension() == null ? "" : "." + x.extension();
            return x.router() + "." + x.network() + ext;
        }
        if (el instanceof AutoGroup x) {
            StringBuilder sb = new StringBuilder("[");
            if (x instanceof AggAuto agg && agg.net() != null) {
                sb.append("ip=").append(agg.net()).append('&');
            }
            if (x instanceof IntfAuto intf && intf.managed()) {
                sb.append("managed&");
            }
            for (int i = 0; i < x.elements().size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                sb.append(text(x.elements().get(i)));
            }
            sb.append(']');
            if (x instanceof IntfAuto intf) {
                sb.append(".[").append(intf.selector()).append(']');
            }
            return sb.toString();
        }
        return text(el);
    }

    static SortKey key(Element el) {
        String name = name(el);
        Matcher m = IP_IN_NAME.matcher(name);
        int from = 0;
        while (from < name.length() && m.find(from)) {
            long ip = toAddress(m, 1);
            if (ip < 0) {
                from = m.start() + 1;
                continue;
            }
            long tail = -1;
            if (m.group(5) != null) {
                tail = toAddress(m, 5);
            } else if (m.group(9) != null) {
                tail = Long.parseLong(m.group(9));
            }
            return new SortKey(name, ip, tail);
        }
        return new SortKey(name, -1, -1);
    }

    // Address from four octet groups starting at group, -1 if an octet is out of range.
    private static long toAddress(Matcher m, int group) {
        long result = 0;
        for (int i = group; i < group + 4; i++) {
            int octet = Integer.parseInt(m.group(i));
            if (octet > 255) {
                return -1;
            }
            result = (result << 8) | octet;
        }
        return result;
    }

    // ========================================================================
    // Protocols
    // ========================================================================

    private static final Comparator<Protocol> PROTOCOL_ORDER = Comparator
        .comparingInt(ElementOrder::protocolRank)
        .thenComparing(ElementOrder::numbers, ElementOrder::compareNumbers)
        .thenComparing(ElementOrder::protocolText);

    /**
     * Named protocols first, then icmp, proto, tcp, udp. Entries of the same
     * protocol are ordered by their numbers.
     */
    public static List<Protocol> sortProtocols(List<Protocol> list) {
        List<Protocol> result = new ArrayList<>(list);
        result.sort(PROTOCOL_ORDER);
        return result;
    }

    static int protocolRank(Protocol p) {
        if (p instanceof SimpleProtocol x) {
            return switch (x.proto()) {
                case "icmp" -> 1;
                case "proto" -> 2;
                case "tcp" -> 3;
                case "udp" -> 4;
                default -> 5;
            };
        }
        return 0;
    }

    static String protocolText(Protocol p) {
        if (p instanceof NamedRef x) {
            return x.kind() + ":" + x.name();
        }
        SimpleProtocol x = (SimpleProtocol) p;
        StringBuilder sb = new StringBuilder(x.proto());
        for (String d : x.details()) {
            sb.append(' ').append(d);
        }
        return sb.toString();
    }

    private static List<Long> numbers(Protocol p) {
        List<Long> result = new ArrayList<>();
        if (p instanceof SimpleProtocol x) {
            for (String d : x.details()) {
                Matcher m = NUMBER.matcher(d);
                while (m.find()) {
                    String digits = m.group();
                    result.add(digits.length() > 18 ? Long.MAX_VALUE : Long.parseLong(digits));
                }
            }
        }
        return result;
    }

    private static int compareNumbers(List<Long> a, List<Long> b) {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int c = Long.compare(a.get(i), b.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(a.size(), b.size());
    }
}
