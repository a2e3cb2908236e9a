package com.spocparser;

import com.spocparser.ast.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for policy source files.
 *
 * <p>Reads one token ahead and stops at the first error with a
 * {@link SyntaxException}; no partial result is returned.</p>
 */
public class Parser {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private final Scanner scanner;
    private final String fileName;

    private Token token;     // one token look-ahead
    private int prevEnd = 0; // end of the last consumed token

    private record TypedName(String kind, String name) {}

    public Parser(String source, String fileName) {
        this.scanner = new Scanner(source, fileName);
        this.fileName = fileName;
        this.token = scanner.next();
    }

    // ========================================================================
    // Parsing support
    // ========================================================================

    private void next() {
        prevEnd = token.end();
        token = scanner.next();
    }

    private SyntaxException syntaxError(String expectation) {
        return scanner.syntaxError(expectation);
    }

    private int expect(String tok) {
        int pos = token.pos();
        if (!token.text().equals(tok)) {
            throw syntaxError("Expected '" + tok + "'");
        }
        next();
        return pos;
    }

    private boolean check(String tok) {
        if (!token.text().equals(tok)) {
            return false;
        }
        next();
        return true;
    }

    private boolean atDelimiter() {
        String text = token.text();
        return text.length() == 1 && Scanner.isDelimiter(text.charAt(0));
    }

    // ========================================================================
    // Name validation
    // ========================================================================

    static boolean isSimpleName(String n) {
        if (n.isEmpty()) {
            return false;
        }
        for (int i = 0; i < n.length(); i++) {
            switch (n.charAt(i)) {
                case '.', ':', '/', '@' -> {
                    return false;
                }
                default -> {
                }
            }
        }
        return true;
    }

    static boolean isDomain(String n) {
        if (n.isEmpty()) {
            return false;
        }
        for (String part : n.split("\\.", -1)) {
            if (!isSimpleName(part)) {
                return false;
            }
        }
        return true;
    }

    static boolean isHostname(String n) {
        if (!n.startsWith("id:")) {
            return isSimpleName(n);
        }
        String id = n.substring(3);
        int i = id.indexOf('@');
        // Leading "@" is ok.
        if (i > 0 && !isDomain(id.substring(0, i))) {
            return false;
        }
        return isDomain(id.substring(i + 1));
    }

    // Optional qualifier after the first occurrence of sep, both parts simple names.
    private static boolean isQualifiedName(String n, char sep) {
        int i = n.indexOf(sep);
        if (i == -1) {
            return isSimpleName(n);
        }
        return isSimpleName(n.substring(0, i)) && isSimpleName(n.substring(i + 1));
    }

    static boolean isNetworkName(String n) {
        return isQualifiedName(n, '/');
    }

    static boolean isRouterName(String n) {
        return isQualifiedName(n, '@');
    }

    // ========================================================================
    // Elements
    // ========================================================================

    private TypedName typedName() {
        String tok = token.text();
        int i = tok.indexOf(':');
        if (i == -1) {
            throw syntaxError("Typed name expected");
        }
        return new TypedName(tok.substring(0, i), tok.substring(i + 1));
    }

    private Element namedRef(String kind, String name) {
        int start = token.pos();
        next();
        return new NamedRef(start, prevEnd, kind, name);
    }

    private Element hostRef(String kind, String name) {
        if (!isHostname(name)) {
            throw syntaxError("Hostname expected");
        }
        return namedRef(kind, name);
    }

    private Element networkRef(String kind, String name) {
        if (!isNetworkName(name)) {
            throw syntaxError("Name or bridged name expected");
        }
        return namedRef(kind, name);
    }

    private Element simpleRef(String kind, String name) {
        verifySimpleName(name);
        return namedRef(kind, name);
    }

    private void verifySimpleName(String name) {
        if (!isSimpleName(name)) {
            throw syntaxError("Name expected");
        }
    }

    private String selector() {
        String result = token.text();
        if (!(result.equals("auto") || result.equals("all"))) {
            throw syntaxError("Expected [auto|all]");
        }
        next();
        expect("]");
        return result;
    }

    private Element intfRef(String kind, String name) {
        int dot = name.indexOf('.');
        if (dot == -1) {
            throw syntaxError("Interface name expected");
        }
        String router = name.substring(0, dot);
        String net = name.substring(dot + 1);
        boolean err = !isRouterName(router);
        int start = token.pos();
        if (net.equals("[")) {
            if (err) {
                throw syntaxError("Interface name expected");
            }
            next();
            String selector = selector();
            return new IntfRef(start, prevEnd, kind, router, "", selector);
        }
        String ext = null;
        int i = net.indexOf('.');
        if (i != -1) {
            ext = net.substring(i + 1);
            err = err || !isSimpleName(ext);
            net = net.substring(0, i);
        }
        err = err || !isNetworkName(net);
        if (err) {
            throw syntaxError("Interface name expected");
        }
        next();
        return new IntfRef(start, prevEnd, kind, router, net, ext);
    }

    private Element simpleAuto(int start, String kind) {
        List<Element> list = union("]");
        return new SimpleAuto(start, prevEnd, kind, list);
    }

    private IpPrefix ipPrefix() {
        String tok = token.text();
        int slash = tok.indexOf('/');
        if (slash == -1) {
            throw syntaxError("Expected 'IP/prefixlen'");
        }
        InetAddress ip = IpPrefix.parseAddress(tok.substring(0, slash));
        if (ip == null) {
            throw syntaxError("IP address expected");
        }
        String len = tok.substring(slash + 1);
        int bits = ip instanceof Inet4Address ? 32 : 128;
        if (!len.matches("\\d{1,3}") || Integer.parseInt(len) > bits) {
            throw syntaxError("Prefixlen expected");
        }
        next();
        return new IpPrefix(ip, Integer.parseInt(len));
    }

    private Element aggAuto(int start, String kind) {
        IpPrefix net = null;
        if (check("ip")) {
            check("=");
            net = ipPrefix();
            expect("&");
        }
        List<Element> list = union("]");
        return new AggAuto(start, prevEnd, kind, net, list);
    }

    private Element intfAuto(int start, String kind) {
        boolean managed = false;
        if (check("managed")) {
            managed = true;
            expect("&");
        }
        List<Element> list = union("]");
        expect(".[");
        String selector = selector();
        return new IntfAuto(start, prevEnd, kind, managed, list, selector);
    }

    private Element extendedName() {
        if (token.text().equals("user")) {
            int start = token.pos();
            next();
            return new User(start, prevEnd);
        }
        TypedName typed = typedName();
        String kind = typed.kind();
        String name = typed.name();
        if (name.equals("[")) {
            int start = token.pos();
            switch (kind) {
                case "host", "network", "interface", "any" -> next();
                default -> throw syntaxError("Unexpected automatic group");
            }
            return switch (kind) {
                case "interface" -> intfAuto(start, kind);
                case "any" -> aggAuto(start, kind);
                default -> simpleAuto(start, kind);
            };
        }
        return switch (kind) {
            case "host" -> hostRef(kind, name);
            case "network" -> networkRef(kind, name);
            case "interface" -> intfRef(kind, name);
            case "any", "area", "group" -> simpleRef(kind, name);
            default -> throw syntaxError("Unknown element type");
        };
    }

    private Element complement() {
        int start = token.pos();
        if (check("!")) {
            Element el = extendedName();
            return new Complement(start, prevEnd, el);
        }
        return extendedName();
    }

    private Element intersection() {
        int start = token.pos();
        List<Element> list = new ArrayList<>();
        list.add(complement());
        while (check("&")) {
            list.add(complement());
        }
        // Errors for a leading complement are shown at its '!'.
        Element first = list.get(0);
        if (list.size() == 1) {
            if (first instanceof Complement) {
                throw scanner.syntaxErrorAt(start + 1,
                    "Complement (!) is only supported as part of intersection");
            }
            return first;
        }
        if (first instanceof Complement) {
            throw scanner.syntaxErrorAt(start + 1,
                "Intersection needs leading element without complement");
        }
        return new Intersection(start, prevEnd, list);
    }

    /**
     * Reads a comma separated list of elements up to and including
     * stopToken. A trailing comma is allowed.
     */
    private List<Element> union(String stopToken) {
        List<Element> union = new ArrayList<>();
        union.add(intersection());
        while (!check(stopToken)) {
            expect(",");
            if (check(stopToken)) {
                break;
            }
            union.add(intersection());
        }
        return union;
    }

    // ========================================================================
    // Attributes and protocols
    // ========================================================================

    private Value value() {
        if (token.isEof() || atDelimiter()) {
            throw syntaxError("Value expected");
        }
        int start = token.pos();
        String text = token.text();
        next();
        return new Value(start, prevEnd, text);
    }

    private Attribute attribute() {
        if (token.isEof() || atDelimiter()) {
            throw syntaxError("Attribute name expected");
        }
        int start = token.pos();
        String name = token.text();
        next();
        List<Value> values = new ArrayList<>();
        if (!check(";")) {
            expect("=");
            values.add(value());
            while (!check(";")) {
                expect(",");
                if (check(";")) {
                    break;
                }
                values.add(value());
            }
        }
        return new Attribute(start, prevEnd, name, values);
    }

    private Protocol protocol() {
        int start = token.pos();
        String tok = token.text();
        int colon = tok.indexOf(':');
        if (colon != -1) {
            String kind = tok.substring(0, colon);
            String name = tok.substring(colon + 1);
            if (!(kind.equals("protocol") || kind.equals("protocolgroup"))) {
                throw syntaxError("Unknown protocol");
            }
            verifySimpleName(name);
            next();
            return new NamedRef(start, prevEnd, kind, name);
        }
        switch (tok) {
            case "tcp", "udp", "icmp", "proto" -> next();
            default -> throw syntaxError("Unknown protocol");
        }
        List<String> details = new ArrayList<>();
        while (!token.isEof() && !atDelimiter()) {
            details.add(token.text());
            next();
        }
        return new SimpleProtocol(start, prevEnd, tok, details);
    }

    private List<Protocol> protocolList() {
        List<Protocol> list = new ArrayList<>();
        list.add(protocol());
        while (!check(";")) {
            expect(",");
            if (check(";")) {
                break;
            }
            list.add(protocol());
        }
        return list;
    }

    // ========================================================================
    // Toplevel definitions
    // ========================================================================

    private Description description() {
        int start = token.pos();
        if (!check("description")) {
            return null;
        }
        if (!token.text().equals("=")) {
            throw syntaxError("Expected '='");
        }
        token = scanner.toEndOfLine();
        String text = token.text();
        next();
        return new Description(start, prevEnd, text);
    }

    private Toplevel group() {
        int start = token.pos();
        String name = token.text();
        next();
        expect("=");
        Description description = description();
        List<Element> list = check(";") ? List.of() : union(";");
        return new Group(start, prevEnd, name, description, list, fileName);
    }

    private Rule rule() {
        int start = token.pos();
        boolean deny;
        if (check("deny")) {
            deny = true;
        } else if (check("permit")) {
            deny = false;
        } else {
            throw syntaxError("Expected 'permit' or 'deny'");
        }
        expect("src");
        expect("=");
        List<Element> src = union(";");
        expect("dst");
        expect("=");
        List<Element> dst = union(";");
        expect("prt");
        expect("=");
        List<Protocol> prt = protocolList();
        Attribute log = token.text().equals("log") ? attribute() : null;
        return new Rule(start, prevEnd, deny, src, dst, prt, log);
    }

    private Toplevel service() {
        int start = token.pos();
        String name = token.text();
        next();
        expect("=");
        expect("{");
        Description description = description();
        List<Attribute> attributes = new ArrayList<>();
        while (!token.text().equals("user")) {
            attributes.add(attribute());
        }
        next();
        expect("=");
        boolean foreach = check("foreach");
        List<Element> user = union(";");
        List<Rule> rules = new ArrayList<>();
        while (!check("}")) {
            rules.add(rule());
        }
        return new Service(start, prevEnd, name, description, attributes, foreach, user, rules, fileName);
    }

    private Toplevel toplevel() {
        TypedName typed = typedName();
        String kind = typed.kind();
        String name = typed.name();

        // Check for xxx:xxx | router:xx@xx | network:xx/xx
        if (!(kind.equals("router") && isRouterName(name)
              || kind.equals("network") && isNetworkName(name)
              || isSimpleName(name))) {
            throw syntaxError("Invalid token");
        }
        return switch (kind) {
            case "group" -> group();
            case "service" -> service();
            default -> throw syntaxError("Unknown global definition");
        };
    }

    // ========================================================================
    // Source files
    // ========================================================================

    public List<Toplevel> parse() {
        List<Toplevel> list = new ArrayList<>();
        while (!token.isEof()) {
            list.add(toplevel());
        }
        log.debug("Parsed {} definitions from {}", list.size(), fileName);
        return list;
    }

    public static List<Toplevel> parse(String source, String fileName) {
        return new Parser(source, fileName).parse();
    }

    public static List<Toplevel> parseFile(byte[] src, String fileName) {
        return parse(new String(src, StandardCharsets.UTF_8), fileName);
    }
}
