package com.spocparser;

import com.spocparser.ast.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static List<Element> elements(String union) {
        List<Toplevel> list = Parser.parse("group:g = " + union + ";", "test");
        assertEquals(1, list.size());
        return ((Group) list.get(0)).elements();
    }

    private static SyntaxException error(String src) {
        return assertThrows(SyntaxException.class, () -> Parser.parse(src, "test"));
    }

    // ========================================================================
    // Name validation
    // ========================================================================

    @Test
    void testSimpleName() {
        assertTrue(Parser.isSimpleName("h1"));
        assertTrue(Parser.isSimpleName("a-b_c"));
        assertFalse(Parser.isSimpleName(""));
        assertFalse(Parser.isSimpleName("a.b"));
        assertFalse(Parser.isSimpleName("a:b"));
        assertFalse(Parser.isSimpleName("a/b"));
        assertFalse(Parser.isSimpleName("a@b"));
    }

    @Test
    void testDomain() {
        assertTrue(Parser.isDomain("example.com"));
        assertTrue(Parser.isDomain("a"));
        assertFalse(Parser.isDomain(""));
        assertFalse(Parser.isDomain("a..b"));
        assertFalse(Parser.isDomain("a.b."));
    }

    @Test
    void testHostname() {
        assertTrue(Parser.isHostname("h1"));
        assertTrue(Parser.isHostname("id:user.name@example.com"));
        assertTrue(Parser.isHostname("id:@example.com"));
        assertTrue(Parser.isHostname("id:example.com"));
        assertFalse(Parser.isHostname("id:user@"));
        assertFalse(Parser.isHostname("id:a..b@example.com"));
        assertFalse(Parser.isHostname("h.1"));
    }

    @Test
    void testNetworkAndRouterName() {
        assertTrue(Parser.isNetworkName("n1"));
        assertTrue(Parser.isNetworkName("n1/left"));
        assertFalse(Parser.isNetworkName("n1/"));
        assertFalse(Parser.isNetworkName("/n1"));
        assertFalse(Parser.isNetworkName("n1@vrf"));
        assertTrue(Parser.isRouterName("r1@vrf2"));
        assertFalse(Parser.isRouterName("r1@"));
        assertFalse(Parser.isRouterName("r1/x"));
    }

    // ========================================================================
    // Elements
    // ========================================================================

    @Test
    void testNamedReferences() {
        List<Element> l = elements(
            "host:h1, host:id:a@b.c, network:n1/left, any:a1, area:x, group:g2, user,");
        assertEquals(7, l.size());
        assertEquals(new NamedRef("host", "h1"), strip(l.get(0)));
        assertEquals(new NamedRef("host", "id:a@b.c"), strip(l.get(1)));
        assertEquals(new NamedRef("network", "n1/left"), strip(l.get(2)));
        assertEquals(new NamedRef("any", "a1"), strip(l.get(3)));
        assertEquals(new NamedRef("area", "x"), strip(l.get(4)));
        assertEquals(new NamedRef("group", "g2"), strip(l.get(5)));
        assertInstanceOf(User.class, l.get(6));
    }

    private static NamedRef strip(Element el) {
        NamedRef x = (NamedRef) el;
        return new NamedRef(x.kind(), x.name());
    }

    @Test
    void testSpans() {
        List<Element> l = elements("host:h1,  network:n1");
        // "group:g = " is 10 characters.
        assertEquals(10, l.get(0).start());
        assertEquals(17, l.get(0).end());
        assertEquals(20, l.get(1).start());
        assertEquals(30, l.get(1).end());
    }

    @Test
    void testInterfaceReferences() {
        List<Element> l = elements("interface:r1@v1.n1.virtual, interface:r2.n2, interface:r3.[auto]");
        IntfRef a = (IntfRef) l.get(0);
        assertEquals("r1@v1", a.router());
        assertEquals("n1", a.network());
        assertEquals("virtual", a.extension());
        assertFalse(a.hasSelector());

        IntfRef b = (IntfRef) l.get(1);
        assertEquals("n2", b.network());
        assertNull(b.extension());

        IntfRef c = (IntfRef) l.get(2);
        assertEquals("r3", c.router());
        assertEquals("", c.network());
        assertEquals("auto", c.extension());
        assertTrue(c.hasSelector());
    }

    @Test
    void testAutomaticGroups() {
        List<Element> l = elements(
            "host:[network:n1, network:n2], any:[ip = 10.1.0.0/16 & area:a1], "
            + "any:[area:a2], interface:[managed & area:a3].[all], network:[any:[area:a4]]");

        SimpleAuto hosts = (SimpleAuto) l.get(0);
        assertEquals("host", hosts.kind());
        assertEquals(2, hosts.elements().size());

        AggAuto any = (AggAuto) l.get(1);
        assertEquals("10.1.0.0/16", any.net().toString());
        assertEquals(List.of(new NamedRef("area", "a1")), List.of(strip(any.elements().get(0))));

        assertNull(((AggAuto) l.get(2)).net());

        IntfAuto intf = (IntfAuto) l.get(3);
        assertTrue(intf.managed());
        assertEquals("all", intf.selector());

        SimpleAuto nets = (SimpleAuto) l.get(4);
        assertInstanceOf(AggAuto.class, nets.elements().get(0));
    }

    @Test
    void testIpv6Prefix() {
        AggAuto any = (AggAuto) elements("any:[ip = 2001:db8:0:0::/32 & area:a1]").get(0);
        assertEquals(32, any.net().prefixLength());
        assertEquals(128, any.net().bits());
        assertEquals("2001:db8::/32", any.net().toString());
    }

    @Test
    void testEqualSignAfterIpIsOptional() {
        AggAuto any = (AggAuto) elements("any:[ip 10.1.0.0/16 & area:a1]").get(0);
        assertEquals("10.1.0.0/16", any.net().toString());
        assertEquals(1, any.elements().size());
    }

    @Test
    void testIntersectionAndComplement() {
        List<Element> l = elements("group:g2 & group:g3 &! host:h2, host:h1");
        assertEquals(2, l.size());
        Intersection x = (Intersection) l.get(0);
        assertEquals(3, x.list().size());
        Complement c = (Complement) x.list().get(2);
        assertEquals("h2", ((NamedRef) c.element()).name());
        assertEquals(x.start(), x.list().get(0).start());
        assertEquals(c.end(), x.end());
    }

    // ========================================================================
    // Definitions
    // ========================================================================

    @Test
    void testEmptyGroup() {
        List<Toplevel> list = Parser.parse("group:g1 = ;", "test");
        Group g = (Group) list.get(0);
        assertEquals("group:g1", g.name());
        assertEquals("test", g.fileName());
        assertTrue(g.elements().isEmpty());
        assertNull(g.description());
        assertEquals(0, g.start());
        assertEquals(12, g.end());
    }

    @Test
    void testDescription() {
        Group g = (Group) Parser.parse("group:g1 =\n description = a # b \n host:h1;", "test").get(0);
        assertEquals(" a # b", g.description().text());
        assertEquals(1, g.elements().size());
    }

    @Test
    void testService() {
        String src = """
            service:s1 = {
             description = web access
             multi_owner;
             overlaps = service:s2, service:s3,;
             user = foreach host:h1, host:h2;
             permit src = user; dst = network:n1; prt = tcp 80-90, protocol:ping;
             deny src = user; dst = any:a1; prt = udp; log = fw1, fw2;
            }
            """;
        Service s = (Service) Parser.parse(src, "test").get(0);
        assertEquals("service:s1", s.name());
        assertFalse(s.isList());
        assertEquals(" web access", s.description().text());

        assertEquals(2, s.attributes().size());
        assertEquals("multi_owner", s.attributes().get(0).name());
        assertTrue(s.attributes().get(0).values().isEmpty());
        Attribute overlaps = s.attributes().get(1);
        assertEquals(List.of("service:s2", "service:s3"),
            overlaps.values().stream().map(Value::value).toList());

        assertTrue(s.foreach());
        assertEquals(2, s.user().size());

        assertEquals(2, s.rules().size());
        Rule permit = s.rules().get(0);
        assertFalse(permit.deny());
        assertInstanceOf(User.class, permit.src().get(0));
        SimpleProtocol tcp = (SimpleProtocol) permit.prt().get(0);
        assertEquals("tcp", tcp.proto());
        assertEquals(List.of("80-90"), tcp.details());
        assertEquals("ping", ((NamedRef) permit.prt().get(1)).name());
        assertNull(permit.log());

        Rule deny = s.rules().get(1);
        assertTrue(deny.deny());
        assertTrue(((SimpleProtocol) deny.prt().get(0)).details().isEmpty());
        assertEquals("log", deny.log().name());
        assertEquals(2, deny.log().values().size());
        assertEquals(src.lastIndexOf('}') + 1, s.end());
    }

    @Test
    void testServiceWithoutForeach() {
        Service s = (Service) Parser.parse(
            "service:s = { user = host:h1; permit src = user; dst = host:h2; prt = icmp 8; }", "test").get(0);
        assertFalse(s.foreach());
        assertTrue(s.attributes().isEmpty());
        assertEquals(List.of("8"), ((SimpleProtocol) s.rules().get(0).prt().get(0)).details());
    }

    @Test
    void testParseFileDecodesUtf8() {
        byte[] src = "group:g1 =\n description = Grüße\n;".getBytes(java.nio.charset.StandardCharsets.UTF_8);
        Group g = (Group) Parser.parseFile(src, "test").get(0);
        assertEquals(" Grüße", g.description().text());
    }

    @Test
    void testEmptyInput() {
        assertTrue(Parser.parse("", "test").isEmpty());
        assertTrue(Parser.parse("# only a comment\n", "test").isEmpty());
    }

    // ========================================================================
    // Errors
    // ========================================================================

    @Test
    void testUnknownGlobalDefinition() {
        SyntaxException e = error("foo:x =");
        assertEquals(
            "Syntax error: Unknown global definition at line 1 of test, near \"foo:x<--HERE--> =\"",
            e.getMessage());
    }

    @Test
    void testInterfaceWithVrfInNetworkPart() {
        SyntaxException e = error("group:g1 = interface:r1.n1@vrf2;");
        assertTrue(e.getMessage().startsWith("Syntax error: Interface name expected at line 1 of test"),
            e.getMessage());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '~', quoteCharacter = '"', value = {
        "router:r1@vrf = {}                          ~ Unknown global definition",
        "network:n1/x = {}                           ~ Unknown global definition",
        "area:a1 = {}                                ~ Unknown global definition",
        "group:g1/x = ;                              ~ Invalid token",
        "foo                                         ~ Typed name expected",
        "group:g1 host:h1;                           ~ Expected '='",
        "group:g1 = host:h1                          ~ Expected ','",
        "group:g1 = host:a.b;                        ~ Hostname expected",
        "group:g1 = network:a/b/c;                   ~ Name or bridged name expected",
        "group:g1 = area:a.b;                        ~ Name expected",
        "group:g1 = foo:x;                           ~ Unknown element type",
        "group:g1 = area:[host:h1];                  ~ Unexpected automatic group",
        "group:g1 = interface:r1;                    ~ Interface name expected",
        "group:g1 = interface:r1.n1.a.b;             ~ Interface name expected",
        "group:g1 = interface:r1/x.[all];            ~ Interface name expected",
        "group:g1 = interface:r1.[any];              ~ Expected [auto|all]",
        "group:g1 = interface:[host:h1].all;         ~ Expected '.['",
        "group:g1 = any:[ip = 10.1.0.0 & area:a];    ~ Expected 'IP/prefixlen'",
        "group:g1 = any:[ip = 10.1.0.300/16 & a:b];  ~ IP address expected",
        "group:g1 = any:[ip = 10.1.0.0/33 & area:a]; ~ Prefixlen expected",
        "group:g1 = any:[ip = 10.1.0.0/x & area:a];  ~ Prefixlen expected",
        "group:g1 = any:[ip = 10.0.0.0/8 area:a];    ~ Expected '&'",
        "group:g1 = ! host:h1;                       ~ Complement (!) is only supported as part of intersection",
        "group:g1 = !host:h1 & host:h2;              ~ Intersection needs leading element without complement",
        "group:g1 = description ;                    ~ Expected '='",
        "service:s1 = user = host:h1; }              ~ Expected '{'",
        "service:s1 = { = ; }                        ~ Attribute name expected",
        "service:s1 = { a = ; }                      ~ Value expected",
        "service:s1 = { user = host:h1; allow }      ~ Expected 'permit' or 'deny'",
        "service:s1 = { user = user; permit src = user; dst = user; prt = foo 1; } ~ Unknown protocol",
        "service:s1 = { user = user; permit src = user; dst = user; prt = service:x; } ~ Unknown protocol",
    })
    void testSyntaxErrors(String src, String expectation) {
        assertEquals(expectation, error(src).getExpectation());
    }

    @Test
    void testErrorLineAndContext() {
        SyntaxException e = error("group:g1 =\n host:h1\n host:h2;");
        assertEquals("Expected ','", e.getExpectation());
        assertEquals(3, e.getLine());
        assertEquals(" host:h2<--HERE-->;", e.getContext());
    }

    @Test
    void testComplementErrorPointsAtExclamationMark() {
        SyntaxException e = error("group:g1 =\n !host:h1 & host:h2;");
        assertEquals("Intersection needs leading element without complement", e.getExpectation());
        assertEquals(2, e.getLine());
        assertEquals(" !<--HERE-->host:h1 &", e.getContext());

        e = error("group:g1 = ! host:h1;");
        assertEquals("oup:g1 = !<--HERE--> host:h1;", e.getContext());
    }

    @Test
    void testErrorAtEndOfInputPointsBehindLastToken() {
        SyntaxException e = error("group:g = host:a\n\n\n");
        assertEquals("Expected ','", e.getExpectation());
        assertEquals(1, e.getLine());
        assertEquals("g = host:a<--HERE-->", e.getContext());
        assertEquals(
            "Syntax error: Expected ',' at line 1 of test, near \"g = host:a<--HERE-->\"",
            e.getMessage());
    }
}
