package com.spocparser.printer;

import com.spocparser.Parser;
import com.spocparser.ast.Toplevel;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Properties that hold for every valid input: printing is a fixed point,
 * no comment is lost or duplicated and re-parsing yields the same tree.
 */
public class CanonicalFormTest {

    static Stream<String> sources() {
        return Stream.of(
            "",
            "# only\n\n\n# comments\n",
            "group:g1 = ;",
            "group:g1 = host:h1, group:g2 & group:g3 &! host:h2 &! host:h3, network:n1,;",
            """
            group:g1 = host:[any:[area:a2]], interface:[network:n3, network:n2].[auto],
              interface:[managed&host:h1].[all], network:[user], any:[ip=10.1.0.0/16&area:a1],
              any:[ip = 2001:db8::/48 & network:[host:[network:n1]]];
            """,
            """
            # head

            # about g1
            group:g1 = # after header
             host:h2, # h2
             # before h1
             host:h1,
            ; # end
            # tail
            """,
            """
            group:g1 = # h
             # before desc
             description = x # y

             # first

             host:h10_1_1_2, host:h10_1_1_10, # mixed
             host:a,
            ;
            group:g2 = host:[ # inside
              host:h1 # h1
            ];
            """,
            """
            group:g1 =
             group:g2 # c1
             & group:g3 # c2
             &! host:h2
             ,
            ;
            """,
            """
            # service comment
            service:s1 = { # header
             # attr comment
             multi_owner; # flag
             overlaps = service:s2, # s2
                        service:s3;

             # user comment
             user = host:h1, host:h2; # users
             # rule comment
             permit src = user; # src
                    dst = network:n1;
                    prt = tcp 80, # http
                          udp 53; # prt
             # orphan
            } # end s1

            service:s2 = {
             user = # u
              foreach host:h2, host:h1;
             deny src = user; dst = host:h3; prt = protocol:ping, tcp 22;
                  log = fw, # fw
                        syslog;
            }
            """,
            """
            service:s3 = {
             user = host:b,

                    # about a
                    host:a;
             permit # p
              src = host:d, # d
                    # about c
                    host:c;
              dst = network:n2,
                    # about n1
                    network:n1;
              prt = udp 53,
                    # about tcp
                    tcp 80;
            }
            """
        );
    }

    private static String format(String src) {
        return Printer.render(Parser.parse(src, "test"), src);
    }

    private static List<String> comments(String src) {
        List<Toplevel> toplevels = Parser.parse(src, "test");
        return CommentIndex.of(src, toplevels).all().stream()
            .map(CommentIndex.Comment::text)
            .sorted()
            .toList();
    }

    @ParameterizedTest
    @MethodSource("sources")
    void testIdempotent(String src) {
        String once = format(src);
        assertEquals(once, format(once));
    }

    @ParameterizedTest
    @MethodSource("sources")
    void testCommentsAreConserved(String src) {
        assertEquals(comments(src), comments(format(src)));
    }

    @ParameterizedTest
    @MethodSource("sources")
    void testStructureSurvivesReparse(String src) {
        String once = format(src);
        String plain = Printer.render(Parser.parse(src, "test"), "");
        assertEquals(plain, Printer.render(Parser.parse(once, "test"), ""));
    }
}
