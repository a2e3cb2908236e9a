package com.spocparser.printer;

import com.spocparser.ast.*;
import com.spocparser.printer.CommentIndex.Comment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Prints policy definitions in canonical form.
 *
 * <p>Element lists are sorted, layout and indentation are fixed and the
 * comments of the original source are put back next to the nodes they
 * belong to. Printing the output of the printer again yields the same
 * text.</p>
 */
public class Printer {

    private static final Logger log = LoggerFactory.getLogger(Printer.class);

    private final CommentIndex comments;
    private final StringBuilder output = new StringBuilder();
    private int indent = 0;

    @FunctionalInterface
    private interface Show<T> {
        void show(String pre, T node, String post);
    }

    private Printer(CommentIndex comments) {
        this.comments = comments;
    }

    public static String render(List<? extends Toplevel> toplevels, byte[] source) {
        return render(toplevels, new String(source, StandardCharsets.UTF_8));
    }

    /**
     * @param toplevels definitions parsed from {@code source}
     * @param source    original source, only read to recover comments
     */
    public static String render(List<? extends Toplevel> toplevels, String source) {
        Printer p = new Printer(CommentIndex.of(source, toplevels));
        p.file(toplevels);
        return p.output.toString();
    }

    // ========================================================================
    // Output
    // ========================================================================

    private void print(String line) {
        if (!line.isEmpty()) {
            output.append(" ".repeat(indent)).append(line);
        }
        output.append('\n');
    }

    private void emptyLine() {
        int l = output.length();
        if (l < 2 || output.charAt(l - 1) != '\n' || output.charAt(l - 2) != '\n') {
            output.append('\n');
        }
    }

    // ========================================================================
    // Comments
    // ========================================================================

    private void printComments(List<Comment> list) {
        Comment prev = null;
        for (Comment c : list) {
            if (prev != null && comments.hasBlankLine(prev.start(), c.start())) {
                print("");
            }
            print(c.text());
            prev = c;
        }
    }

    private void preComment(Node n, String ign) {
        preCommentAt(n.start(), ign);
    }

    private void preCommentAt(int pos, String ign) {
        List<Comment> list = comments.takePreceding(pos, ign);
        if (list.isEmpty()) {
            return;
        }
        printComments(list);
        if (comments.hasBlankLine(list.get(list.size() - 1).start(), pos)) {
            print("");
        }
    }

    private String trailingComment(Node n, String ign) {
        return trailingCommentAt(n.end(), ign);
    }

    private String trailingCommentAt(int pos, String ign) {
        String text = comments.takeTrailing(pos, ign);
        return text == null ? "" : " " + text;
    }

    // Comments inside [from, to) that no node has taken.
    private void orphanComments(int from, int to) {
        List<Comment> list = comments.takeUnused(from, to);
        if (!list.isEmpty()) {
            log.debug("Moving {} unattached comments to end of block", list.size());
            printComments(list);
        }
    }

    // Comments inside [from, to) that no node has taken, printed in front
    // of the next line.
    private void headerComments(int from, int to) {
        List<Comment> list = comments.takeUnused(from, to);
        if (list.isEmpty()) {
            return;
        }
        printComments(list);
        if (comments.hasBlankLine(list.get(list.size() - 1).start(), to)) {
            print("");
        }
    }

    // Start of the element first in source, the list may already be sorted.
    private static int firstStart(List<? extends Node> l) {
        int pos = Integer.MAX_VALUE;
        for (Node n : l) {
            pos = Math.min(pos, n.start());
        }
        return pos;
    }

    private static int lastEnd(List<? extends Node> l) {
        int pos = 0;
        for (Node n : l) {
            pos = Math.max(pos, n.end());
        }
        return pos;
    }

    // ========================================================================
    // Elements
    // ========================================================================

    private String isShort(List<Element> l, Node owner) {
        if (l.size() == 1 && !comments.hasUnused(owner.start(), owner.end())) {
            Element el = l.get(0);
            if (el instanceof NamedRef x) {
                return x.kind() + ":" + x.name();
            }
            if (el instanceof User) {
                return "user";
            }
        }
        return null;
    }

    private void subElements(String p1, String p2, AutoGroup owner, String stop) {
        String name = isShort(owner.elements(), owner);
        if (name != null) {
            print(p1 + p2 + name + stop);
            return;
        }
        print(p1 + p2);
        int ind = p1.length();
        indent += ind;
        elementList(owner.elements(), stop, owner);
        indent -= ind;
    }

    private void element(String pre, Element el, String post) {
        if (el instanceof NamedRef x) {
            print(pre + x.kind() + ":" + x.name() + post);
        } else if (el instanceof IntfRef x) {
            String net = x.network();
            String ext = x.extension() == null ? "" : "." + x.extension();
            if (x.hasSelector()) {
                net = "[" + x.extension() + "]";
                ext = "";
            }
            print(pre + x.kind() + ":" + x.router() + "." + net + ext + post);
        } else if (el instanceof SimpleAuto x) {
            subElements(pre, x.kind() + ":[", x, "]" + post);
        } else if (el instanceof AggAuto x) {
            String p2 = x.kind() + ":[";
            if (x.net() != null) {
                p2 += "ip = " + x.net() + " & ";
            }
            subElements(pre, p2, x, "]" + post);
        } else if (el instanceof IntfAuto x) {
            String p2 = x.kind() + ":[";
            if (x.managed()) {
                p2 += "managed & ";
            }
            subElements(pre, p2, x, "].[" + x.selector() + "]" + post);
        } else if (el instanceof Intersection x) {
            intersection(pre, x.list(), post);
        } else if (el instanceof Complement x) {
            element(pre + "! ", x.element(), post);
        } else if (el instanceof User) {
            print(pre + "user" + post);
        } else {
            throw new IllegalStateException("Unknown element: " + el.type());
        }
    }

    private void intersection(String pre, List<Element> l, String post) {
        // Pre comment of first element was already printed with the list.
        Element first = l.get(0);
        element(pre, first, trailingComment(first, "&!"));
        int ind = pre.length();
        indent += ind;
        for (Element el : l.subList(1, l.size())) {
            String op = "&";
            if (el instanceof Complement x) {
                op += "!";
                el = x.element();
            }
            preComment(el, "&!");
            element(op + " ", el, trailingComment(el, "&!,;"));
        }
        print(post);
        indent -= ind;
    }

    /**
     * One element per line, indented by one, then stop on a line of its own.
     * Comments left over inside owner are printed before stop.
     */
    private void elementList(List<Element> l, String stop, Node owner) {
        indent++;
        for (Element el : ElementOrder.sort(l)) {
            preComment(el, ",");
            if (el instanceof Intersection) {
                // Intersection prints comments of its elements.
                element("", el, ",");
            } else {
                element("", el, "," + trailingComment(el, ",;"));
            }
        }
        if (owner != null) {
            orphanComments(owner.start(), owner.end());
        }
        indent--;
        print(stop);
    }

    /**
     * Prints {@code name = } with the first value, the other values aligned
     * below. Comments in front of the values, from {@code from} on, are
     * printed above the name.
     */
    private <T extends Node> void namedList(String name, int from, List<T> l, Show<T> show) {
        headerComments(from, firstStart(l));
        T first = l.get(0);
        preComment(first, ",");

        // Put first value on same line with name.
        String pre = name + " = ";
        int ind = pre.length();
        List<T> rest = l.subList(1, l.size());
        String post = rest.isEmpty() ? ";" : ",";
        show.show(pre, first, post + listTrailing(first));

        // Show other lines with same indentation as first line.
        if (!rest.isEmpty()) {
            indent += ind;
            for (T v : rest) {
                preComment(v, ",");
                show.show("", v, "," + listTrailing(v));
            }
            print(";");
            indent -= ind;
        }
    }

    private String listTrailing(Node n) {
        return n instanceof Intersection ? "" : trailingComment(n, ",;");
    }

    // ========================================================================
    // Services
    // ========================================================================

    private void attribute(Attribute a) {
        preComment(a, "");
        List<Value> l = a.values();

        // Short attribute without values.
        if (l.isEmpty()) {
            print(a.name() + ";" + trailingComment(a, ",;"));
            return;
        }
        namedList(a.name(), a.start(), l, (pre, v, post) -> print(pre + v.value() + post));
    }

    private void protocol(String pre, Protocol p, String post) {
        print(pre + ElementOrder.protocolText(p) + post);
    }

    private void rule(Rule r) {
        preComment(r, "");
        String action = r.deny() ? "deny  " : "permit";
        int ind = action.length() + 1;
        namedList(action + " src", r.start(), ElementOrder.sort(r.src()), this::element);
        indent += ind;
        namedList("dst", lastEnd(r.src()), ElementOrder.sort(r.dst()), this::element);
        namedList("prt", lastEnd(r.dst()), ElementOrder.sortProtocols(r.prt()), this::protocol);
        if (r.log() != null) {
            attribute(r.log());
        }
        indent -= ind;
    }

    private void service(Service s) {
        indent++;
        emptyLine();
        for (Attribute a : s.attributes()) {
            attribute(a);
        }
        emptyLine();
        if (s.foreach()) {
            headerComments(s.start(), firstStart(s.user()));
            print("user = foreach");
            elementList(s.user(), ";", null);
        } else {
            namedList("user", s.start(), ElementOrder.sort(s.user()), this::element);
        }
        for (Rule r : s.rules()) {
            rule(r);
        }
        orphanComments(s.start(), s.end());
        indent--;
        print("}" + trailingCommentAt(s.end(), ""));
    }

    // ========================================================================
    // Toplevel definitions
    // ========================================================================

    private void group(Group g) {
        elementList(g.elements(), ";" + trailingCommentAt(g.end(), ""), g);
    }

    private void toplevel(Toplevel n) {
        preComment(n, "");
        String sep = n.isList() ? " =" : " = {";
        int pos = n.start() + n.name().length();
        print(n.name() + sep + trailingCommentAt(pos, sep));

        Description d = n.description();
        if (d != null) {
            indent++;
            preComment(d, sep);
            print("description =" + d.text());
            indent--;
            emptyLine();
        }

        if (n instanceof Group g) {
            group(g);
        } else if (n instanceof Service s) {
            service(s);
        } else {
            throw new IllegalStateException("Unknown definition: " + n.type());
        }
    }

    private void file(List<? extends Toplevel> list) {
        int lastEnd = 0;
        for (int i = 0; i < list.size(); i++) {
            Toplevel t = list.get(i);
            toplevel(t);
            lastEnd = t.end();
            // Add empty line between output.
            if (i != list.size() - 1) {
                print("");
            }
        }

        // Comments at end of file.
        List<Comment> rest = comments.takeUnused(0, Integer.MAX_VALUE);
        if (rest.isEmpty()) {
            return;
        }
        if (output.length() > 0 && comments.hasBlankLine(lastEnd, rest.get(0).start())) {
            print("");
        }
        printComments(rest);
    }
}
