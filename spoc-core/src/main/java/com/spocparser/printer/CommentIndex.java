package com.spocparser.printer;

import com.spocparser.ast.Description;
import com.spocparser.ast.Toplevel;

import java.util.ArrayList;
import java.util.List;

/**
 * Position index of all comments in a source file.
 *
 * <p>Comments are never stored in the AST. The printer asks this index for
 * the comments in front of or behind a node and every comment is handed out
 * at most once.</p>
 */
public final class CommentIndex {

    /**
     * A comment from {@code #} up to end of line. {@code end} is the
     * position of the terminating newline or the end of the source.
     */
    public record Comment(int start, int end, String text) {}

    private final String src;
    private final List<Comment> comments;
    private final boolean[] used;
    private final int[] lineStarts;

    private CommentIndex(String src, List<Comment> comments) {
        this.src = src;
        this.comments = comments;
        this.used = new boolean[comments.size()];
        this.lineStarts = computeLineStarts(src);
    }

    /**
     * Collects the comments of {@code src}. The text of descriptions is
     * skipped, a {@code #} in there is no comment.
     */
    public static CommentIndex of(String src, List<? extends Toplevel> toplevels) {
        List<int[]> skip = new ArrayList<>();
        for (Toplevel t : toplevels) {
            Description d = t.description();
            if (d != null) {
                skip.add(new int[] {d.start(), d.end()});
            }
        }
        List<Comment> comments = new ArrayList<>();
        int next = 0;
        int i = 0;
        while (i < src.length()) {
            while (next < skip.size() && skip.get(next)[1] <= i) {
                next++;
            }
            if (next < skip.size() && skip.get(next)[0] <= i) {
                i = skip.get(next)[1];
                continue;
            }
            if (src.charAt(i) != '#') {
                i++;
                continue;
            }
            int eol = src.indexOf('\n', i);
            if (eol == -1) {
                eol = src.length();
            }
            comments.add(new Comment(i, eol, src.substring(i, eol).stripTrailing()));
            i = eol;
        }
        return new CommentIndex(src, comments);
    }

    private static int[] computeLineStarts(String src) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < src.length(); i++) {
            if (src.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    public List<Comment> all() {
        return List.copyOf(comments);
    }

    /**
     * 0-based line of a source position.
     */
    int lineOf(int pos) {
        int low = 0;
        int high = lineStarts.length - 1;
        int line = 0;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            if (lineStarts[mid] <= pos) {
                line = mid;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return line;
    }

    // Index of first comment starting at or after pos.
    private int firstFrom(int pos) {
        int low = 0;
        int high = comments.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (comments.get(mid).start() < pos) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    private Comment containing(int pos) {
        int i = firstFrom(pos + 1) - 1;
        if (i >= 0) {
            Comment c = comments.get(i);
            if (c.start() <= pos && pos < c.end()) {
                return c;
            }
        }
        return null;
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }

    /**
     * Position behind the last code character before {@code pos}. Whitespace,
     * comments and characters in {@code ign} don't count as code.
     */
    int boundary(int pos, String ign) {
        int i = Math.min(pos, src.length());
        while (i > 0) {
            Comment c = containing(i - 1);
            if (c != null) {
                i = c.start();
                continue;
            }
            char ch = src.charAt(i - 1);
            if (isBlank(ch) || ign.indexOf(ch) != -1) {
                i--;
                continue;
            }
            break;
        }
        return i;
    }

    /**
     * Hands out the unused comments between the preceding code and
     * {@code pos}. A comment on the same line as the preceding code belongs
     * to that code and is left alone.
     */
    public List<Comment> takePreceding(int pos, String ign) {
        int b = boundary(pos, ign);
        int codeLine = b > 0 ? lineOf(b - 1) : -1;
        List<Comment> result = new ArrayList<>();
        for (int i = firstFrom(b); i < comments.size(); i++) {
            Comment c = comments.get(i);
            if (c.start() >= pos) {
                break;
            }
            if (used[i] || lineOf(c.start()) == codeLine) {
                continue;
            }
            used[i] = true;
            result.add(c);
        }
        return result;
    }

    /**
     * Hands out the comment on the same line behind {@code pos}, if only
     * blanks and characters in {@code ign} come in between.
     *
     * @return the comment text or null
     */
    public String takeTrailing(int pos, String ign) {
        for (int i = pos; i < src.length(); i++) {
            char ch = src.charAt(i);
            if (ch == ' ' || ch == '\t' || ign.indexOf(ch) != -1) {
                continue;
            }
            if (ch == '#') {
                int k = firstFrom(i);
                if (k < comments.size() && comments.get(k).start() == i && !used[k]) {
                    used[k] = true;
                    return comments.get(k).text();
                }
            }
            break;
        }
        return null;
    }

    public boolean hasUnused(int from, int to) {
        for (int i = firstFrom(from); i < comments.size() && comments.get(i).start() < to; i++) {
            if (!used[i]) {
                return true;
            }
        }
        return false;
    }

    /**
     * Hands out all unused comments starting in {@code [from, to)}.
     */
    public List<Comment> takeUnused(int from, int to) {
        List<Comment> result = new ArrayList<>();
        for (int i = firstFrom(from); i < comments.size() && comments.get(i).start() < to; i++) {
            if (!used[i]) {
                used[i] = true;
                result.add(comments.get(i));
            }
        }
        return result;
    }

    /**
     * Checks for an empty or whitespace-only line strictly between the
     * lines of {@code from} and {@code to}.
     */
    public boolean hasBlankLine(int from, int to) {
        int first = lineOf(from) + 1;
        int last = lineOf(Math.min(to, src.length()));
        for (int line = first; line < last; line++) {
            int s = lineStarts[line];
            int e = line + 1 < lineStarts.length ? lineStarts[line + 1] : src.length();
            if (src.substring(s, e).isBlank()) {
                return true;
            }
        }
        return false;
    }
}
