package com.spocparser;

/**
 * Splits policy source into tokens.
 *
 * <p>Whitespace and comments ({@code #} up to end of line) are skipped.
 * The characters {@code = , ; & ! { } [ ]} are tokens of their own, every
 * other run of characters forms a single token. A token ending in
 * {@code :} or {@code .} takes a directly following {@code [} with it, which
 * yields tokens like {@code host:[}, {@code interface:r1.[} and {@code .[}.</p>
 */
public class Scanner {

    private static final int CONTEXT_WIDTH = 10;

    private final String src;
    private final String fileName;
    private int offset = 0;
    // End of the last token that wasn't end of input.
    private int tokenEnd = 0;

    public Scanner(String src, String fileName) {
        this.src = src;
        this.fileName = fileName;
    }

    public String source() {
        return src;
    }

    /**
     * Read position, just behind the last token returned.
     */
    public int offset() {
        return offset;
    }

    public Token next() {
        skipWhitespaceAndComments();
        int start = offset;
        if (offset >= src.length()) {
            return new Token(start, "");
        }
        char ch = src.charAt(offset);
        if (isDelimiter(ch)) {
            offset++;
            tokenEnd = offset;
            return new Token(start, String.valueOf(ch));
        }
        while (offset < src.length() && isTokenChar(src.charAt(offset))) {
            offset++;
        }
        char last = src.charAt(offset - 1);
        if ((last == ':' || last == '.') && offset < src.length() && src.charAt(offset) == '[') {
            offset++;
        }
        tokenEnd = offset;
        return new Token(start, src.substring(start, offset));
    }

    /**
     * Returns the raw rest of the current line as a single token.
     * Comment characters in there are part of the text.
     */
    public Token toEndOfLine() {
        int start = offset;
        int eol = src.indexOf('\n', offset);
        if (eol == -1) {
            eol = src.length();
        }
        offset = eol;
        String text = stripTrailing(src.substring(start, eol));
        tokenEnd = start + text.length();
        return new Token(start, text);
    }

    private static String stripTrailing(String text) {
        int end = text.length();
        while (end > 0 && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }

    private void skipWhitespaceAndComments() {
        while (offset < src.length()) {
            char ch = src.charAt(offset);
            if (isWhitespace(ch)) {
                offset++;
            } else if (ch == '#') {
                while (offset < src.length() && src.charAt(offset) != '\n') {
                    offset++;
                }
            } else {
                break;
            }
        }
    }

    static boolean isWhitespace(char ch) {
        return ch == ' ' || ch == '\t' || ch == '\n' || ch == '\r';
    }

    static boolean isDelimiter(char ch) {
        return switch (ch) {
            case '=', ',', ';', '&', '!', '{', '}', '[', ']' -> true;
            default -> false;
        };
    }

    static boolean isTokenChar(char ch) {
        return !isWhitespace(ch) && !isDelimiter(ch) && ch != '#';
    }

    /**
     * Builds the diagnostic for an error at the current read position.
     * At end of input the error is shown behind the last token.
     */
    public SyntaxException syntaxError(String expectation) {
        return syntaxErrorAt(offset >= src.length() ? tokenEnd : offset, expectation);
    }

    /**
     * Builds the diagnostic for an error behind source position {@code pos}.
     */
    public SyntaxException syntaxErrorAt(int pos, String expectation) {
        pos = Math.min(pos, src.length());
        int line = 1;
        for (int i = 0; i < pos; i++) {
            if (src.charAt(i) == '\n') {
                line++;
            }
        }
        return new SyntaxException(expectation, line, fileName, context(pos));
    }

    private String context(int pos) {
        int lineStart = src.lastIndexOf('\n', pos - 1) + 1;
        int lineEnd = src.indexOf('\n', pos);
        if (lineEnd == -1) {
            lineEnd = src.length();
        }
        String pre = src.substring(Math.max(lineStart, pos - CONTEXT_WIDTH), pos);
        String post = src.substring(pos, Math.min(lineEnd, pos + CONTEXT_WIDTH));
        return pre + "<--HERE-->" + stripTrailing(post);
    }
}
