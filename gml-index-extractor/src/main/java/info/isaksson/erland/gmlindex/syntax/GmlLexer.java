package info.isaksson.erland.gmlindex.syntax;

import info.isaksson.erland.gmlindex.model.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for GML source.
 *
 * <p>Comments, whitespace and {@code #region}/{@code #endregion} lines are dropped. A
 * {@code #macro} line becomes a {@link GmlToken.Type#MACRO} token, the tokens of its body, and a
 * {@link GmlToken.Type#MACRO_END} token at the end of the (possibly backslash-continued) line.
 * Template strings ({@code $"..."}) are kept as opaque string tokens.</p>
 */
final class GmlLexer {

    private static final String[] PUNCTUATORS = {
            "??=", "<<=", ">>=",
            "[@", "[?", "[|", "[#", "[$",
            "==", "!=", "<=", ">=", "<>", "&&", "||", "^^", "+=", "-=", "*=", "/=", "%=", "|=", "&=", "^=",
            "<<", ">>", "++", "--", "??", ":=",
            "{", "}", "(", ")", "[", "]", ";", ",", ".", ":", "?", "+", "-", "*", "/", "%", "=", "<", ">",
            "!", "~", "&", "|", "^", "@", "#"
    };

    private final String src;
    private final String filePath;
    private int pos;
    private int line = 1;
    private int lineStart;
    private boolean inMacro;

    GmlLexer(String src, String filePath) {
        this.src = src == null ? "" : src;
        this.filePath = filePath;
    }

    List<GmlToken> tokenize() {
        List<GmlToken> out = new ArrayList<>();
        while (true) {
            boolean sawNewline = skipTrivia();
            if (inMacro && (sawNewline || pos >= src.length())) {
                SourceLocation here = location();
                out.add(new GmlToken(GmlToken.Type.MACRO_END, "", here, here));
                inMacro = false;
            }
            if (pos >= src.length()) break;

            char c = src.charAt(pos);
            if (c == '#' && startsWithWord("#macro")) {
                SourceLocation start = location();
                advance("#macro".length());
                out.add(new GmlToken(GmlToken.Type.MACRO, "#macro", start, location()));
                inMacro = true;
                continue;
            }
            if (c == '#' && (startsWithWord("#region") || startsWithWord("#endregion"))) {
                while (pos < src.length() && !isLineBreak(src.charAt(pos))) pos++;
                continue;
            }
            out.add(nextToken(out.isEmpty() ? null : out.get(out.size() - 1)));
        }
        SourceLocation eof = location();
        out.add(new GmlToken(GmlToken.Type.EOF, "", eof, eof));
        return out;
    }

    private GmlToken nextToken(GmlToken previous) {
        SourceLocation start = location();
        char c = src.charAt(pos);

        if (isIdentStart(c)) {
            int s = pos;
            while (pos < src.length() && isIdentPart(src.charAt(pos))) pos++;
            return new GmlToken(GmlToken.Type.IDENTIFIER, src.substring(s, pos), start, location());
        }
        if (Character.isDigit(c) || (c == '.' && nextIsDigit() && !isValueEnd(previous))
                || (c == '$' && pos + 1 < src.length() && isHexDigit(src.charAt(pos + 1)))) {
            return number(start);
        }
        if (c == '#' && isColourLiteral()) {
            pos += 7;
            return new GmlToken(GmlToken.Type.NUMBER, src.substring(start.index, pos), start, location());
        }
        if (c == '"' || c == '\'') {
            return quoted(start, c, 1, true);
        }
        if (c == '@' && pos + 1 < src.length() && (src.charAt(pos + 1) == '"' || src.charAt(pos + 1) == '\'')) {
            return quoted(start, src.charAt(pos + 1), 2, false);
        }
        if (c == '$' && pos + 1 < src.length() && src.charAt(pos + 1) == '"') {
            return quoted(start, '"', 2, true);
        }
        for (String p : PUNCTUATORS) {
            if (src.startsWith(p, pos)) {
                pos += p.length();
                return new GmlToken(GmlToken.Type.PUNCTUATOR, p, start, location());
            }
        }
        throw new GmlParseException("Unexpected character '" + c + "'", filePath, start);
    }

    private GmlToken number(SourceLocation start) {
        int s = pos;
        if (src.charAt(pos) == '$') {
            pos++;
            while (pos < src.length() && (isHexDigit(src.charAt(pos)) || src.charAt(pos) == '_')) pos++;
        } else if (src.startsWith("0x", pos) || src.startsWith("0X", pos)) {
            pos += 2;
            while (pos < src.length() && (isHexDigit(src.charAt(pos)) || src.charAt(pos) == '_')) pos++;
        } else if (src.startsWith("0b", pos) || src.startsWith("0B", pos)) {
            pos += 2;
            while (pos < src.length() && (src.charAt(pos) == '0' || src.charAt(pos) == '1' || src.charAt(pos) == '_')) pos++;
        } else {
            while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) pos++;
            if (pos < src.length() && src.charAt(pos) == '.' && nextIsDigitAt(pos + 1)) {
                pos++;
                while (pos < src.length() && Character.isDigit(src.charAt(pos))) pos++;
            }
        }
        return new GmlToken(GmlToken.Type.NUMBER, src.substring(s, pos), start, location());
    }

    private GmlToken quoted(SourceLocation start, char quote, int prefixLength, boolean escapes) {
        int s = pos;
        pos += prefixLength;
        while (true) {
            if (pos >= src.length()) throw new GmlParseException("Unterminated string", filePath, start);
            char c = src.charAt(pos);
            if (escapes && c == '\\' && pos + 1 < src.length()) {
                pos++;
                consumeChar();
                continue;
            }
            if (c == quote) {
                pos++;
                break;
            }
            consumeChar();
        }
        return new GmlToken(GmlToken.Type.STRING, src.substring(s, pos), start, location());
    }

    /** Skips whitespace and comments; returns whether a line break was crossed outside a continuation. */
    private boolean skipTrivia() {
        boolean newline = false;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (inMacro && c == '\\' && pos + 1 < src.length() && isLineBreak(src.charAt(pos + 1))) {
                pos++;
                consumeChar();
                continue;
            }
            if (isLineBreak(c)) {
                newline = true;
                consumeChar();
                if (inMacro) return true;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (src.startsWith("//", pos)) {
                while (pos < src.length() && !isLineBreak(src.charAt(pos))) pos++;
            } else if (src.startsWith("/*", pos)) {
                SourceLocation start = location();
                pos += 2;
                while (pos < src.length() && !src.startsWith("*/", pos)) {
                    if (isLineBreak(src.charAt(pos))) newline = true;
                    consumeChar();
                }
                if (pos >= src.length()) throw new GmlParseException("Unterminated comment", filePath, start);
                pos += 2;
                if (inMacro && newline) return true;
            } else {
                break;
            }
        }
        return newline;
    }

    /** Advances one character, keeping line bookkeeping for \n, \r\n and \r. */
    private void consumeChar() {
        char c = src.charAt(pos);
        pos++;
        if (c == '\r' && pos < src.length() && src.charAt(pos) == '\n') pos++;
        if (isLineBreak(c)) {
            line++;
            lineStart = pos;
        }
    }

    private void advance(int n) {
        pos += n;
    }

    private SourceLocation location() {
        return new SourceLocation(line, pos - lineStart, pos);
    }

    private boolean startsWithWord(String word) {
        if (!src.startsWith(word, pos)) return false;
        int after = pos + word.length();
        return after >= src.length() || !isIdentPart(src.charAt(after));
    }

    /** {@code #RRGGBB}. */
    private boolean isColourLiteral() {
        if (pos + 7 > src.length()) return false;
        for (int i = pos + 1; i < pos + 7; i++) {
            if (!isHexDigit(src.charAt(i))) return false;
        }
        return pos + 7 == src.length() || !isIdentPart(src.charAt(pos + 7));
    }

    private boolean nextIsDigit() {
        return nextIsDigitAt(pos + 1);
    }

    private boolean nextIsDigitAt(int i) {
        return i < src.length() && Character.isDigit(src.charAt(i));
    }

    private static boolean isValueEnd(GmlToken t) {
        if (t == null) return false;
        return t.type == GmlToken.Type.IDENTIFIER || t.type == GmlToken.Type.NUMBER || t.type == GmlToken.Type.STRING
                || t.isPunct(")") || t.isPunct("]");
    }

    private static boolean isLineBreak(char c) {
        return c == '\n' || c == '\r' || c == '\u2028' || c == '\u2029';
    }

    static boolean isIdentStart(char c) {
        return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    static boolean isIdentPart(char c) {
        return isIdentStart(c) || (c >= '0' && c <= '9');
    }

    private static boolean isHexDigit(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
