package info.isaksson.erland.gmlindex.syntax;

import info.isaksson.erland.gmlindex.model.SourceLocation;

/** One lexical token. {@code end} is exclusive. */
final class GmlToken {

    enum Type {
        IDENTIFIER,
        NUMBER,
        STRING,
        PUNCTUATOR,
        /** {@code #macro}; the macro body runs until the matching {@link #MACRO_END}. */
        MACRO,
        MACRO_END,
        EOF
    }

    final Type type;
    final String text;
    final SourceLocation start;
    final SourceLocation end;

    GmlToken(Type type, String text, SourceLocation start, SourceLocation end) {
        this.type = type;
        this.text = text;
        this.start = start;
        this.end = end;
    }

    boolean is(Type t, String s) {
        return type == t && text.equals(s);
    }

    boolean isPunct(String s) {
        return type == Type.PUNCTUATOR && text.equals(s);
    }

    boolean isWord(String s) {
        return type == Type.IDENTIFIER && text.equals(s);
    }

    @Override public String toString() {
        return type + "(" + text + ")@" + start;
    }
}
