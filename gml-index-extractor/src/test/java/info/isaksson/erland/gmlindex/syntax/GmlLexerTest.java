package info.isaksson.erland.gmlindex.syntax;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class GmlLexerTest {

    private static List<GmlToken> lex(String src) {
        return new GmlLexer(src, "t.gml").tokenize();
    }

    private static List<GmlToken.Type> types(List<GmlToken> tokens) {
        return tokens.stream().map(t -> t.type).collect(Collectors.toList());
    }

    @Test
    void macroBodyEndsAtLineBreak() {
        List<GmlToken> tokens = lex("#macro A 1\nb = A;");
        assertEquals(GmlToken.Type.MACRO, tokens.get(0).type);
        assertEquals("A", tokens.get(1).text);
        assertEquals("1", tokens.get(2).text);
        assertEquals(GmlToken.Type.MACRO_END, tokens.get(3).type);
        assertEquals("b", tokens.get(4).text);
        assertEquals(GmlToken.Type.EOF, tokens.get(tokens.size() - 1).type);
    }

    @Test
    void backslashContinuesMacroLine() {
        List<GmlToken> tokens = lex("#macro A 1 + \\\n 2\nx");
        long macroEnds = tokens.stream().filter(t -> t.type == GmlToken.Type.MACRO_END).count();
        assertEquals(1, macroEnds);
        int end = types(tokens).indexOf(GmlToken.Type.MACRO_END);
        assertEquals("2", tokens.get(end - 1).text);
    }

    @Test
    void crlfCountsAsOneLineBreak() {
        List<GmlToken> tokens = lex("a\r\n  b");
        GmlToken b = tokens.get(1);
        assertEquals(2, b.start.line);
        assertEquals(2, b.start.column);
        assertEquals(5, b.start.index);
    }

    @Test
    void commentsRegionsAndLiterals() {
        List<GmlToken> tokens = lex("#region setup\n// note\nc = #FF00AA; /* x */ s = $\"hp {hp}\"; n = $1F;\n#endregion\n");
        List<String> texts = tokens.stream().map(t -> t.text).collect(Collectors.toList());
        assertFalse(texts.contains("setup"));
        assertTrue(texts.contains("#FF00AA"));
        assertTrue(texts.contains("$\"hp {hp}\""));
        assertTrue(texts.contains("$1F"));
        assertFalse(texts.contains("note"));
    }

    @Test
    void accessorOpenersAreSingleTokens() {
        List<GmlToken> tokens = lex("m[? \"k\"]");
        assertEquals("[?", tokens.get(1).text);
    }

    @Test
    void unterminatedStringFails() {
        GmlParseException e = assertThrows(GmlParseException.class, () -> lex("s = \"open"));
        assertEquals(4, e.getLocation().index);
    }
}
