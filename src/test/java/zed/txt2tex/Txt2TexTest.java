package zed.txt2tex;

import org.junit.jupiter.api.Test;
import zed.txt2tex.core.ZModel.*;
import zed.txt2tex.exceptions.LexException;
import zed.txt2tex.exceptions.ParseException;
import zed.txt2tex.exceptions.StructureException;
import zed.txt2tex.exceptions.Txt2TexException;
import zed.txt2tex.gen.Dialect;
import zed.txt2tex.lexer.Token;
import zed.txt2tex.lexer.TokenType;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Txt2Tex 转换入口测试
 * <p>
 * 验证完整管道：词法、解析、生成，以及 AST 的 JSON 导出与还原。
 */
class Txt2TexTest {

    private static final String NOTES = """
            === Exercise 1 ===
            given Person

            schema Club
              members : P Person
            where
              # members <= 30
            end

            TEXT: Every club has at most $30$ members.

            PROOF:
            p => p [=> intro from 1]
              [1] p [assumption]

            TRUTH TABLE:
            p | not p
            T | F
            F | T
            """;

    // ============================================================
    // 管道
    // ============================================================

    @Test
    void testTokenize_EndsWithEof() throws Exception {
        List<Token> tokens = Txt2Tex.tokenize("p and q");
        assertEquals(TokenType.EOF, tokens.get(tokens.size() - 1).type());
        assertEquals(4, tokens.size());
    }

    @Test
    void testParse_NotesDocument() throws Exception {
        Document doc = Txt2Tex.parse(NOTES);
        assertEquals(1, doc.items().size());
        Section section = assertInstanceOf(Section.class, doc.items().get(0));
        assertEquals("Exercise 1", section.title());
        assertEquals(5, section.items().size());
        assertInstanceOf(GivenTypes.class, section.items().get(0));
        assertInstanceOf(Schema.class, section.items().get(1));
        assertInstanceOf(TextBlock.class, section.items().get(2));
        assertInstanceOf(ProofTree.class, section.items().get(3));
        assertInstanceOf(TruthTable.class, section.items().get(4));
    }

    @Test
    void testConvert_Fragment() throws Exception {
        assertEquals("$p \\land q \\implies p$", Txt2Tex.convert("p and q => p", Dialect.STANDARD));
    }

    @Test
    void testConvert_DialectsDiffer() throws Exception {
        String std = Txt2Tex.convert(NOTES, Dialect.STANDARD);
        String fuzz = Txt2Tex.convert(NOTES, Dialect.FUZZ);
        assertTrue(std.contains("\\# members \\leq 30"), std);
        assertTrue(std.contains("members : \\power Person"), std);
        assertEquals(std, fuzz, "no divergence point occurs in these notes");
    }

    @Test
    void testConvertDocument_HasPreambleAndEnd() throws Exception {
        String doc = Txt2Tex.convertDocument(NOTES, Dialect.FUZZ);
        assertTrue(doc.startsWith("\\documentclass{article}\n\\usepackage{fuzz}\n"), doc);
        assertTrue(doc.contains("\\section*{Exercise 1}"), doc);
        assertTrue(doc.endsWith("\\end{document}\n"), doc);
    }

    @Test
    void testConvertDocument_TitleAndBibliography() throws Exception {
        String source = "TITLE: Z Notes\nAUTHOR: Sam Lee\nBIBLIOGRAPHY: refs.bib\n\nTEXT: see [cite spivey92]\n";
        String doc = Txt2Tex.convertDocument(source, Dialect.STANDARD);
        assertTrue(doc.contains("\\usepackage{natbib}\n"), doc);
        assertTrue(doc.contains("\\title{Z Notes}\n\\author{Sam Lee}\n\\date{\\today}\n"), doc);
        assertTrue(doc.contains("\\begin{document}\n\n\\maketitle\n\nsee \\citep{spivey92}"), doc);
        assertTrue(doc.endsWith("\\bibliographystyle{plainnat}\n\\bibliography{refs}\n\n\\end{document}\n"), doc);
    }

    @Test
    void testConvert_EmptyInput() throws Exception {
        assertEquals("", Txt2Tex.convert("", Dialect.STANDARD));
        assertEquals("", Txt2Tex.convert("\n\n", Dialect.FUZZ));
    }

    @Test
    void testConvert_Idempotent() throws Exception {
        assertEquals(Txt2Tex.convert(NOTES, Dialect.STANDARD), Txt2Tex.convert(NOTES, Dialect.STANDARD));
    }

    // ============================================================
    // 错误分类
    // ============================================================

    @Test
    void testErrors_EachKindSurfaces() {
        Txt2TexException lex = assertThrows(LexException.class, () -> Txt2Tex.convert("x = 3y", Dialect.STANDARD));
        assertEquals(Txt2TexException.Kind.LEX, lex.kind());

        Txt2TexException parse = assertThrows(ParseException.class,
                () -> Txt2Tex.convert("schema S\n  x : N\n", Dialect.STANDARD));
        assertEquals(Txt2TexException.Kind.PARSE, parse.kind());

        Txt2TexException structure = assertThrows(StructureException.class,
                () -> Txt2Tex.convert("PROOF:\nq [x]\n  p [from 2]\n", Dialect.STANDARD));
        assertEquals(Txt2TexException.Kind.STRUCTURE, structure.kind());
        assertTrue(structure.getMessage().startsWith("StructureError at line 3, column 3:"));
    }

    // ============================================================
    // JSON
    // ============================================================

    @Test
    void testToJson_UsesKindDiscriminator() throws Exception {
        String json = Txt2Tex.toJson(Txt2Tex.parse("x in N"));
        assertTrue(json.contains("\"kind\" : \"Expr\""), json);
        assertTrue(json.contains("\"kind\" : \"BinaryOp\""), json);
        assertTrue(json.contains("\"op\" : \"MEMBER\""), json);
    }

    @Test
    void testJson_RoundTrip() throws Exception {
        Document doc = Txt2Tex.parse(NOTES);
        Document back = Txt2Tex.fromJson(Txt2Tex.toJson(doc));
        assertEquals(doc, back);
    }

    @Test
    void testJson_RoundTripOfRulesAndMetadata() throws Exception {
        String source = String.join("\n",
                "TITLE: Rules",
                "INFRULE:",
                "s elem seq[N] [premise]",
                "---",
                "#s >= 0",
                "PAGEBREAK:",
                "CONTENTS: full",
                "PURETEXT: 100% raw",
                "f(x) =",
                "  1 if x > 0",
                "  0 if x <= 0",
                "syntax",
                "  B ::= t | f",
                "end",
                "TEXT: as in [cite spivey92 p. 3]");
        Document doc = Txt2Tex.parse(source);
        assertEquals(7, doc.items().size());
        assertEquals(doc, Txt2Tex.fromJson(Txt2Tex.toJson(doc)));
    }
}
