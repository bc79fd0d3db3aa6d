package zed.txt2tex.lexer;

import org.junit.jupiter.api.Test;
import zed.txt2tex.exceptions.LexException;
import zed.txt2tex.exceptions.Txt2TexException;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static zed.txt2tex.lexer.TokenType.*;

/**
 * Lexer 单元测试
 *
 * 覆盖最长匹配、尖括号判定、括号内换行、行首标记以及各类词法错误的位置。
 */
class LexerTest {

  private static List<Token> lex(String source) throws LexException {
    return new Lexer(source).tokenize();
  }

  private static List<TokenType> types(String source) throws LexException {
    List<TokenType> out = new ArrayList<>();
    for (Token t : lex(source)) {
      out.add(t.type());
    }
    return out;
  }

  // ============================================================
  // 最长匹配
  // ============================================================

  @Test
  void testLongestMatch_IffBeforeImplies() throws Exception {
    assertEquals(List.of(IDENTIFIER, IFF, IDENTIFIER, EOF), types("p <=> q"));
    assertEquals(List.of(IDENTIFIER, IMPLIES, IDENTIFIER, EOF), types("p => q"));
  }

  @Test
  void testLongestMatch_Arrows() throws Exception {
    assertEquals(List.of(IDENTIFIER, PSURJ, IDENTIFIER, EOF), types("A +->> B"));
    assertEquals(List.of(IDENTIFIER, PFUN, IDENTIFIER, EOF), types("A +-> B"));
    assertEquals(List.of(IDENTIFIER, BIJ, IDENTIFIER, EOF), types("A >->> B"));
    assertEquals(List.of(IDENTIFIER, INJ, IDENTIFIER, EOF), types("A >-> B"));
    assertEquals(List.of(IDENTIFIER, FFUN, IDENTIFIER, EOF), types("A 77-> B"));
    assertEquals(List.of(IDENTIFIER, MAPLET, NUMBER, EOF), types("x |-> 1"));
  }

  @Test
  void testKeyword_WholeWordOnly() throws Exception {
    assertEquals(List.of(IDENTIFIER, COMP, IDENTIFIER, EOF), types("R o9 S"));
    List<Token> tokens = lex("o9x");
    assertEquals(IDENTIFIER, tokens.get(0).type());
    assertEquals("o9x", tokens.get(0).text());
  }

  @Test
  void testRange_BetweenWords() throws Exception {
    assertEquals(List.of(IDENTIFIER, RANGE, IDENTIFIER, EOF), types("a..b"));
  }

  @Test
  void testNotEqual_AfterIdentifier() throws Exception {
    List<Token> tokens = lex("x!=y");
    assertEquals(List.of(IDENTIFIER, NOT_EQUAL, IDENTIFIER, EOF),
        tokens.stream().map(Token::type).toList());
    assertEquals("x", tokens.get(0).text());
  }

  @Test
  void testIdentifier_Decorations() throws Exception {
    List<Token> tokens = lex("count' = count? + 1");
    assertEquals("count'", tokens.get(0).text());
    assertEquals("count?", tokens.get(2).text());
  }

  // ============================================================
  // 尖括号与袋
  // ============================================================

  @Test
  void testAngle_SequenceVersusLess() throws Exception {
    assertEquals(List.of(LANGLE, IDENTIFIER, COMMA, IDENTIFIER, RANGLE, EOF), types("<a, b>"));
    assertEquals(List.of(IDENTIFIER, LESS, IDENTIFIER, EOF), types("x < y"));
    assertEquals(List.of(EMPTY_SEQ, EOF), types("<>"));
  }

  @Test
  void testAngle_SequenceArgumentAfterName() throws Exception {
    assertEquals(List.of(IDENTIFIER, LANGLE, IDENTIFIER, COMMA, IDENTIFIER, RANGLE, EOF), types("rev <a, b>"));
    assertEquals(List.of(IDENTIFIER, LESS, IDENTIFIER, EOF), types("x <y"));
    assertEquals(List.of(IDENTIFIER, LESS, IDENTIFIER, AND, IDENTIFIER, GREATER, IDENTIFIER, EOF),
        types("x < y and z > w"));
    assertEquals(List.of(IDENTIFIER, LESS, IDENTIFIER, EOF), types("rev<a"));
  }

  @Test
  void testEmptySet_WordSpelling() throws Exception {
    assertEquals(List.of(EMPTY_SET, LBRACKET, IDENTIFIER, RBRACKET, EOF), types("emptyset[N]"));
  }

  @Test
  void testBag_DoubleBrackets() throws Exception {
    assertEquals(List.of(LBAG, IDENTIFIER, RBAG, EOF), types("[[a]]"));
  }

  @Test
  void testRelationalImage() throws Exception {
    assertEquals(List.of(IDENTIFIER, LIMG, IDENTIFIER, RIMG, EOF), types("R(|S|)"));
  }

  @Test
  void testFreeTypeData_DoubleAngles() throws Exception {
    assertEquals(List.of(IDENTIFIER, FREE_DEF, IDENTIFIER, PIPE, IDENTIFIER, LDATA, IDENTIFIER, RDATA, EOF),
        types("Tree ::= leaf | node <<Tree>>"));
  }

  // ============================================================
  // 数字与标识符
  // ============================================================

  @Test
  void testNumber_DigitLeadingIdentifier() throws Exception {
    List<Token> tokens = lex("479_courses");
    assertEquals(IDENTIFIER, tokens.get(0).type());
    assertEquals("479_courses", tokens.get(0).text());
  }

  @Test
  void testNumber_Malformed() {
    LexException e = assertThrows(LexException.class, () -> lex("x = 12abc"));
    assertEquals(Txt2TexException.Kind.LEX, e.kind());
    assertTrue(e.description().startsWith("Malformed number '12abc'"));
    assertEquals(1, e.line());
    assertEquals(5, e.column());
  }

  // ============================================================
  // 布局
  // ============================================================

  @Test
  void testTabs_ExpandToFourColumns() throws Exception {
    List<Token> tokens = lex("\tx\n  \ty");
    assertEquals(5, tokens.get(0).column());
    Token y = tokens.get(2);
    assertEquals("y", y.text());
    assertEquals(2, y.line());
    assertEquals(5, y.column());
  }

  @Test
  void testNewlineInsideBrackets_Suppressed() throws Exception {
    assertEquals(List.of(LPAREN, IDENTIFIER, PLUS, IDENTIFIER, RPAREN, EOF), types("(x\n+ y)"));
  }

  @Test
  void testUnclosedBracket_ReportsOpener() {
    LexException e = assertThrows(LexException.class, () -> lex("f = (x +\n y"));
    assertEquals("Unclosed bracket '('", e.description());
    assertEquals(1, e.line());
    assertEquals(5, e.column());
  }

  @Test
  void testUnexpectedCharacter() {
    LexException e = assertThrows(LexException.class, () -> lex("x § y"));
    assertTrue(e.getMessage().startsWith("LexError at line 1, column 3:"));
  }

  @Test
  void testLossless_ExceptWhitespace() throws Exception {
    String source = "forall x : N | x > 0 => x >= 1\nS == {a, b} union <c>\nTEXT: the $x$ value";
    StringBuilder sb = new StringBuilder();
    for (Token t : lex(source)) {
      sb.append(t.text());
    }
    assertEquals(source.replaceAll("\\s", ""), sb.toString().replaceAll("\\s", ""));
  }

  // ============================================================
  // 行首标记
  // ============================================================

  @Test
  void testMarkers_Blocks() throws Exception {
    assertEquals(List.of(SECTION, NEWLINE, SOLUTION, NEWLINE, PART_LABEL, IDENTIFIER, EOF),
        types("=== Week 1 ===\n** Solution 2 **\n(a) p"));
    assertEquals(List.of(TRUTH_TABLE, NEWLINE, EQUIV, NEWLINE, PROOF, EOF),
        types("TRUTH TABLE:\nEQUIV:\nPROOF:"));
  }

  @Test
  void testMarkers_DocumentLevel() throws Exception {
    assertEquals(List.of(PURETEXT, NEWLINE, PAGEBREAK, NEWLINE, CONTENTS, NEWLINE, METADATA, EOF),
        types("PURETEXT: a & b\nPAGEBREAK:\nCONTENTS: full\nTITLE: Notes"));
    List<Token> tokens = lex("PURETEXT: 50% of {x}  \nAUTHOR: A. N. Other");
    assertEquals("PURETEXT: 50% of {x}", tokens.get(0).text());
    assertEquals("AUTHOR: A. N. Other", tokens.get(2).text());
  }

  @Test
  void testMarkers_InferenceRule() throws Exception {
    assertEquals(List.of(INFRULE, NEWLINE, IDENTIFIER, NEWLINE, RULE_LINE, NEWLINE, IDENTIFIER, EOF),
        types("INFRULE:\np\n-----  \nq"));
    // 行中的 --- 不是规则线
    assertEquals(List.of(IDENTIFIER, MINUS, MINUS, MINUS, IDENTIFIER, EOF), types("p --- q"));
  }

  @Test
  void testKeyword_Syntax() throws Exception {
    assertEquals(List.of(SYNTAX, NEWLINE, IDENTIFIER, FREE_DEF, IDENTIFIER, NEWLINE, PIPE, IDENTIFIER,
            NEWLINE, END, EOF),
        types("syntax\n  OP ::= plus\n     | minus\nend"));
  }

  @Test
  void testMarkers_ProofPrefixes() throws Exception {
    assertEquals(List.of(PROOF, NEWLINE, IDENTIFIER, NEWLINE, ASSUMPTION_LABEL, IDENTIFIER, NEWLINE,
            SIBLING, IDENTIFIER, NEWLINE, CASE, EOF),
        types("PROOF:\nq\n  [1] p\n  :: r\n  case p:"));
  }

  @Test
  void testMarkers_OnlyAtLineStart() throws Exception {
    List<TokenType> t = types("x = (a)");
    assertEquals(List.of(IDENTIFIER, EQUALS, LPAREN, IDENTIFIER, RPAREN, EOF), t);
  }

  @Test
  void testText_KeepsRestOfLine() throws Exception {
    List<Token> tokens = lex("TEXT: cost is $x + 1$ pounds  \ny");
    assertEquals(TEXT, tokens.get(0).type());
    assertEquals("TEXT: cost is $x + 1$ pounds", tokens.get(0).text());
    assertEquals(IDENTIFIER, tokens.get(2).type());
  }

  @Test
  void testText_UnterminatedInlineMath() {
    LexException e = assertThrows(LexException.class, () -> lex("TEXT: cost is $x"));
    assertEquals("Unterminated inline math '$'", e.description());
    assertEquals(15, e.column());
  }

  @Test
  void testText_EscapedDollarIsLiteral() throws Exception {
    assertEquals(List.of(TEXT, EOF), types("TEXT: costs \\$5"));
  }

  @Test
  void testSection_Unterminated() {
    LexException e = assertThrows(LexException.class, () -> lex("=== Week 1"));
    assertTrue(e.description().contains("section"));
  }
}
