package zed.txt2tex.gen;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import zed.txt2tex.core.ZModel.*;
import zed.txt2tex.exceptions.StructureException;
import zed.txt2tex.exceptions.Txt2TexException;
import zed.txt2tex.parser.Parser;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LatexGenerator 单元测试
 *
 * 检查括号最小化、两种方言的差异点，以及各类段落与证明树的输出形状。
 */
class LatexGeneratorTest {

  private static final LatexGenerator STANDARD = new LatexGenerator(Dialect.STANDARD);
  private static final LatexGenerator FUZZ = new LatexGenerator(Dialect.FUZZ);

  private static String render(LatexGenerator gen, String source) throws Txt2TexException {
    return gen.generate(Parser.parse(source));
  }

  private static String std(String source) throws Txt2TexException {
    return render(STANDARD, source);
  }

  // ============================================================
  // 表达式与括号
  // ============================================================

  @ParameterizedTest
  @CsvSource(delimiterString = ";;", value = {
    "p and q => p ;; $p \\land q \\implies p$",
    "(p or q) and r ;; $(p \\lor q) \\land r$",
    "p => (q => r) ;; $p \\implies q \\implies r$",
    "(p => q) => r ;; $(p \\implies q) \\implies r$",
    "a - (b - c) ;; $a - (b - c)$",
    "(a - b) - c ;; $a - b - c$",
    "not (p and q) ;; $\\lnot (p \\land q)$",
    "x != y ;; $x \\neq y$",
    "f x ;; $f~x$",
    "f (g x) ;; $f~(g~x)$",
    "f(x, y) ;; $f(x, y)$",
    "R~ ;; $R\\inv$",
    "x^2 ;; $x^{2}$",
    "<a, b> ;; $\\langle a, b \\rangle$",
    "<> ;; $\\langle \\rangle$",
    "{} ;; $\\emptyset$",
    "[[a]] ;; $\\lbag a \\rbag$",
    "x |-> y ;; $x \\mapsto y$",
    "1..n ;; $1 \\upto n$",
    "R(|S|) ;; $R \\limg S \\rimg$",
    "my_var ;; $\\mathit{my\\_var}$",
    "x_1 + a_i ;; $x_1 + a_i$",
    "x_12 ;; $x_{12}$",
    "a_b_c ;; $\\mathit{a\\_b\\_c}$",
    "seq[N] ;; $\\seq[\\mathbb{N}]$",
    "emptyset[N] ;; $\\emptyset[\\mathbb{N}]$",
    "Pair[A, B] ;; $Pair[A, B]$",
    "rev <a, b> ;; $rev~\\langle a, b \\rangle$",
    "dom R <| S ;; $\\dom R \\dres S$"
  })
  void testExpressions_Standard(String source, String expected) throws Exception {
    assertEquals(expected, std(source));
  }

  @Test
  void testQuantifiers() throws Exception {
    assertEquals("$\\forall x : \\mathbb{N} @ x \\geq 0$", std("forall x : N | x >= 0"));
    assertEquals("$\\forall x : \\mathbb{N} | x > 0 @ x \\geq 1$", std("forall x : N | x > 0 . x >= 1"));
    assertEquals("$\\lambda x : \\mathbb{N} @ x + 1$", std("lambda x : N . x + 1"));
    assertEquals("$\\mu x : \\mathbb{N} | x > 0$", std("mu x : N | x > 0"));
  }

  @Test
  void testSetComprehension() throws Exception {
    assertEquals("$\\{x : \\mathbb{N} | x > 0 @ x * x\\}$", std("{ x : N | x > 0 . x * x }"));
  }

  @Test
  void testQuantifierOperand_IsParenthesized() throws Exception {
    assertEquals("$p \\land (\\forall x : X @ q)$", std("p and (forall x : X . q)"));
  }

  @Test
  void testConditional() throws Exception {
    assertEquals("$\\IF x > 0 \\THEN x \\ELSE -x$", std("if x > 0 then x else - x"));
  }

  // ============================================================
  // 方言差异
  // ============================================================

  @Test
  void testDialect_PrimitiveTypes() throws Exception {
    assertEquals("$x \\in \\mathbb{N}$", render(STANDARD, "x in N"));
    assertEquals("$x \\in \\nat$", render(FUZZ, "x in N"));
    assertEquals("$y \\in \\mathbb{Z}$", render(STANDARD, "y in Z"));
    assertEquals("$y \\in \\num$", render(FUZZ, "y in Z"));
    assertEquals("$z \\in \\nat_1$", render(FUZZ, "z in N1"));
  }

  @Test
  void testDialect_PrefixFunctionOverApplication() throws Exception {
    assertEquals("$\\# f(x)$", render(STANDARD, "# f(x)"));
    assertEquals("$\\# (f(x))$", render(FUZZ, "# f(x)"));
    assertEquals("$\\# S$", render(FUZZ, "# S"));
  }

  @Test
  void testDialect_NestedSpecialFunction() throws Exception {
    assertEquals("$\\power \\power X$", render(STANDARD, "P P X"));
    assertEquals("$\\power (\\power X)$", render(FUZZ, "P P X"));
    assertEquals("$\\seq (\\finset X)$", render(FUZZ, "seq F X"));
  }

  @Test
  void testDialect_DeclarationSeparator() throws Exception {
    String source = """
        axdef
          x : N
          y : N
        where
          x < y
        end
        """;
    assertEquals("\\begin{axdef}\nx : \\mathbb{N}\ny : \\mathbb{N}\n\\where\nx < y\n\\end{axdef}",
        render(STANDARD, source));
    assertEquals("\\begin{axdef}\nx : \\nat \\\\\ny : \\nat\n\\where\nx < y\n\\end{axdef}",
        render(FUZZ, source));
  }

  @Test
  void testDialect_FromName() {
    assertEquals(Dialect.STANDARD, Dialect.fromName("zed-cm"));
    assertEquals(Dialect.STANDARD, Dialect.fromName("Standard"));
    assertEquals(Dialect.FUZZ, Dialect.fromName(" FUZZ "));
    assertThrows(IllegalArgumentException.class, () -> Dialect.fromName("latex2e"));
  }

  // ============================================================
  // Z 段落
  // ============================================================

  @Test
  void testGivenAndFreeType() throws Exception {
    assertEquals("\\begin{zed}\n[Person, Course]\n\\end{zed}", std("given Person, Course"));
    assertEquals("\\begin{zed}\nTree ::= leaf | node \\ldata Tree \\cross Tree \\rdata\n\\end{zed}",
        std("Tree ::= leaf | node <<Tree cross Tree>>"));
  }

  @Test
  void testAbbreviation_Generic() throws Exception {
    assertEquals("\\begin{zed}\nPairs[X] == X \\cross X\n\\end{zed}", std("[X] Pairs == X cross X"));
  }

  @Test
  void testZedBlock_JoinsLines() throws Exception {
    assertEquals("\\begin{zed}\n[A] \\\\\nB == \\power A\n\\end{zed}", std("zed\n  given A\n  B == P A\nend"));
  }

  @Test
  void testSchema_WithDeltaAndGroups() throws Exception {
    String source = """
        schema Add[X]
          Delta State
          x? : X
        where
          x? notin items

          items' = items union {x?}
        end
        """;
    String expected = "\\begin{schema}{Add}[X]\n"
        + "\\Delta State\n"
        + "x? : X\n"
        + "\\where\n"
        + "x? \\notin items\n"
        + "\\also\n"
        + "items' = items \\cup \\{x?\\}\n"
        + "\\end{schema}";
    assertEquals(expected, std(source));
  }

  @Test
  void testAxDef_GenericRendersAsGendef() throws Exception {
    String out = std("axdef [X]\n  f : X -> X\nend");
    assertTrue(out.startsWith("\\begin{gendef}[X]\n"), out);
    assertTrue(out.endsWith("\\end{gendef}"), out);
  }

  // ============================================================
  // 推理结构
  // ============================================================

  @Test
  void testEquivChain() throws Exception {
    String source = """
        EQUIV:
        not (p and q)
        <=> not p or not q [De Morgan]
        """;
    assertEquals("\\begin{argue}\n\\lnot (p \\land q) \\\\\n\\iff \\lnot p \\lor \\lnot q & [\\mbox{De Morgan}]\n\\end{argue}",
        std(source));
  }

  @Test
  void testTruthTable() throws Exception {
    String source = """
        TRUTH TABLE:
        p | q | p => q
        T | F | F
        F | T | T
        """;
    String expected = "\\begin{center}\n\\begin{tabular}{|c|c|c|}\n\\hline\n"
        + "$p$ & $q$ & $p \\implies q$ \\\\\n\\hline\n"
        + "T & F & F \\\\\n"
        + "F & T & T \\\\\n"
        + "\\hline\n\\end{tabular}\n\\end{center}";
    assertEquals(expected, std(source));
  }

  @Test
  void testTruthTable_HandBuiltArityMismatch() {
    TruthTable table = new TruthTable(List.of(new Identifier("p"), new Identifier("q")),
        List.of(List.of("T", "F"), List.of("T")), 7, 1);
    StructureException e = assertThrows(StructureException.class, () -> STANDARD.generateItem(table));
    assertEquals("Truth table row 2 has 1 cells but the header has 2", e.description());
    assertEquals(7, e.line());
  }

  @Test
  void testProof_SiblingPremises() throws Exception {
    String source = """
        PROOF:
        q [=> elim]
          p [premise]
          :: p => q [premise]
        """;
    assertEquals("\\begin{center}\n"
            + "$\\infer[\\mbox{$\\implies$ elim}]{q}{\\infer[\\mbox{premise}]{p}{} & "
            + "\\infer[\\mbox{premise}]{p \\implies q}{}}$\n"
            + "\\end{center}",
        std(source));
  }

  @Test
  void testProof_AssumptionDischarge() throws Exception {
    String source = """
        PROOF:
        p => p [=> intro from 1]
          [1] p [assumption]
        """;
    assertEquals("\\begin{center}\n$\\infer[\\mbox{$\\implies$ intro from 1}]{p \\implies p}{[p]^{1}}$\n\\end{center}",
        std(source));
  }

  @Test
  void testProof_ChildrenChain() throws Exception {
    String source = """
        PROOF:
        r [c]
          q [b]
            p [a]
        """;
    assertEquals("\\begin{center}\n$\\infer[\\mbox{c}]{r}{\\infer[\\mbox{b}]{q}{\\infer[\\mbox{a}]{p}{}}}$\n\\end{center}",
        std(source));
  }

  @Test
  void testProof_Cases() throws Exception {
    String source = """
        PROOF:
        r [or elim]
          p or q [premise]
          case p:
            r [x]
          case q:
            r [y]
        """;
    String out = std(source);
    assertTrue(out.contains("\\infer[\\mbox{$\\lor$ elim}]{r}{"), out);
    assertTrue(out.contains("\\infer[\\mbox{premise}]{p \\lor q}{} & \\infer[\\mbox{x}]{r}{} & \\infer[\\mbox{y}]{r}{}"), out);
  }

  @Test
  void testGenericInstantiation_Fuzz() throws Exception {
    assertEquals("$\\seq[\\nat]$", render(FUZZ, "seq[N]"));
    assertEquals("$x \\in \\power[X]$", render(FUZZ, "x elem P[X]"));
  }

  @Test
  void testIdentifier_DecorationAfterSubscript() throws Exception {
    assertEquals("$x_1' = x_1 + 1$", std("x_1' = x_1 + 1"));
  }

  @Test
  void testGuardedCases() throws Exception {
    String out = std("abs(x) =\n  x if x >= 0\n  -x if x < 0");
    assertEquals("$abs(x) = \\begin{cases} x & \\mbox{if } x \\geq 0 \\\\ -x & \\mbox{if } x < 0 \\end{cases}$", out);
  }

  @Test
  void testInfRule() throws Exception {
    String out = std("INFRULE:\np [premise]\np => q\n---\nq [=> elim]");
    assertEquals("\\begin{center}\n"
        + "$\\infer[\\mbox{$\\implies$ elim}]{q}{\\infer[\\mbox{premise}]{p}{} & p \\implies q}$\n"
        + "\\end{center}", out);
  }

  @Test
  void testInfRule_Axiom() throws Exception {
    assertEquals("\\begin{center}\n$\\infer{x = x}{}$\n\\end{center}", std("INFRULE:\n---\nx = x"));
  }

  @Test
  void testSyntaxBlock() throws Exception {
    String source = """
        syntax
          OP ::= plus | minus

          EXP ::= const<<N>>
               |  binop<<OP cross EXP>>
        end
        """;
    assertEquals("\\begin{syntax}\n"
        + "OP & ::= & plus | minus\n"
        + "\\also\n"
        + "EXP & ::= & const \\ldata \\mathbb{N} \\rdata \\\\\n"
        + "& | & binop \\ldata OP \\cross EXP \\rdata\n"
        + "\\end{syntax}", std(source));
  }

  @Test
  void testDeclaredNames_UseIdentifierRendering() throws Exception {
    assertEquals("\\begin{axdef}\n\\mathit{max\\_size} : \\mathbb{N}\n\\end{axdef}", std("axdef\n  max_size : N\nend"));
  }

  // ============================================================
  // 文本与文档
  // ============================================================

  @Test
  void testText_Citations() throws Exception {
    assertEquals("see \\citep[pp. 10-15]{spivey92} and \\citep{key_2}",
        std("TEXT: see [cite spivey92 pp. 10-15] and [cite key_2]"));
  }

  @Test
  void testPureText_EscapedOnly() throws Exception {
    assertEquals("\\bigskip\n\\noindent a \\& b \\$5", std("PURETEXT: a & b $5"));
  }

  @Test
  void testPageBreak() throws Exception {
    assertEquals("$p$\n\n\\newpage\n\n$q$", std("p\nPAGEBREAK:\nq"));
  }

  @Test
  void testContents_RegistersSectionsAndSolutions() throws Exception {
    String out = std("CONTENTS:\n=== Week 1 ===\n** Solution 1 **\np");
    assertEquals("\\setcounter{tocdepth}{1}\n\\tableofcontents\n\n"
        + "\\section*{Week 1}\n\\addcontentsline{toc}{section}{Week 1}\n\n"
        + "\\bigskip\n\\noindent\\textbf{Solution 1}\n\\addcontentsline{toc}{subsection}{Solution 1}\n\n"
        + "$p$", out);
  }

  @Test
  void testDocument_TitleBlock() throws Exception {
    Document doc = Parser.parse("TITLE: Z Notes\nSUBTITLE: Week 1\nAUTHOR: Sam Lee\nINSTITUTION: Uni\nDATE: May\np");
    String out = STANDARD.generateDocument(doc);
    assertTrue(out.contains("\\title{Z Notes \\\\\n\\large Week 1}\n\\author{Sam Lee \\\\\nUni}\n\\date{May}\n"), out);
    assertTrue(out.contains("\\begin{document}\n\n\\maketitle\n\n$p$"), out);
    assertFalse(out.contains("natbib"), out);
  }

  @Test
  void testDocument_BibliographyStyle() throws Exception {
    Document doc = Parser.parse("BIBLIOGRAPHY: refs\nBIBLIOGRAPHY_STYLE: alpha\np");
    String out = STANDARD.generateDocument(doc);
    assertTrue(out.contains("\\usepackage{natbib}\n\n\\begin{document}"), out);
    assertTrue(out.endsWith("$p$\n\n\\bibliographystyle{alpha}\n\\bibliography{refs}\n\n\\end{document}\n"), out);
  }

  @Test
  void testText_EscapesProseKeepsMath() throws Exception {
    assertEquals("Costs 50\\% \\& more when $x > 0$.", std("TEXT: Costs 50% & more when $x > 0$."));
  }

  @Test
  void testEscapeText() {
    assertEquals("a\\_b \\$ \\{c\\} \\textbackslash{}", LatexGenerator.escapeText("a_b $ {c} \\"));
  }

  @Test
  void testStructure_SectionSolutionPart() throws Exception {
    String out = std("=== Week 1 ===\n** Solution 1 **\n(a) p");
    assertEquals("\\section*{Week 1}\n\n\\bigskip\n\\noindent\\textbf{Solution 1}\n\n\\noindent (a)\n\n$p$", out);
  }

  @Test
  void testDocument_PreamblePerDialect() throws Exception {
    Document doc = Parser.parse("p");
    String std = STANDARD.generateDocument(doc);
    assertTrue(std.startsWith("\\documentclass{article}\n\\usepackage{zed-cm}\n\\usepackage{zed-maths}\n"), std);
    assertTrue(std.contains("\\begin{document}\n\n$p$\n\n\\end{document}\n"), std);
    String fuzz = FUZZ.generateDocument(doc);
    assertTrue(fuzz.contains("\\usepackage{fuzz}"), fuzz);
    assertFalse(fuzz.contains("zed-cm"), fuzz);
  }

  @Test
  void testGenerate_IsDeterministic() throws Exception {
    Document doc = Parser.parse("forall x : N | x > 0 => # {x} = 1\n\ngiven A");
    assertEquals(STANDARD.generate(doc), STANDARD.generate(doc));
    assertEquals(STANDARD.generate(doc), new LatexGenerator(Dialect.STANDARD).generate(doc));
  }
}
