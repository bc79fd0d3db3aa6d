package zed.txt2tex.parser;

import zed.txt2tex.core.Operator;
import zed.txt2tex.core.Precedence;
import zed.txt2tex.core.ZModel.*;
import zed.txt2tex.exceptions.ParseException;
import zed.txt2tex.exceptions.StructureException;
import zed.txt2tex.exceptions.Txt2TexException;
import zed.txt2tex.lexer.Lexer;
import zed.txt2tex.lexer.Token;
import zed.txt2tex.lexer.TokenType;
import zed.txt2tex.proof.ProofLine;
import zed.txt2tex.proof.ProofTreeBuilder;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 递归下降 + 优先级爬升解析器。
 * <p>
 * 文档层按行首标记分派到各类条目；表达式层按 {@link Precedence} 分层，
 * 约束式（量词、lambda、mu、if）在操作数位置解析并向右延伸到底。
 * 证明块只在此解析到"行"，缩进成树由 {@link ProofTreeBuilder} 完成。
 */
public final class Parser {

  private static final Logger LOGGER = Logger.getLogger(Parser.class.getName());

  private static final Map<TokenType, Operator> INFIX = new EnumMap<>(TokenType.class);
  private static final Map<TokenType, Operator> PREFIX = new EnumMap<>(TokenType.class);
  private static final Map<TokenType, Binder> BINDERS = new EnumMap<>(TokenType.class);

  static {
    INFIX.put(TokenType.IMPLIES, Operator.IMPLIES);
    INFIX.put(TokenType.IFF, Operator.IFF);
    INFIX.put(TokenType.OR, Operator.OR);
    INFIX.put(TokenType.AND, Operator.AND);
    INFIX.put(TokenType.EQUALS, Operator.EQUALS);
    INFIX.put(TokenType.NOT_EQUAL, Operator.NOT_EQUAL);
    INFIX.put(TokenType.LESS, Operator.LESS);
    INFIX.put(TokenType.GREATER, Operator.GREATER);
    INFIX.put(TokenType.LESS_EQUAL, Operator.LESS_EQUAL);
    INFIX.put(TokenType.GREATER_EQUAL, Operator.GREATER_EQUAL);
    INFIX.put(TokenType.IN, Operator.MEMBER);
    INFIX.put(TokenType.NOT_IN, Operator.NOT_MEMBER);
    INFIX.put(TokenType.SUBSET_EQ, Operator.SUBSET_EQ);
    INFIX.put(TokenType.PSUBSET, Operator.PROPER_SUBSET);
    INFIX.put(TokenType.REL, Operator.RELATION);
    INFIX.put(TokenType.FUN, Operator.TOTAL_FUN);
    INFIX.put(TokenType.PFUN, Operator.PARTIAL_FUN);
    INFIX.put(TokenType.INJ, Operator.TOTAL_INJ);
    INFIX.put(TokenType.PINJ, Operator.PARTIAL_INJ);
    INFIX.put(TokenType.SURJ, Operator.TOTAL_SURJ);
    INFIX.put(TokenType.PSURJ, Operator.PARTIAL_SURJ);
    INFIX.put(TokenType.BIJ, Operator.BIJECTION);
    INFIX.put(TokenType.FFUN, Operator.FINITE_FUN);
    INFIX.put(TokenType.MAPLET, Operator.MAPLET);
    INFIX.put(TokenType.RANGE, Operator.UPTO);
    INFIX.put(TokenType.UNION, Operator.UNION);
    INFIX.put(TokenType.INTERSECT, Operator.INTERSECT);
    INFIX.put(TokenType.SET_MINUS, Operator.SET_MINUS);
    INFIX.put(TokenType.CROSS, Operator.CROSS);
    INFIX.put(TokenType.DRES, Operator.DOM_RESTRICT);
    INFIX.put(TokenType.RRES, Operator.RAN_RESTRICT);
    INFIX.put(TokenType.NDRES, Operator.DOM_SUBTRACT);
    INFIX.put(TokenType.NRRES, Operator.RAN_SUBTRACT);
    INFIX.put(TokenType.OVERRIDE, Operator.OVERRIDE);
    INFIX.put(TokenType.COMP, Operator.FORWARD_COMPOSE);
    INFIX.put(TokenType.CIRC, Operator.BACKWARD_COMPOSE);
    INFIX.put(TokenType.FILTER, Operator.FILTER);
    INFIX.put(TokenType.UPLUS, Operator.BAG_UNION);
    INFIX.put(TokenType.CARET, Operator.CONCAT);
    INFIX.put(TokenType.PLUS, Operator.PLUS);
    INFIX.put(TokenType.MINUS, Operator.MINUS);
    INFIX.put(TokenType.STAR, Operator.TIMES);
    INFIX.put(TokenType.DIV, Operator.DIV);
    INFIX.put(TokenType.MOD, Operator.MOD);

    PREFIX.put(TokenType.MINUS, Operator.NEGATE);
    PREFIX.put(TokenType.HASH, Operator.CARD);
    PREFIX.put(TokenType.DOM, Operator.DOM);
    PREFIX.put(TokenType.RAN, Operator.RAN);
    PREFIX.put(TokenType.ID, Operator.ID);
    PREFIX.put(TokenType.BIGCUP, Operator.BIGCUP);
    PREFIX.put(TokenType.BIGCAP, Operator.BIGCAP);
    PREFIX.put(TokenType.POWER, Operator.POWER);
    PREFIX.put(TokenType.POWER1, Operator.POWER1);
    PREFIX.put(TokenType.FINSET, Operator.FINSET);
    PREFIX.put(TokenType.FINSET1, Operator.FINSET1);
    PREFIX.put(TokenType.SEQ, Operator.SEQ);
    PREFIX.put(TokenType.SEQ1, Operator.SEQ1);
    PREFIX.put(TokenType.ISEQ, Operator.ISEQ);
    PREFIX.put(TokenType.BAG, Operator.BAG);

    BINDERS.put(TokenType.FORALL, Binder.FORALL);
    BINDERS.put(TokenType.EXISTS, Binder.EXISTS);
    BINDERS.put(TokenType.EXISTS1, Binder.EXISTS1);
    BINDERS.put(TokenType.MU, Binder.MU);
    BINDERS.put(TokenType.LAMBDA, Binder.LAMBDA);
  }

  /** 结构块关键字不能当作名字 */
  private static final Set<TokenType> RESERVED = EnumSet.of(
    TokenType.GIVEN, TokenType.AXDEF, TokenType.GENDEF, TokenType.SCHEMA, TokenType.ZED, TokenType.SYNTAX,
    TokenType.WHERE, TokenType.END, TokenType.IF, TokenType.THEN, TokenType.ELSE);

  /** 出现在行首时结束当前块 */
  private static final Set<TokenType> BLOCK_START = EnumSet.of(
    TokenType.SECTION, TokenType.SOLUTION, TokenType.PART_LABEL, TokenType.TEXT, TokenType.LATEX,
    TokenType.PROOF, TokenType.TRUTH_TABLE, TokenType.EQUIV, TokenType.GIVEN, TokenType.AXDEF,
    TokenType.GENDEF, TokenType.SCHEMA, TokenType.ZED, TokenType.SYNTAX, TokenType.PURETEXT,
    TokenType.PAGEBREAK, TokenType.CONTENTS, TokenType.INFRULE, TokenType.METADATA);

  private static final Set<String> TRUE_CELLS = Set.of("T", "t", "true");
  private static final Set<String> FALSE_CELLS = Set.of("F", "f", "false");

  private final List<Token> tokens;
  private int pos;
  /** 解析约束变量类型时禁用投影，避免 {@code forall x:N.p} 被读成 {@code N.p} */
  private boolean inBindingType;

  public Parser(List<Token> tokens) {
    this.tokens = tokens;
  }

  /** 便捷入口：词法分析并解析整篇文档 */
  public static Document parse(String source) throws Txt2TexException {
    return new Parser(new Lexer(source).tokenize()).parseDocument();
  }

  // ============================================================
  // 文档层
  // ============================================================

  public Document parseDocument() throws Txt2TexException {
    List<Item> items = new ArrayList<>();
    Map<String, String> metadata = new HashMap<>();
    skipNewlines();
    while (!check(TokenType.EOF)) {
      if (check(TokenType.METADATA)) {
        parseMetadataLine(metadata);
      } else {
        items.add(parseTopItem());
      }
      skipNewlines();
    }
    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.log(Level.FINE, "Parsed {0} top-level items", items.size());
    }
    return new Document(new Metadata(metadata.get("TITLE"), metadata.get("SUBTITLE"), metadata.get("AUTHOR"),
        metadata.get("DATE"), metadata.get("INSTITUTION"), metadata.get("BIBLIOGRAPHY"),
        metadata.get("BIBLIOGRAPHY_STYLE")), items);
  }

  /** {@code TITLE: ...}、{@code BIBLIOGRAPHY: refs.bib} 等元数据行，每个字段至多一次 */
  private void parseMetadataLine(Map<String, String> metadata) throws ParseException {
    Token t = advance();
    String text = t.text();
    int colon = text.indexOf(':');
    String field = text.substring(0, colon);
    String value = text.substring(colon + 1).strip();
    if (value.isEmpty()) {
      throw error(t, "Expected a value after " + field + ":", "text");
    }
    if (metadata.putIfAbsent(field, value) != null) {
      throw error(t, "Duplicate " + field + ": line", "newline");
    }
    expectLineEnd(field + ":");
  }

  /** 整个单元序列是一个表达式（内联数学片段用） */
  public Expr parseStandaloneExpression() throws ParseException {
    skipNewlines();
    Expr e = parseExpression();
    skipNewlines();
    if (!check(TokenType.EOF)) {
      throw error(peek(), "Unexpected " + describe(peek()) + " after expression", "end of input");
    }
    return e;
  }

  private Item parseTopItem() throws Txt2TexException {
    return switch (peek().type()) {
      case SECTION -> parseSection();
      case SOLUTION -> parseSolution();
      case PART_LABEL -> parsePart();
      default -> parseItem();
    };
  }

  private Section parseSection() throws Txt2TexException {
    Token t = advance();
    String text = t.text();
    String title = text.substring(3, text.length() - 3).strip();
    expectLineEnd("section heading");
    List<Item> items = new ArrayList<>();
    skipNewlines();
    while (!check(TokenType.EOF) && !check(TokenType.SECTION)) {
      if (check(TokenType.SOLUTION)) {
        items.add(parseSolution());
      } else if (check(TokenType.PART_LABEL)) {
        items.add(parsePart());
      } else {
        items.add(parseItem());
      }
      skipNewlines();
    }
    return new Section(title, items);
  }

  private Solution parseSolution() throws Txt2TexException {
    Token t = advance();
    String text = t.text();
    String label = text.substring(2, text.length() - 2).strip();
    expectLineEnd("solution heading");
    List<Item> items = new ArrayList<>();
    skipNewlines();
    while (!check(TokenType.EOF) && !check(TokenType.SECTION) && !check(TokenType.SOLUTION)) {
      items.add(check(TokenType.PART_LABEL) ? parsePart() : parseItem());
      skipNewlines();
    }
    return new Solution(label, items);
  }

  private Part parsePart() throws Txt2TexException {
    Token t = advance();
    String label = t.text().substring(1, t.text().length() - 1);
    List<Item> items = new ArrayList<>();
    match(TokenType.NEWLINE);
    skipNewlines();
    while (!check(TokenType.EOF) && !check(TokenType.SECTION) && !check(TokenType.SOLUTION)
        && !check(TokenType.PART_LABEL)) {
      items.add(parseItem());
      skipNewlines();
    }
    return new Part(label, items);
  }

  private Item parseItem() throws Txt2TexException {
    return switch (peek().type()) {
      case TEXT -> parseText();
      case LATEX -> parseRawLatex();
      case PROOF -> parseProof();
      case TRUTH_TABLE -> parseTruthTable();
      case EQUIV -> parseEquivChain();
      case GIVEN -> parseGiven();
      case AXDEF -> parseAxDef();
      case GENDEF -> parseGenDef();
      case SCHEMA -> parseSchema();
      case ZED -> parseZedBlock();
      case SYNTAX -> parseSyntax();
      case PURETEXT -> parsePureText();
      case PAGEBREAK -> parsePageBreak();
      case CONTENTS -> parseContents();
      case INFRULE -> parseInfRule();
      case METADATA -> throw error(peek(), "Document metadata must come before the first section", "section");
      default -> parseDefinitionOrExpression();
    };
  }

  private Item parseDefinitionOrExpression() throws Txt2TexException {
    if (check(TokenType.LBRACKET) && isGenericAbbreviation()) {
      List<String> generics = parseGenericParams();
      String name = expectName("abbreviation name").text();
      expect(TokenType.ABBREV, "'=='");
      return finishAbbreviation(name, generics);
    }
    if (isName(peek()) && peekAt(1).is(TokenType.FREE_DEF)) {
      return parseFreeType();
    }
    if (isName(peek()) && peekAt(1).is(TokenType.ABBREV)) {
      String name = advance().text();
      advance();
      return finishAbbreviation(name, List.of());
    }
    if (isName(peek()) && peekAt(1).is(TokenType.LBRACKET) && peek().touches(peekAt(1))
        && isGenericSuffixAbbreviation()) {
      String name = advance().text();
      List<String> generics = parseGenericParams();
      expect(TokenType.ABBREV, "'=='");
      return finishAbbreviation(name, generics);
    }
    Expr e = parseExpression();
    expectLineEnd("expression");
    return new ExprItem(e);
  }

  private Abbreviation finishAbbreviation(String name, List<String> generics) throws ParseException {
    Expr body = parseExpression();
    expectLineEnd("abbreviation");
    return new Abbreviation(name, generics, body);
  }

  private boolean isGenericAbbreviation() {
    int i = skipBracketedNames(pos);
    return i > 0 && isName(tokenAt(i)) && tokenAt(i + 1).is(TokenType.ABBREV);
  }

  private boolean isGenericSuffixAbbreviation() {
    int i = skipBracketedNames(pos + 1);
    return i > 0 && tokenAt(i).is(TokenType.ABBREV);
  }

  /** 从 {@code [} 开始跳过 {@code [A, B]}，返回其后位置；形状不符返回 -1 */
  private int skipBracketedNames(int i) {
    if (!tokenAt(i).is(TokenType.LBRACKET)) {
      return -1;
    }
    i++;
    while (true) {
      if (!isName(tokenAt(i))) {
        return -1;
      }
      i++;
      if (tokenAt(i).is(TokenType.COMMA)) {
        i++;
      } else if (tokenAt(i).is(TokenType.RBRACKET)) {
        return i + 1;
      } else {
        return -1;
      }
    }
  }

  private TextBlock parseText() throws Txt2TexException {
    Token t = advance();
    expectLineEnd("TEXT");
    return new TextBlock(TextSplitter.split(t));
  }

  private RawLatex parseRawLatex() throws ParseException {
    Token t = advance();
    expectLineEnd("LATEX");
    return new RawLatex(t.text().substring("LATEX:".length()).strip());
  }

  private PureText parsePureText() throws ParseException {
    Token t = advance();
    expectLineEnd("PURETEXT");
    return new PureText(t.text().substring("PURETEXT:".length()).strip());
  }

  private PageBreak parsePageBreak() throws ParseException {
    advance();
    expectLineEnd("PAGEBREAK:");
    return new PageBreak();
  }

  /** {@code CONTENTS:} 只列节；{@code CONTENTS: full} 或 {@code CONTENTS: 2} 连同小节 */
  private Contents parseContents() throws ParseException {
    Token t = advance();
    String depth = t.text().substring("CONTENTS:".length()).strip();
    expectLineEnd("CONTENTS:");
    return switch (depth) {
      case "", "1" -> new Contents(1);
      case "full", "2" -> new Contents(2);
      default -> throw error(t, "Unknown table of contents depth '" + depth + "'", "'full'", "'2'");
    };
  }

  // ============================================================
  // Z 段落
  // ============================================================

  private GivenTypes parseGiven() throws ParseException {
    advance();
    List<String> names = parseNameList("given type name");
    expectLineEnd("given types");
    return new GivenTypes(names);
  }

  private FreeType parseFreeType() throws ParseException {
    String name = advance().text();
    expect(TokenType.FREE_DEF, "'::='");
    List<Branch> branches = new ArrayList<>();
    do {
      branches.add(parseConstructor());
    } while (match(TokenType.PIPE));
    expectLineEnd("free type");
    return new FreeType(name, branches);
  }

  private Branch parseConstructor() throws ParseException {
    String branch = expectName("constructor name").text();
    Expr arg = null;
    if (match(TokenType.LDATA)) {
      arg = parseExpression();
      expect(TokenType.RDATA, "'>>'");
    } else if (match(TokenType.LANGLE)) {
      arg = parseExpression();
      expect(TokenType.RANGLE, "'⟩'");
    }
    return new Branch(branch, arg);
  }

  /**
   * {@code syntax ... end}：每行一个产生式 {@code NAME ::= a | b}，以 {@code |} 开头的行续写上一个产生式，
   * 空行分组。
   */
  private SyntaxBlock parseSyntax() throws ParseException {
    Token opener = advance();
    if (!atLineEnd()) {
      throw error(peek(), "Unexpected " + describe(peek()) + " after syntax", "newline");
    }
    List<List<SyntaxRule>> groups = new ArrayList<>();
    List<SyntaxRule> current = new ArrayList<>();
    while (true) {
      int newlines = countNewlines();
      if (match(TokenType.END)) {
        break;
      }
      if (atBlockBoundary()) {
        throw missingEnd("syntax", opener);
      }
      if (newlines >= 2 && !current.isEmpty()) {
        groups.add(current);
        current = new ArrayList<>();
      }
      current.add(parseSyntaxRule());
      if (!atLineEnd()) {
        throw error(peek(), "Unexpected " + describe(peek()) + " after syntax production", "newline", "'|'");
      }
    }
    if (current.isEmpty() && groups.isEmpty()) {
      throw error(previous(), "Syntax block needs at least one production", "identifier");
    }
    if (!current.isEmpty()) {
      groups.add(current);
    }
    expectLineEnd("end");
    return new SyntaxBlock(groups);
  }

  private SyntaxRule parseSyntaxRule() throws ParseException {
    String name = expectName("syntax category").text();
    expect(TokenType.FREE_DEF, "'::='");
    List<List<Branch>> lines = new ArrayList<>();
    List<Branch> line = new ArrayList<>();
    line.add(parseConstructor());
    while (true) {
      if (match(TokenType.PIPE)) {
        line.add(parseConstructor());
      } else if (check(TokenType.NEWLINE) && peekAt(1).is(TokenType.PIPE)) {
        advance();
        advance();
        lines.add(line);
        line = new ArrayList<>();
        line.add(parseConstructor());
      } else {
        break;
      }
    }
    lines.add(line);
    return new SyntaxRule(name, lines);
  }

  private AxDef parseAxDef() throws ParseException {
    Token opener = advance();
    List<String> generics = parseGenericParams();
    expectLineEnd("axdef header");
    List<Declaration> decls = parseDeclarations("axdef", opener, null);
    List<List<Expr>> predicates = parsePredicates("axdef", opener);
    return new AxDef(generics, decls, predicates);
  }

  private GenDef parseGenDef() throws ParseException {
    Token opener = advance();
    if (!check(TokenType.LBRACKET)) {
      throw error(peek(), "gendef requires generic parameters", "'['");
    }
    List<String> generics = parseGenericParams();
    expectLineEnd("gendef header");
    List<Declaration> decls = parseDeclarations("gendef", opener, null);
    List<List<Expr>> predicates = parsePredicates("gendef", opener);
    return new GenDef(generics, decls, predicates);
  }

  private Schema parseSchema() throws ParseException {
    Token opener = advance();
    String name = null;
    if (isName(peek())) {
      name = advance().text();
    }
    List<String> generics = parseGenericParams();
    expectLineEnd("schema header");
    List<String> inclusions = new ArrayList<>();
    List<Declaration> decls = parseDeclarations("schema", opener, inclusions);
    List<List<Expr>> predicates = parsePredicates("schema", opener);
    return new Schema(name, generics, inclusions, decls, predicates);
  }

  private ZedBlock parseZedBlock() throws Txt2TexException {
    Token opener = advance();
    expectLineEnd("zed");
    List<Item> items = new ArrayList<>();
    while (true) {
      skipNewlines();
      if (match(TokenType.END)) {
        break;
      }
      if (check(TokenType.GIVEN)) {
        items.add(parseGiven());
        continue;
      }
      if (atBlockBoundary()) {
        throw missingEnd("zed", opener);
      }
      items.add(parseDefinitionOrExpression());
    }
    expectLineEnd("end");
    return new ZedBlock(items);
  }

  private List<String> parseGenericParams() throws ParseException {
    if (!check(TokenType.LBRACKET)) {
      return List.of();
    }
    advance();
    List<String> names = parseNameList("generic parameter");
    expect(TokenType.RBRACKET, "']'");
    return names;
  }

  /**
   * 解析声明区直到 {@code where} 或 {@code end}。
   * {@code inclusions} 非空时允许单独一个模式名成行（模式引入）。
   */
  private List<Declaration> parseDeclarations(String block, Token opener, List<String> inclusions)
      throws ParseException {
    List<Declaration> decls = new ArrayList<>();
    while (true) {
      skipNewlines();
      if (check(TokenType.WHERE) || check(TokenType.END)) {
        return decls;
      }
      if (atBlockBoundary()) {
        throw missingEnd(block, opener);
      }
      do {
        String included = inclusions == null ? null : tryInclusion();
        if (included != null) {
          inclusions.add(included);
        } else {
          List<String> names = parseNameList("declared name");
          expect(TokenType.COLON, "':'");
          decls.add(new Declaration(names, parseExpression()));
        }
      } while (match(TokenType.SEMICOLON));
      expectLineEnd("declaration");
    }
  }

  private String tryInclusion() {
    Token t = peek();
    if (!isName(t)) {
      return null;
    }
    Token next = peekAt(1);
    if (isDeclarationEnd(next)) {
      advance();
      return t.text();
    }
    boolean delta = t.text().equals("Delta") || t.text().equals("Xi")
        || t.text().equals("Δ") || t.text().equals("Ξ");
    if (delta && isName(next) && isDeclarationEnd(peekAt(2))) {
      advance();
      advance();
      return t.text() + " " + next.text();
    }
    return null;
  }

  private static boolean isDeclarationEnd(Token t) {
    return t.is(TokenType.NEWLINE) || t.is(TokenType.EOF) || t.is(TokenType.SEMICOLON);
  }

  /** 解析 {@code where ... end}，空行分隔谓词组 */
  private List<List<Expr>> parsePredicates(String block, Token opener) throws ParseException {
    List<List<Expr>> groups = new ArrayList<>();
    if (match(TokenType.END)) {
      expectLineEnd("end");
      return groups;
    }
    expect(TokenType.WHERE, "'where'");
    List<Expr> current = new ArrayList<>();
    while (true) {
      int newlines = countNewlines();
      if (match(TokenType.END)) {
        break;
      }
      if (atBlockBoundary()) {
        throw missingEnd(block, opener);
      }
      if (newlines >= 2 && !current.isEmpty()) {
        groups.add(current);
        current = new ArrayList<>();
      }
      do {
        current.add(parseExpression());
      } while (match(TokenType.SEMICOLON));
      if (!atLineEnd() && !check(TokenType.END)) {
        throw error(peek(), "Unexpected " + describe(peek()) + " after predicate", "newline", "';'", "'end'");
      }
    }
    if (!current.isEmpty()) {
      groups.add(current);
    }
    expectLineEnd("end");
    return groups;
  }

  private ParseException missingEnd(String block, Token opener) {
    return error(peek(), "Expected 'end' to close " + block + " block opened at line " + opener.line(), "'end'");
  }

  private boolean atBlockBoundary() {
    return check(TokenType.EOF) || BLOCK_START.contains(peek().type());
  }

  // ============================================================
  // 推理结构：等价链、真值表、证明树
  // ============================================================

  private EquivChain parseEquivChain() throws ParseException {
    advance();
    expectLineEnd("EQUIV:");
    skipNewlines();
    List<EquivStep> steps = new ArrayList<>();
    Expr first = parseExpression();
    steps.add(new EquivStep(first, parseJustification()));
    expectLineEnd("equivalence step");
    while (match(TokenType.IFF)) {
      Expr e = parseExpression();
      steps.add(new EquivStep(e, parseJustification()));
      expectLineEnd("equivalence step");
    }
    if (steps.size() < 2) {
      throw error(peek(), "Equivalence chain needs at least one '<=>' step", "'<=>'");
    }
    return new EquivChain(steps);
  }

  private TruthTable parseTruthTable() throws Txt2TexException {
    Token marker = advance();
    expectLineEnd("TRUTH TABLE:");
    skipNewlines();
    List<Expr> header = new ArrayList<>();
    do {
      header.add(parseExpression());
    } while (match(TokenType.PIPE));
    expectLineEnd("truth table header");

    List<List<String>> rows = new ArrayList<>();
    while (atTruthRow()) {
      Token rowStart = peek();
      List<String> row = new ArrayList<>();
      do {
        Token cell = peek();
        if (!isTruthCell(cell)) {
          throw error(cell, "Expected a truth value", "'T'", "'F'");
        }
        advance();
        row.add(TRUE_CELLS.contains(cell.text()) ? "T" : "F");
      } while (match(TokenType.PIPE));
      if (row.size() != header.size()) {
        throw new StructureException("Truth table row has " + row.size() + " cells but the header has "
            + header.size(), rowStart.line(), rowStart.column());
      }
      expectLineEnd("truth table row");
      rows.add(row);
    }
    if (rows.isEmpty()) {
      throw error(peek(), "Truth table needs at least one row", "'T'", "'F'");
    }
    return new TruthTable(header, rows, marker.line(), marker.column());
  }

  private static boolean isTruthCell(Token t) {
    return TRUE_CELLS.contains(t.text()) || FALSE_CELLS.contains(t.text());
  }

  /** 真值单元后紧跟 {@code |} 或行尾才是新的一行，{@code F = {1}} 这类表达式结束表格 */
  private boolean atTruthRow() {
    if (!isTruthCell(peek())) {
      return false;
    }
    Token next = peekAt(1);
    return next.is(TokenType.PIPE) || next.is(TokenType.NEWLINE) || next.is(TokenType.EOF);
  }

  /** {@code INFRULE:} 之后若干前提行，一条 {@code ---} 线，最后一行结论；每行可带 {@code [标签]} */
  private InfRule parseInfRule() throws ParseException {
    Token marker = advance();
    expectLineEnd("INFRULE:");
    skipNewlines();
    List<RuleLine> premises = new ArrayList<>();
    while (!check(TokenType.RULE_LINE)) {
      if (atBlockBoundary()) {
        throw error(peek(), "Expected a '---' line in the inference rule opened at line " + marker.line(), "'---'");
      }
      premises.add(parseRuleLine("premise"));
      skipNewlines();
    }
    advance();
    expectLineEnd("'---'");
    skipNewlines();
    if (atBlockBoundary()) {
      throw error(peek(), "Expected the conclusion of the inference rule below '---'", "expression");
    }
    RuleLine conclusion = parseRuleLine("conclusion");
    return new InfRule(premises, conclusion);
  }

  private RuleLine parseRuleLine(String what) throws ParseException {
    Expr expr = parseExpression();
    String label = parseJustification();
    expectLineEnd(what);
    return new RuleLine(expr, label);
  }

  private ProofTree parseProof() throws Txt2TexException {
    Token marker = advance();
    expectLineEnd("PROOF:");
    skipNewlines();
    if (atBlockBoundary()) {
      throw error(peek(), "Expected proof steps after PROOF:", "proof step");
    }
    int rootColumn = peek().column();
    List<ProofLine> lines = new ArrayList<>();
    lines.add(parseProofLine());
    while (true) {
      int newlines = countNewlines();
      if (atBlockBoundary()) {
        break;
      }
      // 空行后回到根列或更左：证明结束
      if (newlines >= 1 && peek().column() <= rootColumn) {
        break;
      }
      lines.add(parseProofLine());
    }
    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.log(Level.FINE, "Proof at line {0}: {1} lines", new Object[]{marker.line(), lines.size()});
    }
    return new ProofTree(ProofTreeBuilder.build(lines));
  }

  private ProofLine parseProofLine() throws ParseException {
    Token first = peek();
    if (first.is(TokenType.CASE)) {
      advance();
      String text = first.text();
      String tag = text.substring("case".length(), text.lastIndexOf(':')).strip();
      expectLineEnd("case");
      return ProofLine.caseLine(tag, first.line(), first.column());
    }
    Integer label = null;
    boolean sibling = false;
    while (true) {
      if (check(TokenType.ASSUMPTION_LABEL) && label == null) {
        String text = advance().text();
        label = Integer.valueOf(text.substring(1, text.length() - 1));
      } else if (check(TokenType.SIBLING) && !sibling) {
        advance();
        sibling = true;
      } else {
        break;
      }
    }
    Expr expr = parseExpression();
    String justification = parseJustification();
    expectLineEnd("proof step");
    return new ProofLine(first.line(), first.column(), null, label, sibling, expr, justification);
  }

  /**
   * 可选的 {@code [理由]}。理由按原单元拼回文本，单元之间有空白则插入一个空格。
   */
  private String parseJustification() throws ParseException {
    if (!check(TokenType.LBRACKET)) {
      return null;
    }
    Token open = advance();
    StringBuilder sb = new StringBuilder();
    Token prev = null;
    int depth = 0;
    while (true) {
      Token t = peek();
      if (t.is(TokenType.EOF) || t.is(TokenType.NEWLINE)) {
        throw error(t, "Unclosed justification opened at column " + open.column(), "']'");
      }
      if (t.is(TokenType.RBRACKET)) {
        if (depth == 0) {
          advance();
          break;
        }
        depth--;
      } else if (t.is(TokenType.LBRACKET)) {
        depth++;
      }
      advance();
      if (prev != null && !prev.touches(t)) {
        sb.append(' ');
      }
      sb.append(t.text());
      prev = t;
    }
    return sb.toString();
  }

  // ============================================================
  // 表达式
  // ============================================================

  public Expr parseExpression() throws ParseException {
    return parseBinary(Precedence.IMPLICATION);
  }

  private Expr parseBinary(Precedence min) throws ParseException {
    Expr left = parseUnary();
    while (true) {
      Operator op = INFIX.get(peek().type());
      if (op == null || op.precedence().looserThan(min)) {
        return left;
      }
      advance();
      if (check(TokenType.NEWLINE) && guardedBranchAhead()) {
        left = new BinaryOp(op, left, parseGuardedCases());
        continue;
      }
      Precedence next = op.isRightAssociative() ? op.precedence() : tighter(op.precedence());
      Expr right = parseBinary(next);
      left = new BinaryOp(op, left, right);
    }
  }

  /** 换行后的下一行形如 {@code value if guard}（{@code if} 不在行首，其后没有 {@code then}） */
  private boolean guardedBranchAhead() {
    int i = pos + 1;
    Token first = tokenAt(i);
    if (first.is(TokenType.NEWLINE) || first.is(TokenType.EOF) || first.is(TokenType.IF)
        || first.type().isMarker() || RESERVED.contains(first.type())) {
      return false;
    }
    boolean guard = false;
    for (i++; !tokenAt(i).is(TokenType.NEWLINE) && !tokenAt(i).is(TokenType.EOF); i++) {
      if (tokenAt(i).is(TokenType.IF)) {
        guard = true;
      } else if (tokenAt(i).is(TokenType.THEN)) {
        guard = false;
      }
    }
    return guard;
  }

  private GuardedCases parseGuardedCases() throws ParseException {
    List<GuardedBranch> branches = new ArrayList<>();
    while (check(TokenType.NEWLINE) && guardedBranchAhead()) {
      advance();
      Expr value = parseExpression();
      expect(TokenType.IF, "'if'");
      branches.add(new GuardedBranch(value, parseExpression()));
    }
    return new GuardedCases(branches);
  }

  private static Precedence tighter(Precedence p) {
    Precedence[] all = Precedence.values();
    return all[Math.min(p.ordinal() + 1, all.length - 1)];
  }

  private Expr parseUnary() throws ParseException {
    // 行尾是运算符时，操作数可以写在下一行
    if (check(TokenType.NEWLINE) && pos > 0 && !previous().is(TokenType.NEWLINE)) {
      advance();
    }
    Token t = peek();
    Binder binder = BINDERS.get(t.type());
    if (binder != null) {
      return parseQuantifier(binder);
    }
    if (t.is(TokenType.IF)) {
      return parseConditional();
    }
    if (t.is(TokenType.NOT)) {
      advance();
      return new UnaryOp(Operator.NOT, parseBinary(Precedence.COMPARISON));
    }
    Operator prefix = PREFIX.get(t.type());
    if (prefix != null) {
      // P、F、dom 等后面没有操作数时按普通名字处理
      if (t.type().isWord() && !canStartOperand(peekAt(1))) {
        return parsePostfix();
      }
      advance();
      return new UnaryOp(prefix, parseUnary());
    }
    return parsePostfix();
  }

  private Expr parsePostfix() throws ParseException {
    Expr expr = parsePrimary();
    while (true) {
      Token t = peek();
      Token prev = previous();
      if (t.is(TokenType.LPAREN) && prev.touches(t) && isCallable(expr)) {
        advance();
        List<Expr> args = check(TokenType.RPAREN) ? List.of() : parseExpressionList();
        expect(TokenType.RPAREN, "')'");
        expr = new Application(expr, args, false);
      } else if (t.is(TokenType.LBRACKET) && prev.touches(t) && isGenericBase(expr)) {
        expr = parseInstantiation(expr);
      } else if (t.is(TokenType.LIMG)) {
        advance();
        Expr set = parseExpression();
        expect(TokenType.RIMG, "'|)'");
        expr = new RelationalImage(expr, set);
      } else if (t.is(TokenType.PERIOD) && !inBindingType && prev.touches(t) && t.touches(peekAt(1))
          && (peekAt(1).is(TokenType.NUMBER) || peekAt(1).is(TokenType.IDENTIFIER))) {
        advance();
        expr = new Projection(expr, advance().text());
      } else if (t.is(TokenType.TILDE)) {
        advance();
        expr = new UnaryOp(Operator.INVERSE, expr);
      } else if ((t.is(TokenType.PLUS) || t.is(TokenType.STAR)) && prev.touches(t) && !canStartOperand(peekAt(1))) {
        advance();
        expr = new UnaryOp(t.is(TokenType.PLUS) ? Operator.CLOSURE : Operator.REFLEXIVE_CLOSURE, expr);
      } else if (t.is(TokenType.CARET) && prev.touches(t) && t.touches(peekAt(1))) {
        advance();
        Expr exponent = match(TokenType.MINUS)
            ? new UnaryOp(Operator.NEGATE, parsePrimary())
            : parsePrimary();
        expr = new Superscript(expr, exponent);
      } else if (isCallable(expr) && canStartPrimary(t)) {
        expr = new Application(expr, List.of(parseJuxtaposedArgument()), true);
      } else {
        return expr;
      }
    }
  }

  /** 并置实参：一个原子，连同紧贴的括号调用和投影 */
  private Expr parseJuxtaposedArgument() throws ParseException {
    Expr arg = parsePrimary();
    while (true) {
      Token t = peek();
      if (t.is(TokenType.LPAREN) && previous().touches(t) && isCallable(arg)) {
        advance();
        List<Expr> args = check(TokenType.RPAREN) ? List.of() : parseExpressionList();
        expect(TokenType.RPAREN, "')'");
        arg = new Application(arg, args, false);
      } else if (t.is(TokenType.LBRACKET) && previous().touches(t) && isGenericBase(arg)) {
        arg = parseInstantiation(arg);
      } else if (t.is(TokenType.PERIOD) && !inBindingType && previous().touches(t) && t.touches(peekAt(1))
          && (peekAt(1).is(TokenType.NUMBER) || peekAt(1).is(TokenType.IDENTIFIER))) {
        advance();
        arg = new Projection(arg, advance().text());
      } else {
        return arg;
      }
    }
  }

  private static boolean isCallable(Expr e) {
    return e instanceof Identifier || e instanceof Application;
  }

  private static boolean isGenericBase(Expr e) {
    return e instanceof Identifier || e instanceof GenericInstantiation
        || (e instanceof SetLiteral s && s.elements().isEmpty());
  }

  /** 紧贴名字的 {@code [A, B]}；允许末尾多一个逗号 */
  private Expr parseInstantiation(Expr base) throws ParseException {
    advance();
    List<Expr> params = new ArrayList<>();
    do {
      params.add(parseExpression());
    } while (match(TokenType.COMMA) && !check(TokenType.RBRACKET));
    expect(TokenType.RBRACKET, "']'");
    return new GenericInstantiation(base, params);
  }

  private Expr parsePrimary() throws ParseException {
    Token t = peek();
    switch (t.type()) {
      case IDENTIFIER -> {
        advance();
        return new Identifier(t.text());
      }
      case NUMBER -> {
        advance();
        return new NumberLiteral(t.text());
      }
      case LPAREN -> {
        advance();
        Expr first = parseExpression();
        if (match(TokenType.COMMA)) {
          List<Expr> elements = new ArrayList<>();
          elements.add(first);
          elements.addAll(parseExpressionList());
          expect(TokenType.RPAREN, "')'");
          return new TupleLiteral(elements);
        }
        expect(TokenType.RPAREN, "')'");
        return first;
      }
      case LBRACE -> {
        return parseSetExpression();
      }
      case LANGLE -> {
        advance();
        List<Expr> elements = check(TokenType.RANGLE) ? List.of() : parseExpressionList();
        expect(TokenType.RANGLE, "'>'");
        return new SequenceLiteral(elements);
      }
      case EMPTY_SEQ -> {
        advance();
        return new SequenceLiteral(List.of());
      }
      case EMPTY_SET -> {
        advance();
        return new SetLiteral(List.of());
      }
      case LBAG -> {
        advance();
        List<Expr> elements = check(TokenType.RBAG) ? List.of() : parseExpressionList();
        expect(TokenType.RBAG, "']]'");
        return new BagLiteral(elements);
      }
      default -> {
        if (PREFIX.containsKey(t.type()) && t.type().isWord()) {
          advance();
          return new Identifier(t.text());
        }
        throw error(t, "Expected an expression but found " + describe(t),
            "identifier", "number", "'('", "'{'", "'<'", "'[['");
      }
    }
  }

  private Expr parseSetExpression() throws ParseException {
    advance();
    if (match(TokenType.RBRACE)) {
      return new SetLiteral(List.of());
    }
    if (looksLikeComprehension()) {
      List<Binding> bindings = parseBindings();
      Expr predicate = null;
      Expr body = null;
      if (match(TokenType.PIPE)) {
        predicate = parseExpression();
      }
      if (matchBullet()) {
        body = parseExpression();
      }
      expect(TokenType.RBRACE, "'}'");
      return new SetComprehension(bindings, predicate, body);
    }
    List<Expr> elements = parseExpressionList();
    expect(TokenType.RBRACE, "'}'");
    return new SetLiteral(elements);
  }

  /** {@code { x, y : ...} 或 { x | ...}} 是推导式，其余是字面量 */
  private boolean looksLikeComprehension() {
    int i = pos;
    while (isName(tokenAt(i))) {
      Token next = tokenAt(i + 1);
      if (next.is(TokenType.COLON) || next.is(TokenType.PIPE)) {
        return true;
      }
      if (!next.is(TokenType.COMMA)) {
        return false;
      }
      i += 2;
    }
    return false;
  }

  private Expr parseQuantifier(Binder binder) throws ParseException {
    advance();
    List<Binding> bindings = parseBindings();
    Expr predicate = null;
    Expr body = null;
    if (match(TokenType.PIPE)) {
      predicate = parseExpression();
      if (matchBullet()) {
        body = parseExpression();
      }
    } else if (matchBullet()) {
      body = parseExpression();
    } else {
      throw error(peek(), "Expected '|' or '.' after bindings of " + binder.name().toLowerCase(Locale.ROOT),
          "'|'", "'.'", "'@'");
    }
    // forall x : T | p 与 forall x : T . p 同义
    if (body == null && binder != Binder.MU && binder != Binder.LAMBDA) {
      body = predicate;
      predicate = null;
    }
    if (binder == Binder.LAMBDA && body == null) {
      throw error(peek(), "lambda needs a body after '.'", "'.'", "'@'");
    }
    return new Quantifier(binder, bindings, predicate, body);
  }

  private List<Binding> parseBindings() throws ParseException {
    List<Binding> bindings = new ArrayList<>();
    do {
      List<String> names = parseNameList("bound variable");
      Expr type = null;
      if (match(TokenType.COLON)) {
        boolean saved = inBindingType;
        inBindingType = true;
        try {
          type = parseExpression();
        } finally {
          inBindingType = saved;
        }
      }
      bindings.add(new Binding(names, type));
    } while (match(TokenType.SEMICOLON));
    return bindings;
  }

  private Expr parseConditional() throws ParseException {
    advance();
    Expr condition = parseExpression();
    expect(TokenType.THEN, "'then'");
    Expr thenBranch = parseExpression();
    expect(TokenType.ELSE, "'else'");
    Expr elseBranch = parseExpression();
    return new Conditional(condition, thenBranch, elseBranch);
  }

  private List<Expr> parseExpressionList() throws ParseException {
    List<Expr> list = new ArrayList<>();
    do {
      list.add(parseExpression());
    } while (match(TokenType.COMMA));
    return list;
  }

  private boolean matchBullet() {
    return match(TokenType.PERIOD) || match(TokenType.AT);
  }

  private List<String> parseNameList(String what) throws ParseException {
    List<String> names = new ArrayList<>();
    do {
      names.add(expectName(what).text());
    } while (match(TokenType.COMMA));
    return names;
  }

  private Token expectName(String what) throws ParseException {
    if (!isName(peek())) {
      throw error(peek(), "Expected " + what + " but found " + describe(peek()), "identifier");
    }
    return advance();
  }

  /** 名字位置接受标识符和非结构关键字（如 {@code id}、{@code seq}） */
  private static boolean isName(Token t) {
    return t.is(TokenType.IDENTIFIER) || (t.type().isWord() && !RESERVED.contains(t.type()));
  }

  private static boolean canStartPrimary(Token t) {
    return switch (t.type()) {
      case IDENTIFIER, NUMBER, LPAREN, LBRACE, LANGLE, EMPTY_SEQ, EMPTY_SET, LBAG -> true;
      default -> false;
    };
  }

  private static boolean canStartOperand(Token t) {
    return canStartPrimary(t) || t.is(TokenType.NOT) || t.is(TokenType.IF)
        || PREFIX.containsKey(t.type()) || BINDERS.containsKey(t.type());
  }

  // ============================================================
  // 游标
  // ============================================================

  private Token peek() {
    return tokenAt(pos);
  }

  private Token peekAt(int offset) {
    return tokenAt(pos + offset);
  }

  private Token tokenAt(int i) {
    return tokens.get(Math.min(i, tokens.size() - 1));
  }

  private Token previous() {
    return pos == 0 ? null : tokens.get(pos - 1);
  }

  private Token advance() {
    Token t = peek();
    if (!t.is(TokenType.EOF)) {
      pos++;
    }
    return t;
  }

  private boolean check(TokenType type) {
    return peek().is(type);
  }

  private boolean match(TokenType type) {
    if (check(type)) {
      advance();
      return true;
    }
    return false;
  }

  private Token expect(TokenType type, String what) throws ParseException {
    if (check(type)) {
      return advance();
    }
    throw error(peek(), "Expected " + what + " but found " + describe(peek()), what);
  }

  private void skipNewlines() {
    while (match(TokenType.NEWLINE)) {
      // 跳过空行
    }
  }

  private int countNewlines() {
    int n = 0;
    while (match(TokenType.NEWLINE)) {
      n++;
    }
    return n;
  }

  private boolean atLineEnd() {
    return check(TokenType.NEWLINE) || check(TokenType.EOF);
  }

  private void expectLineEnd(String context) throws ParseException {
    if (!atLineEnd()) {
      throw error(peek(), "Unexpected " + describe(peek()) + " after " + context, "newline");
    }
    match(TokenType.NEWLINE);
  }

  private static String describe(Token t) {
    return switch (t.type()) {
      case EOF -> "end of input";
      case NEWLINE -> "end of line";
      default -> "'" + t.text() + "'";
    };
  }

  private static ParseException error(Token at, String description, String... expected) {
    String found = at.is(TokenType.EOF) ? "<end of input>" : at.text();
    return new ParseException(description, found, List.of(expected), at.line(), at.column());
  }
}
