package zed.txt2tex.lexer;

import java.util.*;

/**
 * 词法单元种类。
 * <p>
 * 关键字与符号的拼写在此集中登记；{@link Lexer} 对符号按长度降序做最长匹配。
 */
public enum TokenType {
  // 字面量
  IDENTIFIER(Category.LITERAL),
  NUMBER(Category.LITERAL),

  // 逻辑
  AND(Category.WORD, "and", "land", "∧"),
  OR(Category.WORD, "or", "lor", "∨"),
  NOT(Category.WORD, "not", "lnot", "¬"),
  IMPLIES(Category.SYMBOL, "=>", "⇒", "implies"),
  IFF(Category.SYMBOL, "<=>", "⇔", "iff"),

  // 约束
  FORALL(Category.WORD, "forall", "∀"),
  EXISTS(Category.WORD, "exists", "∃"),
  EXISTS1(Category.WORD, "exists1"),
  MU(Category.WORD, "mu"),
  LAMBDA(Category.WORD, "lambda"),

  // 比较
  EQUALS(Category.SYMBOL, "="),
  NOT_EQUAL(Category.SYMBOL, "!=", "/=", "≠"),
  LESS(Category.SYMBOL),
  GREATER(Category.SYMBOL),
  LESS_EQUAL(Category.SYMBOL, "<=", "≤"),
  GREATER_EQUAL(Category.SYMBOL, ">=", "≥"),
  IN(Category.WORD, "in", "elem", "∈"),
  NOT_IN(Category.WORD, "notin", "∉"),
  SUBSET_EQ(Category.WORD, "subseteq", "subset", "⊆"),
  PSUBSET(Category.WORD, "psubset", "⊂"),

  // 箭头
  REL(Category.SYMBOL, "<->", "↔"),
  FUN(Category.SYMBOL, "->", "→"),
  PFUN(Category.SYMBOL, "+->", "⇸"),
  INJ(Category.SYMBOL, ">->", "↣"),
  PINJ(Category.SYMBOL, ">+>", "⤔"),
  SURJ(Category.SYMBOL, "-->>", "↠"),
  PSURJ(Category.SYMBOL, "+->>", "⤀"),
  BIJ(Category.SYMBOL, ">->>", "⤖"),
  FFUN(Category.SYMBOL, "77->"),
  MAPLET(Category.SYMBOL, "|->", "↦"),
  RANGE(Category.SYMBOL, ".."),

  // 集合与关系
  UNION(Category.WORD, "union", "∪"),
  INTERSECT(Category.WORD, "intersect", "∩"),
  SET_MINUS(Category.SYMBOL, "\\"),
  CROSS(Category.WORD, "cross", "×"),
  DRES(Category.SYMBOL, "<|", "◁"),
  RRES(Category.SYMBOL, "|>", "▷"),
  NDRES(Category.SYMBOL, "<<|", "⩤"),
  NRRES(Category.SYMBOL, "|>>", "⩥"),
  OVERRIDE(Category.SYMBOL, "++", "⊕"),
  COMP(Category.WORD, "o9", "⨾"),
  CIRC(Category.WORD, "comp", "∘"),
  FILTER(Category.WORD, "filter", "↾"),
  UPLUS(Category.WORD, "uplus", "⊎"),

  // 算术
  PLUS(Category.SYMBOL, "+"),
  MINUS(Category.SYMBOL, "-"),
  STAR(Category.SYMBOL, "*"),
  CARET(Category.SYMBOL, "^"),
  DIV(Category.WORD, "div"),
  MOD(Category.WORD, "mod"),

  // 前缀函数
  HASH(Category.SYMBOL, "#"),
  DOM(Category.WORD, "dom"),
  RAN(Category.WORD, "ran"),
  ID(Category.WORD, "id"),
  BIGCUP(Category.WORD, "bigcup"),
  BIGCAP(Category.WORD, "bigcap"),
  POWER(Category.WORD, "P", "ℙ"),
  POWER1(Category.WORD, "P1"),
  FINSET(Category.WORD, "F", "𝔽"),
  FINSET1(Category.WORD, "F1"),
  SEQ(Category.WORD, "seq"),
  SEQ1(Category.WORD, "seq1"),
  ISEQ(Category.WORD, "iseq"),
  BAG(Category.WORD, "bag"),

  // 后缀
  TILDE(Category.SYMBOL, "~", "∼"),

  // 标点与括号
  LPAREN(Category.SYMBOL, "("),
  RPAREN(Category.SYMBOL, ")"),
  LBRACKET(Category.SYMBOL, "["),
  RBRACKET(Category.SYMBOL, "]"),
  LBRACE(Category.SYMBOL, "{"),
  RBRACE(Category.SYMBOL, "}"),
  LANGLE(Category.SYMBOL, "⟨"),
  RANGLE(Category.SYMBOL, "⟩"),
  EMPTY_SEQ(Category.SYMBOL, "<>"),
  EMPTY_SET(Category.SYMBOL, "∅", "emptyset"),
  LBAG(Category.SYMBOL, "[[", "⟦"),
  RBAG(Category.SYMBOL, "⟧"),
  LIMG(Category.SYMBOL, "(|", "⦇"),
  RIMG(Category.SYMBOL, "|)", "⦈"),
  LDATA(Category.SYMBOL, "<<", "⟪"),
  RDATA(Category.SYMBOL, "⟫"),
  COMMA(Category.SYMBOL, ","),
  SEMICOLON(Category.SYMBOL, ";"),
  COLON(Category.SYMBOL, ":"),
  PERIOD(Category.SYMBOL, ".", "•"),
  AT(Category.SYMBOL, "@"),
  PIPE(Category.SYMBOL, "|"),
  ABBREV(Category.SYMBOL, "=="),
  FREE_DEF(Category.SYMBOL, "::="),

  // 条件
  IF(Category.WORD, "if"),
  THEN(Category.WORD, "then"),
  ELSE(Category.WORD, "else"),

  // 结构块关键字
  GIVEN(Category.WORD, "given"),
  AXDEF(Category.WORD, "axdef"),
  GENDEF(Category.WORD, "gendef"),
  SCHEMA(Category.WORD, "schema"),
  ZED(Category.WORD, "zed"),
  SYNTAX(Category.WORD, "syntax"),
  WHERE(Category.WORD, "where"),
  END(Category.WORD, "end"),

  // 行首标记
  TEXT(Category.MARKER),
  LATEX(Category.MARKER),
  PROOF(Category.MARKER),
  TRUTH_TABLE(Category.MARKER),
  EQUIV(Category.MARKER),
  SECTION(Category.MARKER),
  SOLUTION(Category.MARKER),
  PART_LABEL(Category.MARKER),
  ASSUMPTION_LABEL(Category.MARKER),
  SIBLING(Category.MARKER),
  CASE(Category.MARKER),
  PURETEXT(Category.MARKER),
  PAGEBREAK(Category.MARKER),
  CONTENTS(Category.MARKER),
  INFRULE(Category.MARKER),
  RULE_LINE(Category.MARKER),
  METADATA(Category.MARKER),

  NEWLINE(Category.LAYOUT),
  EOF(Category.LAYOUT);

  public enum Category { LITERAL, WORD, SYMBOL, MARKER, LAYOUT }

  private final Category category;
  private final List<String> spellings;

  TokenType(Category category, String... spellings) {
    this.category = category;
    this.spellings = List.of(spellings);
  }

  public Category category() { return category; }

  public List<String> spellings() { return spellings; }

  public boolean isWord() { return category == Category.WORD; }

  public boolean isMarker() { return category == Category.MARKER; }

  private static final Map<String, TokenType> KEYWORDS;
  private static final List<Map.Entry<String, TokenType>> SYMBOLS;

  static {
    Map<String, TokenType> words = new HashMap<>();
    List<Map.Entry<String, TokenType>> symbols = new ArrayList<>();
    for (TokenType t : values()) {
      for (String s : t.spellings) {
        if (Character.isLetter(s.codePointAt(0)) && s.chars().allMatch(c -> c < 128)) {
          words.put(s, t);
        } else {
          symbols.add(Map.entry(s, t));
        }
      }
    }
    symbols.sort((a, b) -> Integer.compare(b.getKey().length(), a.getKey().length()));
    KEYWORDS = Collections.unmodifiableMap(words);
    SYMBOLS = Collections.unmodifiableList(symbols);
  }

  /** 查找 ASCII 单词关键字，非关键字返回 null */
  public static TokenType keyword(String word) {
    return KEYWORDS.get(word);
  }

  /** 按长度降序排列的符号拼写表 */
  static List<Map.Entry<String, TokenType>> symbols() {
    return SYMBOLS;
  }
}
