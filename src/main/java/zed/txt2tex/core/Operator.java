package zed.txt2tex.core;

/**
 * 运算符表：每个运算符的形态、优先级、结合性、家族和 LaTeX 字形。
 *
 * <p>家族 {@link Family#PREFIX_FUNCTION} 与 {@link Family#SPECIAL_FUNCTION} 是两种方言
 * 在补括号规则上产生分歧的地方。</p>
 */
public enum Operator {
  // 逻辑
  IMPLIES(Fixity.INFIX, Precedence.IMPLICATION, Assoc.RIGHT, Family.LOGICAL, "\\implies"),
  IFF(Fixity.INFIX, Precedence.IMPLICATION, Assoc.RIGHT, Family.LOGICAL, "\\iff"),
  OR(Fixity.INFIX, Precedence.DISJUNCTION, Assoc.LEFT, Family.LOGICAL, "\\lor"),
  AND(Fixity.INFIX, Precedence.CONJUNCTION, Assoc.LEFT, Family.LOGICAL, "\\land"),
  NOT(Fixity.PREFIX, Precedence.NEGATION, Assoc.NONE, Family.LOGICAL, "\\lnot"),

  // 比较
  EQUALS(Fixity.INFIX, Precedence.COMPARISON, Assoc.LEFT, Family.RELATIONAL, "="),
  NOT_EQUAL(Fixity.INFIX, Precedence.COMPARISON, Assoc.LEFT, Family.RELATIONAL, "\\neq"),
  LESS(Fixity.INFIX, Precedence.COMPARISON, Assoc.LEFT, Family.RELATIONAL, "<"),
  GREATER(Fixity.INFIX, Precedence.COMPARISON, Assoc.LEFT, Family.RELATIONAL, ">"),
  LESS_EQUAL(Fixity.INFIX, Precedence.COMPARISON, Assoc.LEFT, Family.RELATIONAL, "\\leq"),
  GREATER_EQUAL(Fixity.INFIX, Precedence.COMPARISON, Assoc.LEFT, Family.RELATIONAL, "\\geq"),
  MEMBER(Fixity.INFIX, Precedence.COMPARISON, Assoc.LEFT, Family.RELATIONAL, "\\in"),
  NOT_MEMBER(Fixity.INFIX, Precedence.COMPARISON, Assoc.LEFT, Family.RELATIONAL, "\\notin"),
  SUBSET_EQ(Fixity.INFIX, Precedence.COMPARISON, Assoc.LEFT, Family.RELATIONAL, "\\subseteq"),
  PROPER_SUBSET(Fixity.INFIX, Precedence.COMPARISON, Assoc.LEFT, Family.RELATIONAL, "\\subset"),

  // 类型构造箭头
  RELATION(Fixity.INFIX, Precedence.FUNCTION_TYPE, Assoc.RIGHT, Family.ARROW, "\\rel"),
  TOTAL_FUN(Fixity.INFIX, Precedence.FUNCTION_TYPE, Assoc.RIGHT, Family.ARROW, "\\fun"),
  PARTIAL_FUN(Fixity.INFIX, Precedence.FUNCTION_TYPE, Assoc.RIGHT, Family.ARROW, "\\pfun"),
  TOTAL_INJ(Fixity.INFIX, Precedence.FUNCTION_TYPE, Assoc.RIGHT, Family.ARROW, "\\inj"),
  PARTIAL_INJ(Fixity.INFIX, Precedence.FUNCTION_TYPE, Assoc.RIGHT, Family.ARROW, "\\pinj"),
  TOTAL_SURJ(Fixity.INFIX, Precedence.FUNCTION_TYPE, Assoc.RIGHT, Family.ARROW, "\\surj"),
  PARTIAL_SURJ(Fixity.INFIX, Precedence.FUNCTION_TYPE, Assoc.RIGHT, Family.ARROW, "\\psurj"),
  BIJECTION(Fixity.INFIX, Precedence.FUNCTION_TYPE, Assoc.RIGHT, Family.ARROW, "\\bij"),
  FINITE_FUN(Fixity.INFIX, Precedence.FUNCTION_TYPE, Assoc.RIGHT, Family.ARROW, "\\ffun"),

  MAPLET(Fixity.INFIX, Precedence.MAPLET, Assoc.LEFT, Family.ARITHMETIC, "\\mapsto"),
  UPTO(Fixity.INFIX, Precedence.RANGE, Assoc.LEFT, Family.ARITHMETIC, "\\upto"),

  // 集合与关系
  UNION(Fixity.INFIX, Precedence.SET_RELATION, Assoc.LEFT, Family.SET, "\\cup"),
  INTERSECT(Fixity.INFIX, Precedence.SET_RELATION, Assoc.LEFT, Family.SET, "\\cap"),
  SET_MINUS(Fixity.INFIX, Precedence.SET_RELATION, Assoc.LEFT, Family.SET, "\\setminus"),
  CROSS(Fixity.INFIX, Precedence.SET_RELATION, Assoc.LEFT, Family.SET, "\\cross"),
  DOM_RESTRICT(Fixity.INFIX, Precedence.SET_RELATION, Assoc.LEFT, Family.SET, "\\dres"),
  RAN_RESTRICT(Fixity.INFIX, Precedence.SET_RELATION, Assoc.LEFT, Family.SET, "\\rres"),
  DOM_SUBTRACT(Fixity.INFIX, Precedence.SET_RELATION, Assoc.LEFT, Family.SET, "\\ndres"),
  RAN_SUBTRACT(Fixity.INFIX, Precedence.SET_RELATION, Assoc.LEFT, Family.SET, "\\nrres"),
  FORWARD_COMPOSE(Fixity.INFIX, Precedence.SET_RELATION, Assoc.LEFT, Family.SET, "\\comp"),
  BACKWARD_COMPOSE(Fixity.INFIX, Precedence.SET_RELATION, Assoc.LEFT, Family.SET, "\\circ"),
  OVERRIDE(Fixity.INFIX, Precedence.SET_RELATION, Assoc.LEFT, Family.SET, "\\oplus"),
  CONCAT(Fixity.INFIX, Precedence.SET_RELATION, Assoc.LEFT, Family.SET, "\\cat"),
  FILTER(Fixity.INFIX, Precedence.SET_RELATION, Assoc.LEFT, Family.SET, "\\filter"),
  BAG_UNION(Fixity.INFIX, Precedence.SET_RELATION, Assoc.LEFT, Family.SET, "\\uplus"),

  // 算术
  PLUS(Fixity.INFIX, Precedence.ADDITIVE, Assoc.LEFT, Family.ARITHMETIC, "+"),
  MINUS(Fixity.INFIX, Precedence.ADDITIVE, Assoc.LEFT, Family.ARITHMETIC, "-"),
  TIMES(Fixity.INFIX, Precedence.MULTIPLICATIVE, Assoc.LEFT, Family.ARITHMETIC, "*"),
  DIV(Fixity.INFIX, Precedence.MULTIPLICATIVE, Assoc.LEFT, Family.ARITHMETIC, "\\div"),
  MOD(Fixity.INFIX, Precedence.MULTIPLICATIVE, Assoc.LEFT, Family.ARITHMETIC, "\\mod"),

  // 前缀
  NEGATE(Fixity.PREFIX, Precedence.PREFIX, Assoc.NONE, Family.ARITHMETIC, "-"),
  CARD(Fixity.PREFIX, Precedence.PREFIX, Assoc.NONE, Family.PREFIX_FUNCTION, "\\#"),
  DOM(Fixity.PREFIX, Precedence.PREFIX, Assoc.NONE, Family.PREFIX_FUNCTION, "\\dom"),
  RAN(Fixity.PREFIX, Precedence.PREFIX, Assoc.NONE, Family.PREFIX_FUNCTION, "\\ran"),
  ID(Fixity.PREFIX, Precedence.PREFIX, Assoc.NONE, Family.PREFIX_FUNCTION, "\\id"),
  BIGCUP(Fixity.PREFIX, Precedence.PREFIX, Assoc.NONE, Family.PREFIX_FUNCTION, "\\bigcup"),
  BIGCAP(Fixity.PREFIX, Precedence.PREFIX, Assoc.NONE, Family.PREFIX_FUNCTION, "\\bigcap"),
  POWER(Fixity.PREFIX, Precedence.PREFIX, Assoc.NONE, Family.SPECIAL_FUNCTION, "\\power"),
  POWER1(Fixity.PREFIX, Precedence.PREFIX, Assoc.NONE, Family.SPECIAL_FUNCTION, "\\power_1"),
  FINSET(Fixity.PREFIX, Precedence.PREFIX, Assoc.NONE, Family.SPECIAL_FUNCTION, "\\finset"),
  FINSET1(Fixity.PREFIX, Precedence.PREFIX, Assoc.NONE, Family.SPECIAL_FUNCTION, "\\finset_1"),
  SEQ(Fixity.PREFIX, Precedence.PREFIX, Assoc.NONE, Family.SPECIAL_FUNCTION, "\\seq"),
  SEQ1(Fixity.PREFIX, Precedence.PREFIX, Assoc.NONE, Family.SPECIAL_FUNCTION, "\\seq_1"),
  ISEQ(Fixity.PREFIX, Precedence.PREFIX, Assoc.NONE, Family.SPECIAL_FUNCTION, "\\iseq"),
  BAG(Fixity.PREFIX, Precedence.PREFIX, Assoc.NONE, Family.SPECIAL_FUNCTION, "\\bag"),

  // 后缀
  INVERSE(Fixity.POSTFIX, Precedence.POSTFIX, Assoc.NONE, Family.SET, "\\inv"),
  CLOSURE(Fixity.POSTFIX, Precedence.POSTFIX, Assoc.NONE, Family.SET, "\\plus"),
  REFLEXIVE_CLOSURE(Fixity.POSTFIX, Precedence.POSTFIX, Assoc.NONE, Family.SET, "\\star");

  public enum Fixity { INFIX, PREFIX, POSTFIX }

  public enum Assoc { LEFT, RIGHT, NONE }

  public enum Family { LOGICAL, RELATIONAL, ARROW, SET, ARITHMETIC, PREFIX_FUNCTION, SPECIAL_FUNCTION }

  private final Fixity fixity;
  private final Precedence precedence;
  private final Assoc assoc;
  private final Family family;
  private final String glyph;

  Operator(Fixity fixity, Precedence precedence, Assoc assoc, Family family, String glyph) {
    this.fixity = fixity;
    this.precedence = precedence;
    this.assoc = assoc;
    this.family = family;
    this.glyph = glyph;
  }

  public Fixity fixity() { return fixity; }
  public Precedence precedence() { return precedence; }
  public Assoc assoc() { return assoc; }
  public Family family() { return family; }

  /** LaTeX 字形（两种方言共用） */
  public String glyph() { return glyph; }

  public boolean isRightAssociative() { return assoc == Assoc.RIGHT; }

  /** 前缀函数后是否需要空格：{@code \dom R} 需要，{@code -x} 不需要 */
  public boolean spacedPrefix() {
    return fixity == Fixity.PREFIX && glyph.startsWith("\\");
  }
}
