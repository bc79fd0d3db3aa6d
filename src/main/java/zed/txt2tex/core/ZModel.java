package zed.txt2tex.core;

import com.fasterxml.jackson.annotation.*;
import java.util.*;

/**
 * txt2tex 抽象语法树。
 * <p>
 * 所有节点都是不可变记录，构造后即冻结；表达式节点不携带源码位置，
 * 因此 {@code equals} 就是语法同一性（证明树的分支汇合检查依赖这一点）。
 * 多态节点通过 {@code kind} 字段序列化，便于调试时导出 JSON。
 */
public final class ZModel {
  private ZModel() {}

  // ============================================================
  // 表达式
  // ============================================================

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = Identifier.class, name = "Identifier"),
    @JsonSubTypes.Type(value = NumberLiteral.class, name = "Number"),
    @JsonSubTypes.Type(value = BinaryOp.class, name = "BinaryOp"),
    @JsonSubTypes.Type(value = UnaryOp.class, name = "UnaryOp"),
    @JsonSubTypes.Type(value = Application.class, name = "Application"),
    @JsonSubTypes.Type(value = Quantifier.class, name = "Quantifier"),
    @JsonSubTypes.Type(value = SetLiteral.class, name = "SetLiteral"),
    @JsonSubTypes.Type(value = SetComprehension.class, name = "SetComprehension"),
    @JsonSubTypes.Type(value = SequenceLiteral.class, name = "SequenceLiteral"),
    @JsonSubTypes.Type(value = BagLiteral.class, name = "BagLiteral"),
    @JsonSubTypes.Type(value = TupleLiteral.class, name = "Tuple"),
    @JsonSubTypes.Type(value = Projection.class, name = "Projection"),
    @JsonSubTypes.Type(value = RelationalImage.class, name = "RelationalImage"),
    @JsonSubTypes.Type(value = Superscript.class, name = "Superscript"),
    @JsonSubTypes.Type(value = Conditional.class, name = "Conditional"),
    @JsonSubTypes.Type(value = GenericInstantiation.class, name = "GenericInstantiation"),
    @JsonSubTypes.Type(value = GuardedCases.class, name = "GuardedCases")
  })
  public sealed interface Expr permits Identifier, NumberLiteral, BinaryOp, UnaryOp, Application,
      Quantifier, SetLiteral, SetComprehension, SequenceLiteral, BagLiteral, TupleLiteral,
      Projection, RelationalImage, Superscript, Conditional, GenericInstantiation, GuardedCases {}

  /** 标识符，可带 {@code ' ? !} 装饰，或为 {@code 479_courses} 这类数字开头的名字 */
  @JsonTypeName("Identifier")
  public record Identifier(String name) implements Expr {}

  /** 数字字面量，保留源码拼写 */
  @JsonTypeName("Number")
  public record NumberLiteral(String value) implements Expr {}

  @JsonTypeName("BinaryOp")
  public record BinaryOp(Operator op, Expr left, Expr right) implements Expr {}

  /** 前缀或后缀一元运算，形态由 {@link Operator#fixity()} 决定 */
  @JsonTypeName("UnaryOp")
  public record UnaryOp(Operator op, Expr operand) implements Expr {
    @JsonIgnore
    public boolean isPostfix() {
      return op.fixity() == Operator.Fixity.POSTFIX;
    }
  }

  /**
   * 函数应用。{@code juxtaposed} 为 true 表示空格并置（{@code f x}），
   * 否则为紧贴的括号实参列表（{@code f(x, y)}）。
   */
  @JsonTypeName("Application")
  public record Application(Expr callee, List<Expr> args, boolean juxtaposed) implements Expr {
    public Application {
      args = copy(args);
    }
  }

  public enum Binder {
    FORALL("\\forall"),
    EXISTS("\\exists"),
    EXISTS1("\\exists_1"),
    MU("\\mu"),
    LAMBDA("\\lambda");

    private final String glyph;

    Binder(String glyph) { this.glyph = glyph; }

    public String glyph() { return glyph; }
  }

  /** 一组同类型的约束变量：{@code x, y : T}；类型可省略 */
  public record Binding(List<String> names, Expr type) {
    public Binding {
      names = copy(names);
    }
  }

  /**
   * 量词 / lambda / mu。谓词与主体都可为空，但不会同时为空
   * （{@code mu} 允许只有谓词）。
   */
  @JsonTypeName("Quantifier")
  public record Quantifier(Binder binder, List<Binding> bindings, Expr predicate, Expr body) implements Expr {
    public Quantifier {
      bindings = copy(bindings);
    }
  }

  /** 集合字面量；空列表即空集 */
  @JsonTypeName("SetLiteral")
  public record SetLiteral(List<Expr> elements) implements Expr {
    public SetLiteral {
      elements = copy(elements);
    }
  }

  @JsonTypeName("SetComprehension")
  public record SetComprehension(List<Binding> bindings, Expr predicate, Expr body) implements Expr {
    public SetComprehension {
      bindings = copy(bindings);
    }
  }

  @JsonTypeName("SequenceLiteral")
  public record SequenceLiteral(List<Expr> elements) implements Expr {
    public SequenceLiteral {
      elements = copy(elements);
    }
  }

  @JsonTypeName("BagLiteral")
  public record BagLiteral(List<Expr> elements) implements Expr {
    public BagLiteral {
      elements = copy(elements);
    }
  }

  @JsonTypeName("Tuple")
  public record TupleLiteral(List<Expr> elements) implements Expr {
    public TupleLiteral {
      elements = copy(elements);
    }
  }

  /** 元组/绑定投影 {@code t.1}、{@code s.field} */
  @JsonTypeName("Projection")
  public record Projection(Expr target, String selector) implements Expr {}

  /** 关系像 {@code R(| S |)} */
  @JsonTypeName("RelationalImage")
  public record RelationalImage(Expr relation, Expr set) implements Expr {}

  /** 上标（迭代/幂）{@code R^k} */
  @JsonTypeName("Superscript")
  public record Superscript(Expr base, Expr exponent) implements Expr {}

  @JsonTypeName("Conditional")
  public record Conditional(Expr condition, Expr thenBranch, Expr elseBranch) implements Expr {}

  /**
   * 泛型实例化 {@code seq[N]}、{@code Pair[A, B]}、{@code emptyset[N]}。
   * 方括号必须紧贴在名字后面，可以连写 {@code T[N][M]}。
   */
  @JsonTypeName("GenericInstantiation")
  public record GenericInstantiation(Expr base, List<Expr> params) implements Expr {
    public GenericInstantiation {
      params = copy(params);
    }
  }

  /** 分情况定义的一支：{@code value if guard} */
  public record GuardedBranch(Expr value, Expr guard) {}

  /** 行尾二元运算后换行写出的分情况定义，每行一支 */
  @JsonTypeName("GuardedCases")
  public record GuardedCases(List<GuardedBranch> branches) implements Expr {
    public GuardedCases {
      branches = copy(branches);
    }
  }

  // ============================================================
  // 文档条目
  // ============================================================

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = GivenTypes.class, name = "Given"),
    @JsonSubTypes.Type(value = FreeType.class, name = "FreeType"),
    @JsonSubTypes.Type(value = Abbreviation.class, name = "Abbreviation"),
    @JsonSubTypes.Type(value = AxDef.class, name = "AxDef"),
    @JsonSubTypes.Type(value = GenDef.class, name = "GenDef"),
    @JsonSubTypes.Type(value = Schema.class, name = "Schema"),
    @JsonSubTypes.Type(value = EquivChain.class, name = "EquivChain"),
    @JsonSubTypes.Type(value = TruthTable.class, name = "TruthTable"),
    @JsonSubTypes.Type(value = ProofTree.class, name = "ProofTree"),
    @JsonSubTypes.Type(value = TextBlock.class, name = "Text"),
    @JsonSubTypes.Type(value = ExprItem.class, name = "Expr"),
    @JsonSubTypes.Type(value = Section.class, name = "Section"),
    @JsonSubTypes.Type(value = Solution.class, name = "Solution"),
    @JsonSubTypes.Type(value = Part.class, name = "Part"),
    @JsonSubTypes.Type(value = ZedBlock.class, name = "Zed"),
    @JsonSubTypes.Type(value = RawLatex.class, name = "Latex"),
    @JsonSubTypes.Type(value = PureText.class, name = "PureText"),
    @JsonSubTypes.Type(value = PageBreak.class, name = "PageBreak"),
    @JsonSubTypes.Type(value = Contents.class, name = "Contents"),
    @JsonSubTypes.Type(value = InfRule.class, name = "InfRule"),
    @JsonSubTypes.Type(value = SyntaxBlock.class, name = "Syntax")
  })
  public sealed interface Item permits GivenTypes, FreeType, Abbreviation, AxDef, GenDef, Schema,
      EquivChain, TruthTable, ProofTree, TextBlock, ExprItem, Section, Solution, Part, ZedBlock, RawLatex,
      PureText, PageBreak, Contents, InfRule, SyntaxBlock {}

  /** 基本类型声明 {@code given A, B} */
  @JsonTypeName("Given")
  public record GivenTypes(List<String> names) implements Item {
    public GivenTypes {
      names = copy(names);
    }
  }

  /** 自由类型的一个分支；{@code argument} 非空时为构造子 */
  public record Branch(String name, Expr argument) {}

  @JsonTypeName("FreeType")
  public record FreeType(String name, List<Branch> branches) implements Item {
    public FreeType {
      branches = copy(branches);
    }
  }

  @JsonTypeName("Abbreviation")
  public record Abbreviation(String name, List<String> genericParams, Expr body) implements Item {
    public Abbreviation {
      genericParams = copy(genericParams);
    }
  }

  public record Declaration(List<String> names, Expr type) {
    public Declaration {
      names = copy(names);
    }
  }

  /**
   * 公理定义。谓词按空行分组：外层列表是组，组与组之间在输出中插入分组间隔。
   */
  @JsonTypeName("AxDef")
  public record AxDef(List<String> genericParams, List<Declaration> declarations,
                      List<List<Expr>> predicates) implements Item {
    public AxDef {
      genericParams = copy(genericParams);
      declarations = copy(declarations);
      predicates = copyGroups(predicates);
    }
  }

  @JsonTypeName("GenDef")
  public record GenDef(List<String> genericParams, List<Declaration> declarations,
                       List<List<Expr>> predicates) implements Item {
    public GenDef {
      genericParams = copy(genericParams);
      declarations = copy(declarations);
      predicates = copyGroups(predicates);
    }
  }

  /** 模式框。{@code name} 为空表示匿名模式；{@code inclusions} 是被引入的模式名 */
  @JsonTypeName("Schema")
  public record Schema(String name, List<String> genericParams, List<String> inclusions,
                       List<Declaration> declarations, List<List<Expr>> predicates) implements Item {
    public Schema {
      genericParams = copy(genericParams);
      inclusions = copy(inclusions);
      declarations = copy(declarations);
      predicates = copyGroups(predicates);
    }
  }

  public record EquivStep(Expr expr, String justification) {}

  /** 等价链：首步无运算符，后续每步以 {@code <=>} 引出 */
  @JsonTypeName("EquivChain")
  public record EquivChain(List<EquivStep> steps) implements Item {
    public EquivChain {
      steps = copy(steps);
    }
  }

  /** 真值表。每行单元格数必须与表头一致，生成前会再检查一次 */
  @JsonTypeName("TruthTable")
  public record TruthTable(List<Expr> header, List<List<String>> rows, int line, int column) implements Item {
    public TruthTable {
      header = copy(header);
      rows = copyGroups(rows);
    }
  }

  @JsonTypeName("ProofTree")
  public record ProofTree(ProofStep root) implements Item {}

  @JsonTypeName("Text")
  public record TextBlock(List<Span> spans) implements Item {
    public TextBlock {
      spans = copy(spans);
    }
  }

  /** 独立成行的表达式 */
  @JsonTypeName("Expr")
  public record ExprItem(Expr expr) implements Item {}

  @JsonTypeName("Section")
  public record Section(String title, List<Item> items) implements Item {
    public Section {
      items = copy(items);
    }
  }

  @JsonTypeName("Solution")
  public record Solution(String label, List<Item> items) implements Item {
    public Solution {
      items = copy(items);
    }
  }

  @JsonTypeName("Part")
  public record Part(String label, List<Item> items) implements Item {
    public Part {
      items = copy(items);
    }
  }

  /** {@code zed ... end} 块，内部只允许基本类型、自由类型、缩写和谓词 */
  @JsonTypeName("Zed")
  public record ZedBlock(List<Item> items) implements Item {
    public ZedBlock {
      items = copy(items);
    }
  }

  /** 原样透传的 LaTeX */
  @JsonTypeName("Latex")
  public record RawLatex(String latex) implements Item {}

  /** 不识别内联数学的纯文本段落，只做 LaTeX 转义 */
  @JsonTypeName("PureText")
  public record PureText(String text) implements Item {}

  @JsonTypeName("PageBreak")
  public record PageBreak() implements Item {}

  /** 目录；{@code depth} 为 1 只列节，为 2 连同小节一起列出 */
  @JsonTypeName("Contents")
  public record Contents(int depth) implements Item {}

  /** 推理规则中的一行公式，{@code label} 可为空 */
  public record RuleLine(Expr expr, String label) {}

  /** 推理规则：横线上方是前提（可以没有），下方是结论 */
  @JsonTypeName("InfRule")
  public record InfRule(List<RuleLine> premises, RuleLine conclusion) implements Item {
    public InfRule {
      premises = copy(premises);
    }
  }

  /**
   * BNF 产生式 {@code NAME ::= b1 | b2}。外层列表的每个元素对应源码中的一行，
   * 续行以 {@code |} 开头。
   */
  public record SyntaxRule(String name, List<List<Branch>> lines) {
    public SyntaxRule {
      lines = copyGroups(lines);
    }
  }

  /** {@code syntax ... end} 块，产生式按空行分组 */
  @JsonTypeName("Syntax")
  public record SyntaxBlock(List<List<SyntaxRule>> groups) implements Item {
    public SyntaxBlock {
      groups = copyGroups(groups);
    }
  }

  /**
   * 文档元数据，来自顶层的 {@code TITLE:}、{@code AUTHOR:}、{@code BIBLIOGRAPHY:} 等行。
   * 未给出的字段为 null。
   */
  public record Metadata(String title, String subtitle, String author, String date, String institution,
                         String bibliography, String bibliographyStyle) {
    public static final Metadata EMPTY = new Metadata(null, null, null, null, null, null, null);

    @JsonIgnore
    public boolean isEmpty() {
      return equals(EMPTY);
    }
  }

  public record Document(Metadata metadata, List<Item> items) {
    @JsonCreator
    public Document {
      metadata = metadata == null ? Metadata.EMPTY : metadata;
      items = copy(items);
    }

    public Document(List<Item> items) {
      this(Metadata.EMPTY, items);
    }
  }

  // ============================================================
  // 文本片段
  // ============================================================

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = Prose.class, name = "Prose"),
    @JsonSubTypes.Type(value = InlineMath.class, name = "InlineMath"),
    @JsonSubTypes.Type(value = Citation.class, name = "Citation")
  })
  public sealed interface Span permits Prose, InlineMath, Citation {}

  @JsonTypeName("Prose")
  public record Prose(String text) implements Span {}

  @JsonTypeName("InlineMath")
  public record InlineMath(Expr expr) implements Span {}

  /** 引用 {@code [cite key]} 或 {@code [cite key p. 42]}；{@code locator} 可为空 */
  @JsonTypeName("Citation")
  public record Citation(String key, String locator) implements Span {}

  // ============================================================
  // 证明树
  // ============================================================

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = ProofStep.class, name = "Step"),
    @JsonSubTypes.Type(value = CaseAnalysis.class, name = "Cases")
  })
  public sealed interface ProofChild permits ProofStep, CaseAnalysis {}

  /**
   * 证明步骤。子节点是它的前提（推导在上方）；
   * {@code label} 非空表示引入了编号假设 {@code [N]}；
   * {@code sibling} 表示与相邻的同级步骤共同作为下一步的前提。
   */
  @JsonTypeName("Step")
  public record ProofStep(Expr expr, String justification, Integer label, boolean assumption,
                          boolean sibling, List<ProofChild> children, int line, int column) implements ProofChild {
    public ProofStep {
      children = copy(children);
    }
  }

  public record CaseBranch(String tag, List<ProofStep> steps, int line, int column) {
    public CaseBranch {
      steps = copy(steps);
    }
  }

  @JsonTypeName("Cases")
  public record CaseAnalysis(List<CaseBranch> branches, int line, int column) implements ProofChild {
    public CaseAnalysis {
      branches = copy(branches);
    }
  }

  private static <T> List<T> copy(List<T> list) {
    return list == null ? List.of() : List.copyOf(list);
  }

  private static <T> List<List<T>> copyGroups(List<List<T>> groups) {
    if (groups == null) {
      return List.of();
    }
    List<List<T>> out = new ArrayList<>(groups.size());
    for (List<T> g : groups) {
      out.add(copy(g));
    }
    return List.copyOf(out);
  }
}
