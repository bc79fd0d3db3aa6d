package zed.txt2tex.gen;

import zed.txt2tex.core.Operator;
import zed.txt2tex.core.Precedence;
import zed.txt2tex.core.ZModel.*;
import zed.txt2tex.exceptions.StructureException;

import java.util.*;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * LaTeX 代码生成器。
 * <p>
 * 生成器不可变，方言在构造时确定，渲染同一棵语法树总是得到同一字符串。
 * 括号由 {@link Precedence} 决定：子表达式比所在位置要求的层级更松时才加括号，
 * 因此输出再解析回来得到同一棵树。
 */
public final class LatexGenerator {

  private static final Logger LOGGER = Logger.getLogger(LatexGenerator.class.getName());

  /** 理由文本中需要转成数学符号的运算符单词 */
  private static final Map<String, String> JUSTIFICATION_SYMBOLS = Map.ofEntries(
    Map.entry("=>", "\\implies"),
    Map.entry("⇒", "\\implies"),
    Map.entry("implies", "\\implies"),
    Map.entry("<=>", "\\iff"),
    Map.entry("⇔", "\\iff"),
    Map.entry("and", "\\land"),
    Map.entry("land", "\\land"),
    Map.entry("∧", "\\land"),
    Map.entry("or", "\\lor"),
    Map.entry("lor", "\\lor"),
    Map.entry("∨", "\\lor"),
    Map.entry("not", "\\lnot"),
    Map.entry("lnot", "\\lnot"),
    Map.entry("¬", "\\lnot"),
    Map.entry("forall", "\\forall"),
    Map.entry("exists", "\\exists"),
    Map.entry("exists1", "\\exists_1"));

  /** 作泛型实例化基名时按运算符符号输出的前缀关键字 */
  private static final Map<String, Operator> GENERIC_CONSTANTS = Map.ofEntries(
    Map.entry("P", Operator.POWER),
    Map.entry("ℙ", Operator.POWER),
    Map.entry("P1", Operator.POWER1),
    Map.entry("F", Operator.FINSET),
    Map.entry("𝔽", Operator.FINSET),
    Map.entry("F1", Operator.FINSET1),
    Map.entry("seq", Operator.SEQ),
    Map.entry("seq1", Operator.SEQ1),
    Map.entry("iseq", Operator.ISEQ),
    Map.entry("bag", Operator.BAG));

  private final Dialect dialect;

  public LatexGenerator(Dialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  public Dialect dialect() {
    return dialect;
  }

  // ============================================================
  // 文档
  // ============================================================

  /**
   * 完整可编译的 LaTeX 文档。有标题时输出标题页，
   * 有参考文献或引用时加载 {@code natbib}，参考文献列表放在正文末尾。
   */
  public String generateDocument(Document doc) throws StructureException {
    Metadata meta = doc.metadata();
    StringBuilder sb = new StringBuilder();
    sb.append("\\documentclass{article}\n");
    for (String pkg : dialect.packages()) {
      sb.append("\\usepackage{").append(pkg).append("}\n");
    }
    sb.append("\\usepackage{amsmath}\n");
    sb.append("\\usepackage{proof}\n");
    if (meta.bibliography() != null || anyItem(doc.items(), LatexGenerator::cites)) {
      sb.append("\\usepackage{natbib}\n");
    }
    if (meta.title() != null) {
      sb.append('\n').append(titleBlock(meta));
    }
    sb.append("\n\\begin{document}\n\n");
    if (meta.title() != null) {
      sb.append("\\maketitle\n\n");
    }
    String body = generate(doc);
    if (!body.isEmpty()) {
      sb.append(body).append("\n\n");
    }
    if (meta.bibliography() != null) {
      String file = meta.bibliography().endsWith(".bib")
          ? meta.bibliography().substring(0, meta.bibliography().length() - 4)
          : meta.bibliography();
      sb.append("\\bibliographystyle{")
          .append(meta.bibliographyStyle() == null ? "plainnat" : meta.bibliographyStyle())
          .append("}\n\\bibliography{").append(file).append("}\n\n");
    }
    sb.append("\\end{document}\n");
    return sb.toString();
  }

  private static String titleBlock(Metadata meta) {
    StringBuilder sb = new StringBuilder();
    sb.append("\\title{").append(escapeText(meta.title()));
    if (meta.subtitle() != null) {
      sb.append(" \\\\\n\\large ").append(escapeText(meta.subtitle()));
    }
    sb.append("}\n\\author{");
    if (meta.author() != null) {
      sb.append(escapeText(meta.author()));
    }
    if (meta.institution() != null) {
      sb.append(meta.author() == null ? "" : " \\\\\n").append(escapeText(meta.institution()));
    }
    sb.append("}\n\\date{").append(meta.date() == null ? "\\today" : escapeText(meta.date())).append("}\n");
    return sb.toString();
  }

  /** 文档片段：各条目之间空一行 */
  public String generate(Document doc) throws StructureException {
    String body = items(doc.items(), anyItem(doc.items(), i -> i instanceof Contents));
    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.log(Level.FINE, "Generated {0} chars for {1} items ({2})",
          new Object[]{body.length(), doc.items().size(), dialect});
    }
    return body;
  }

  /**
   * @param toc 文档含目录时，节与解答标题同时登记到目录
   */
  private String items(List<Item> items, boolean toc) throws StructureException {
    List<String> out = new ArrayList<>(items.size());
    for (Item item : items) {
      out.add(item(item, toc));
    }
    return String.join("\n\n", out);
  }

  public String generateItem(Item item) throws StructureException {
    return item(item, false);
  }

  private String item(Item item, boolean toc) throws StructureException {
    if (item instanceof Section s) {
      String body = items(s.items(), toc);
      String title = escapeText(s.title());
      return "\\section*{" + title + "}" + (toc ? "\n\\addcontentsline{toc}{section}{" + title + "}" : "")
          + (body.isEmpty() ? "" : "\n\n" + body);
    }
    if (item instanceof Solution s) {
      String body = items(s.items(), toc);
      String label = escapeText(s.label());
      return "\\bigskip\n\\noindent\\textbf{" + label + "}"
          + (toc ? "\n\\addcontentsline{toc}{subsection}{" + label + "}" : "")
          + (body.isEmpty() ? "" : "\n\n" + body);
    }
    if (item instanceof Part p) {
      String body = items(p.items(), toc);
      return "\\noindent (" + escapeText(p.label()) + ")" + (body.isEmpty() ? "" : "\n\n" + body);
    }
    if (item instanceof TextBlock t) {
      return text(t);
    }
    if (item instanceof RawLatex r) {
      return r.latex();
    }
    if (item instanceof ExprItem e) {
      return "$" + generateExpr(e.expr()) + "$";
    }
    if (item instanceof GivenTypes || item instanceof FreeType || item instanceof Abbreviation) {
      return "\\begin{zed}\n" + zedLine(item) + "\n\\end{zed}";
    }
    if (item instanceof ZedBlock z) {
      List<String> lines = new ArrayList<>();
      for (Item inner : z.items()) {
        lines.add(zedLine(inner));
      }
      return "\\begin{zed}\n" + String.join(" \\\\\n", lines) + "\n\\end{zed}";
    }
    if (item instanceof AxDef a) {
      if (!a.genericParams().isEmpty()) {
        return box("gendef", genericSuffix(a.genericParams()), a.declarations(), List.of(), a.predicates());
      }
      return box("axdef", "", a.declarations(), List.of(), a.predicates());
    }
    if (item instanceof GenDef g) {
      return box("gendef", genericSuffix(g.genericParams()), g.declarations(), List.of(), g.predicates());
    }
    if (item instanceof Schema s) {
      String header = "{" + (s.name() == null ? "" : s.name()) + "}" + genericSuffix(s.genericParams());
      return box("schema", header, s.declarations(), s.inclusions(), s.predicates());
    }
    if (item instanceof EquivChain c) {
      return equivChain(c);
    }
    if (item instanceof TruthTable t) {
      return truthTable(t);
    }
    if (item instanceof ProofTree p) {
      return "\\begin{center}\n$" + proofNode(p.root(), null) + "$\n\\end{center}";
    }
    if (item instanceof InfRule r) {
      return infRule(r);
    }
    if (item instanceof SyntaxBlock b) {
      return syntax(b);
    }
    if (item instanceof PureText t) {
      return t.text().isEmpty() ? "\\bigskip" : "\\bigskip\n\\noindent " + escapeText(t.text());
    }
    if (item instanceof PageBreak) {
      return "\\newpage";
    }
    if (item instanceof Contents c) {
      return "\\setcounter{tocdepth}{" + c.depth() + "}\n\\tableofcontents";
    }
    throw new IllegalStateException("Unknown item: " + item.getClass().getSimpleName());
  }

  // ============================================================
  // Z 段落
  // ============================================================

  private String zedLine(Item item) {
    if (item instanceof GivenTypes g) {
      return "[" + String.join(", ", g.names()) + "]";
    }
    if (item instanceof FreeType f) {
      return f.name() + " ::= " + branches(f.branches());
    }
    if (item instanceof Abbreviation a) {
      return a.name() + genericSuffix(a.genericParams()) + " == " + generateExpr(a.body());
    }
    if (item instanceof ExprItem e) {
      return generateExpr(e.expr());
    }
    throw new IllegalStateException("Not allowed inside a zed block: " + item.getClass().getSimpleName());
  }

  private String branches(List<Branch> branches) {
    List<String> out = new ArrayList<>();
    for (Branch b : branches) {
      out.add(b.argument() == null
          ? b.name()
          : b.name() + " \\ldata " + generateExpr(b.argument()) + " \\rdata");
    }
    return String.join(" | ", out);
  }

  /** BNF 产生式：续行以 {@code & | &} 对齐，分组之间 {@code \also} */
  private String syntax(SyntaxBlock block) {
    List<String> groups = new ArrayList<>();
    for (List<SyntaxRule> group : block.groups()) {
      List<String> rows = new ArrayList<>();
      for (SyntaxRule rule : group) {
        for (int i = 0; i < rule.lines().size(); i++) {
          String lead = i == 0 ? identifier(rule.name()) + " & ::= & " : "& | & ";
          rows.add(lead + branches(rule.lines().get(i)));
        }
      }
      groups.add(String.join(" \\\\\n", rows));
    }
    return "\\begin{syntax}\n" + String.join("\n\\also\n", groups) + "\n\\end{syntax}";
  }

  private String box(String env, String header, List<Declaration> decls, List<String> inclusions,
                     List<List<Expr>> predicates) {
    StringBuilder sb = new StringBuilder();
    sb.append("\\begin{").append(env).append('}').append(header).append('\n');
    List<String> lines = new ArrayList<>();
    for (String inc : inclusions) {
      lines.add(inclusion(inc));
    }
    for (Declaration d : decls) {
      lines.add(names(d.names()) + " : " + generateExpr(d.type()));
    }
    sb.append(String.join(dialect.declarationSeparator(), lines));
    if (!predicates.isEmpty()) {
      sb.append("\n\\where\n");
      List<String> groups = new ArrayList<>();
      for (List<Expr> group : predicates) {
        List<String> preds = new ArrayList<>();
        for (Expr p : group) {
          preds.add(generateExpr(p));
        }
        groups.add(String.join(" \\\\\n", preds));
      }
      sb.append(String.join("\n\\also\n", groups));
    }
    sb.append("\n\\end{").append(env).append('}');
    return sb.toString();
  }

  private static String inclusion(String name) {
    if (name.startsWith("Delta ") || name.startsWith("Δ ")) {
      return "\\Delta " + name.substring(name.indexOf(' ') + 1);
    }
    if (name.startsWith("Xi ") || name.startsWith("Ξ ")) {
      return "\\Xi " + name.substring(name.indexOf(' ') + 1);
    }
    return name;
  }

  private static String genericSuffix(List<String> params) {
    return params.isEmpty() ? "" : "[" + String.join(", ", params) + "]";
  }

  // ============================================================
  // 推理结构
  // ============================================================

  private String equivChain(EquivChain chain) {
    List<String> lines = new ArrayList<>();
    for (int i = 0; i < chain.steps().size(); i++) {
      EquivStep step = chain.steps().get(i);
      String line = (i == 0 ? "" : "\\iff ") + generateExpr(step.expr());
      if (step.justification() != null) {
        line += " & [" + justification(step.justification()) + "]";
      }
      lines.add(line);
    }
    return "\\begin{argue}\n" + String.join(" \\\\\n", lines) + "\n\\end{argue}";
  }

  private String truthTable(TruthTable table) throws StructureException {
    int width = table.header().size();
    for (int i = 0; i < table.rows().size(); i++) {
      int cells = table.rows().get(i).size();
      if (cells != width) {
        throw new StructureException("Truth table row " + (i + 1) + " has " + cells
            + " cells but the header has " + width, table.line(), table.column());
      }
    }
    StringBuilder sb = new StringBuilder();
    sb.append("\\begin{center}\n\\begin{tabular}{|");
    sb.append("c|".repeat(width));
    sb.append("}\n\\hline\n");
    List<String> header = new ArrayList<>();
    for (Expr e : table.header()) {
      header.add("$" + generateExpr(e) + "$");
    }
    sb.append(String.join(" & ", header)).append(" \\\\\n\\hline\n");
    for (List<String> row : table.rows()) {
      sb.append(String.join(" & ", row)).append(" \\\\\n");
    }
    sb.append("\\hline\n\\end{tabular}\n\\end{center}");
    return sb.toString();
  }

  /**
   * 证明节点。假设渲染为 {@code [expr]^{N}}，其子步骤在假设之下继续推导；
   * 普通步骤渲染为 {@code \infer}，前提来自子步骤组成的推导链。
   *
   * @param input 同一子列表中上一步传下来的前提，可为 null
   */
  private String proofNode(ProofStep step, String input) {
    if (step.assumption()) {
      String leaf = "[" + generateExpr(step.expr()) + "]" + (step.label() == null ? "" : "^{" + step.label() + "}");
      String result = step.children().isEmpty() ? leaf : proofChain(step.children(), leaf);
      return input == null ? result : input + " & " + result;
    }
    String premises = proofChain(step.children(), input);
    String expr = generateExpr(step.expr());
    if (premises == null && step.justification() == null) {
      return expr;
    }
    String label = step.justification() == null ? "" : "[" + justification(step.justification()) + "]";
    return "\\infer" + label + "{" + expr + "}{" + (premises == null ? "" : premises) + "}";
  }

  /**
   * 子步骤推导链：每步以前一步为前提；并列标记的步骤收集成一组，
   * 共同作为下一步的前提；分情况节点把当前前提与各分支推导并排。
   */
  private String proofChain(List<ProofChild> children, String start) {
    String current = start;
    List<String> group = new ArrayList<>();
    for (ProofChild child : children) {
      if (child instanceof CaseAnalysis cases) {
        List<String> parts = new ArrayList<>(group);
        group.clear();
        if (current != null && parts.isEmpty()) {
          parts.add(current);
        }
        for (CaseBranch branch : cases.branches()) {
          String derivation = proofChain(new ArrayList<>(branch.steps()), null);
          if (derivation != null) {
            parts.add(derivation);
          }
        }
        current = String.join(" & ", parts);
      } else if (child instanceof ProofStep step) {
        if (step.sibling()) {
          if (group.isEmpty() && current != null) {
            group.add(current);
          }
          current = null;
          group.add(proofNode(step, null));
        } else {
          String input = group.isEmpty() ? current : String.join(" & ", group);
          group.clear();
          current = proofNode(step, input);
        }
      }
    }
    if (!group.isEmpty()) {
      current = String.join(" & ", group);
    }
    return current;
  }

  /** 推理规则：带标签的前提画成自带横线的叶子，与证明树中的前提一致 */
  private String infRule(InfRule rule) {
    List<String> premises = new ArrayList<>();
    for (RuleLine p : rule.premises()) {
      String expr = generateExpr(p.expr());
      premises.add(p.label() == null ? expr : "\\infer[" + justification(p.label()) + "]{" + expr + "}{}");
    }
    RuleLine c = rule.conclusion();
    String label = c.label() == null ? "" : "[" + justification(c.label()) + "]";
    return "\\begin{center}\n$\\infer" + label + "{" + generateExpr(c.expr()) + "}{"
        + String.join(" & ", premises) + "}$\n\\end{center}";
  }

  private static String justification(String text) {
    List<String> words = new ArrayList<>();
    for (String word : text.trim().split("\\s+")) {
      String symbol = JUSTIFICATION_SYMBOLS.get(word);
      words.add(symbol != null ? "$" + symbol + "$" : escapeText(word));
    }
    return "\\mbox{" + String.join(" ", words) + "}";
  }

  private String text(TextBlock block) {
    StringBuilder sb = new StringBuilder();
    for (Span span : block.spans()) {
      if (span instanceof Prose p) {
        sb.append(escapeText(p.text()));
      } else if (span instanceof InlineMath m) {
        sb.append('$').append(generateExpr(m.expr())).append('$');
      } else if (span instanceof Citation c) {
        sb.append("\\citep");
        if (c.locator() != null) {
          sb.append('[').append(escapeText(c.locator())).append(']');
        }
        sb.append('{').append(c.key()).append('}');
      }
    }
    return sb.toString();
  }

  // ============================================================
  // 表达式
  // ============================================================

  public String generateExpr(Expr e) {
    if (e instanceof Identifier id) {
      return identifier(id.name());
    }
    if (e instanceof NumberLiteral n) {
      return n.value();
    }
    if (e instanceof BinaryOp b) {
      Operator op = b.op();
      Precedence leftMin = op.isRightAssociative() ? tighter(op.precedence()) : op.precedence();
      Precedence rightMin = op.isRightAssociative() ? op.precedence() : tighter(op.precedence());
      return wrap(b.left(), leftMin) + " " + op.glyph() + " " + wrap(b.right(), rightMin);
    }
    if (e instanceof UnaryOp u) {
      return unary(u);
    }
    if (e instanceof Application a) {
      return application(a);
    }
    if (e instanceof Quantifier q) {
      return quantifier(q);
    }
    if (e instanceof SetLiteral s) {
      return s.elements().isEmpty() ? "\\emptyset" : "\\{" + list(s.elements()) + "\\}";
    }
    if (e instanceof SetComprehension c) {
      StringBuilder sb = new StringBuilder("\\{");
      sb.append(bindings(c.bindings()));
      if (c.predicate() != null) {
        sb.append(" | ").append(generateExpr(c.predicate()));
      }
      if (c.body() != null) {
        sb.append(" @ ").append(generateExpr(c.body()));
      }
      return sb.append("\\}").toString();
    }
    if (e instanceof SequenceLiteral s) {
      return s.elements().isEmpty() ? "\\langle \\rangle" : "\\langle " + list(s.elements()) + " \\rangle";
    }
    if (e instanceof BagLiteral b) {
      return b.elements().isEmpty() ? "\\lbag \\rbag" : "\\lbag " + list(b.elements()) + " \\rbag";
    }
    if (e instanceof TupleLiteral t) {
      return "(" + list(t.elements()) + ")";
    }
    if (e instanceof Projection p) {
      return wrap(p.target(), Precedence.APPLICATION) + "." + p.selector();
    }
    if (e instanceof RelationalImage r) {
      return wrap(r.relation(), Precedence.APPLICATION) + " \\limg " + generateExpr(r.set()) + " \\rimg";
    }
    if (e instanceof Superscript s) {
      return wrap(s.base(), Precedence.APPLICATION) + "^{" + generateExpr(s.exponent()) + "}";
    }
    if (e instanceof Conditional c) {
      return "\\IF " + generateExpr(c.condition()) + " \\THEN " + generateExpr(c.thenBranch())
          + " \\ELSE " + generateExpr(c.elseBranch());
    }
    if (e instanceof GenericInstantiation g) {
      return genericBase(g.base()) + "[" + list(g.params()) + "]";
    }
    if (e instanceof GuardedCases c) {
      List<String> rows = new ArrayList<>();
      for (GuardedBranch b : c.branches()) {
        rows.add(generateExpr(b.value()) + " & \\mbox{if } " + generateExpr(b.guard()));
      }
      return "\\begin{cases} " + String.join(" \\\\ ", rows) + " \\end{cases}";
    }
    throw new IllegalStateException("Unknown expression: " + e.getClass().getSimpleName());
  }

  private String unary(UnaryOp u) {
    Operator op = u.op();
    if (u.isPostfix()) {
      return wrap(u.operand(), Precedence.POSTFIX) + op.glyph();
    }
    Expr operand = u.operand();
    String inner;
    if (dialect.parenthesizesPrefixApplication() && op.family() == Operator.Family.PREFIX_FUNCTION
        && operand instanceof Application) {
      inner = "(" + generateExpr(operand) + ")";
    } else if (dialect.parenthesizesNestedSpecial() && op.family() == Operator.Family.SPECIAL_FUNCTION
        && operand instanceof UnaryOp nested && nested.op().family() == Operator.Family.SPECIAL_FUNCTION) {
      inner = "(" + generateExpr(operand) + ")";
    } else {
      inner = wrap(operand, op == Operator.NOT ? Precedence.NEGATION : Precedence.PREFIX);
    }
    return op.glyph() + (op.spacedPrefix() ? " " : "") + inner;
  }

  private String application(Application a) {
    String callee = wrap(a.callee(), Precedence.APPLICATION);
    if (!a.juxtaposed()) {
      return callee + "(" + list(a.args()) + ")";
    }
    StringBuilder sb = new StringBuilder(callee);
    for (Expr arg : a.args()) {
      boolean parens = precedence(arg).looserThan(Precedence.APPLICATION)
          || (arg instanceof Application inner && inner.juxtaposed());
      sb.append('~').append(parens ? "(" + generateExpr(arg) + ")" : generateExpr(arg));
    }
    return sb.toString();
  }

  private String quantifier(Quantifier q) {
    StringBuilder sb = new StringBuilder(q.binder().glyph());
    sb.append(' ').append(bindings(q.bindings()));
    Expr predicate = q.predicate();
    Expr body = q.body();
    if (q.binder() == Binder.MU || q.binder() == Binder.LAMBDA) {
      if (predicate != null) {
        sb.append(" | ").append(generateExpr(predicate));
      }
      if (body != null) {
        sb.append(" @ ").append(generateExpr(body));
      }
    } else if (predicate != null && body != null) {
      sb.append(" | ").append(generateExpr(predicate)).append(" @ ").append(generateExpr(body));
    } else {
      sb.append(" @ ").append(generateExpr(body != null ? body : predicate));
    }
    return sb.toString();
  }

  private String genericBase(Expr base) {
    if (base instanceof Identifier id && GENERIC_CONSTANTS.containsKey(id.name())) {
      return GENERIC_CONSTANTS.get(id.name()).glyph();
    }
    return wrap(base, Precedence.APPLICATION);
  }

  private String bindings(List<Binding> bindings) {
    List<String> parts = new ArrayList<>(bindings.size());
    for (Binding b : bindings) {
      String names = names(b.names());
      parts.add(b.type() == null ? names : names + " : " + generateExpr(b.type()));
    }
    return String.join("; ", parts);
  }

  private String list(List<Expr> exprs) {
    List<String> parts = new ArrayList<>(exprs.size());
    for (Expr e : exprs) {
      parts.add(generateExpr(e));
    }
    return String.join(", ", parts);
  }

  private String names(List<String> names) {
    List<String> out = new ArrayList<>(names.size());
    for (String n : names) {
      out.add(identifier(n));
    }
    return String.join(", ", out);
  }

  /**
   * 名字中的下划线：{@code x_1}、{@code a_i}、{@code x_12} 是下标，
   * 其余（{@code max_value}、{@code a_b_c}）整体用 {@code \mathit} 排成一个词。
   */
  private String identifier(String name) {
    String primitive = dialect.primitiveType(name);
    if (primitive != null) {
      return primitive;
    }
    int underscore = name.indexOf('_');
    if (underscore < 0) {
      return name;
    }
    int bareEnd = name.length();
    while (bareEnd > 0 && "'?!".indexOf(name.charAt(bareEnd - 1)) >= 0) {
      bareEnd--;
    }
    String base = name.substring(0, underscore);
    String suffix = name.substring(underscore + 1, bareEnd);
    String decoration = name.substring(bareEnd);
    if (!base.isEmpty() && !suffix.isEmpty() && suffix.indexOf('_') < 0) {
      if (suffix.length() == 1) {
        return base + "_" + suffix + decoration;
      }
      if (suffix.chars().allMatch(Character::isDigit)) {
        return base + "_{" + suffix + "}" + decoration;
      }
    }
    return "\\mathit{" + name.substring(0, bareEnd).replace("_", "\\_") + "}" + decoration;
  }

  private String wrap(Expr e, Precedence min) {
    String s = generateExpr(e);
    return precedence(e).looserThan(min) ? "(" + s + ")" : s;
  }

  private static Precedence precedence(Expr e) {
    if (e instanceof BinaryOp b) {
      return b.op().precedence();
    }
    if (e instanceof UnaryOp u) {
      return u.op().precedence();
    }
    if (e instanceof Quantifier || e instanceof Conditional) {
      return Precedence.BINDER;
    }
    if (e instanceof Superscript) {
      return Precedence.POSTFIX;
    }
    return Precedence.APPLICATION;
  }

  private static Precedence tighter(Precedence p) {
    Precedence[] all = Precedence.values();
    return all[Math.min(p.ordinal() + 1, all.length - 1)];
  }

  /** 在各层节、解答、小题中查找满足条件的条目 */
  private static boolean anyItem(List<Item> items, Predicate<Item> test) {
    for (Item item : items) {
      if (test.test(item)) {
        return true;
      }
      List<Item> nested = item instanceof Section section ? section.items()
          : item instanceof Solution solution ? solution.items()
          : item instanceof Part part ? part.items()
          : List.of();
      if (anyItem(nested, test)) {
        return true;
      }
    }
    return false;
  }

  private static boolean cites(Item item) {
    if (item instanceof TextBlock t) {
      for (Span span : t.spans()) {
        if (span instanceof Citation) {
          return true;
        }
      }
    }
    return false;
  }

  /** 转义散文中的 LaTeX 特殊字符 */
  static String escapeText(String text) {
    StringBuilder sb = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '\\' -> sb.append("\\textbackslash{}");
        case '{', '}', '$', '&', '%', '#', '_' -> sb.append('\\').append(c);
        case '^' -> sb.append("\\^{}");
        case '~' -> sb.append("\\~{}");
        default -> sb.append(c);
      }
    }
    return sb.toString();
  }
}
