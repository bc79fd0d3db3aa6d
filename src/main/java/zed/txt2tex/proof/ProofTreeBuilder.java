package zed.txt2tex.proof;

import zed.txt2tex.core.ZModel.*;
import zed.txt2tex.exceptions.StructureException;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 把按行解析的证明块组织成树。
 * <p>
 * 缩进栈状态机：
 * <ul>
 *   <li>比上一行更深：成为上一行的子节点</li>
 *   <li>与栈中某一层同列：成为那一层的兄弟</li>
 *   <li>回退到从未打开过的列，或出现第二个根：{@link StructureException}</li>
 * </ul>
 * 连续同列的 {@code case X:} 合并为一个分情况节点。建树后依次检查分情况结论一致
 * 与假设标签作用域。
 */
public final class ProofTreeBuilder {

  private static final Logger LOGGER = Logger.getLogger(ProofTreeBuilder.class.getName());

  private ProofTreeBuilder() {}

  public static ProofStep build(List<ProofLine> lines) throws StructureException {
    if (lines.isEmpty()) {
      throw new IllegalArgumentException("proof has no lines");
    }
    ProofLine first = lines.get(0);
    if (first.isCase()) {
      throw new StructureException("Proof must start with its conclusion, not a case marker",
          first.line(), first.column());
    }
    StepNode root = new StepNode(first);
    Deque<Frame> stack = new ArrayDeque<>();
    stack.push(root);
    int previousColumn = first.column();

    for (int i = 1; i < lines.size(); i++) {
      ProofLine line = lines.get(i);
      int column = line.column();
      if (column <= previousColumn) {
        while (!stack.isEmpty() && stack.peek().column() > column) {
          stack.pop();
        }
        if (stack.isEmpty() || stack.peek().column() != column) {
          throw new StructureException("Indentation returns to a column no enclosing step uses",
              line.line(), column);
        }
        stack.pop();
        if (stack.isEmpty()) {
          throw new StructureException("Proof has a second root-level step; indent it under the conclusion",
              line.line(), column);
        }
      }
      stack.push(stack.peek().attach(line));
      previousColumn = column;
    }

    ProofStep tree = root.freeze();
    checkCases(tree);
    LabelScopeChecker.check(tree);
    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.log(Level.FINE, "Built proof tree rooted at line {0}", first.line());
    }
    return tree;
  }

  // ============================================================
  // 分情况：每个分支的结论必须语法相同
  // ============================================================

  private static void checkCases(ProofStep step) throws StructureException {
    for (ProofChild child : step.children()) {
      if (child instanceof ProofStep s) {
        checkCases(s);
      } else if (child instanceof CaseAnalysis cases) {
        checkConvergence(cases);
        for (CaseBranch branch : cases.branches()) {
          for (ProofStep s : branch.steps()) {
            checkCases(s);
          }
        }
      }
    }
  }

  private static void checkConvergence(CaseAnalysis cases) throws StructureException {
    CaseBranch first = null;
    Expr expected = null;
    for (CaseBranch branch : cases.branches()) {
      if (branch.steps().isEmpty()) {
        throw new StructureException("Case '" + branch.tag() + "' has no steps", branch.line(), branch.column());
      }
      Expr conclusion = conclusion(branch.steps());
      if (first == null) {
        first = branch;
        expected = conclusion;
      } else if (!expected.equals(conclusion)) {
        throw new StructureException("Case '" + branch.tag() + "' reaches a different conclusion than case '"
            + first.tag() + "'", branch.line(), branch.column());
      }
    }
  }

  /** 分支的结论：最后一步；若最后一步是带推导的假设，继续看它的最后一个子步骤 */
  static Expr conclusion(List<ProofStep> steps) {
    ProofStep last = steps.get(steps.size() - 1);
    while (last.assumption() && !last.children().isEmpty()) {
      ProofChild tail = last.children().get(last.children().size() - 1);
      if (tail instanceof ProofStep s) {
        last = s;
      } else if (tail instanceof CaseAnalysis cases) {
        return conclusion(cases.branches().get(0).steps());
      }
    }
    return last.expr();
  }

  // ============================================================
  // 可变建树节点
  // ============================================================

  private interface Frame {
    int column();

    Frame attach(ProofLine line) throws StructureException;
  }

  private static final class StepNode implements Frame {
    private final ProofLine line;
    private final List<Object> children = new ArrayList<>();

    StepNode(ProofLine line) {
      this.line = line;
    }

    @Override
    public int column() {
      return line.column();
    }

    @Override
    public Frame attach(ProofLine child) {
      if (!child.isCase()) {
        StepNode step = new StepNode(child);
        children.add(step);
        return step;
      }
      CaseNode cases = null;
      if (!children.isEmpty() && children.get(children.size() - 1) instanceof CaseNode last
          && last.column == child.column()) {
        cases = last;
      }
      if (cases == null) {
        cases = new CaseNode(child.line(), child.column());
        children.add(cases);
      }
      BranchNode branch = new BranchNode(child);
      cases.branches.add(branch);
      return branch;
    }

    ProofStep freeze() {
      List<ProofChild> frozen = new ArrayList<>(children.size());
      for (Object c : children) {
        if (c instanceof StepNode s) {
          frozen.add(s.freeze());
        } else if (c instanceof CaseNode cn) {
          frozen.add(cn.freeze());
        }
      }
      return new ProofStep(line.expr(), line.justification(), line.label(), line.isAssumption(),
          line.sibling(), frozen, line.line(), line.column());
    }
  }

  private static final class CaseNode {
    private final int line;
    private final int column;
    private final List<BranchNode> branches = new ArrayList<>();

    CaseNode(int line, int column) {
      this.line = line;
      this.column = column;
    }

    CaseAnalysis freeze() {
      List<CaseBranch> frozen = new ArrayList<>(branches.size());
      for (BranchNode b : branches) {
        frozen.add(b.freeze());
      }
      return new CaseAnalysis(frozen, line, column);
    }
  }

  private static final class BranchNode implements Frame {
    private final ProofLine marker;
    private final List<StepNode> steps = new ArrayList<>();

    BranchNode(ProofLine marker) {
      this.marker = marker;
    }

    @Override
    public int column() {
      return marker.column();
    }

    @Override
    public Frame attach(ProofLine child) throws StructureException {
      if (child.isCase()) {
        throw new StructureException("A case marker cannot directly follow another case marker",
            child.line(), child.column());
      }
      StepNode step = new StepNode(child);
      steps.add(step);
      return step;
    }

    CaseBranch freeze() {
      List<ProofStep> frozen = new ArrayList<>(steps.size());
      for (StepNode s : steps) {
        frozen.add(s.freeze());
      }
      return new CaseBranch(marker.caseTag(), frozen, marker.line(), marker.column());
    }
  }
}
