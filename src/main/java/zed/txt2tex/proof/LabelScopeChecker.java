package zed.txt2tex.proof;

import zed.txt2tex.core.ZModel.*;
import zed.txt2tex.exceptions.StructureException;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 假设标签作用域检查。
 * <p>
 * 规则：
 * <ul>
 *   <li>{@code from N} 引用的标签必须在根到叶的路径上处于打开状态：祖先或自身引入了它，
 *       或者它在本步的子树中引入且尚未被消解</li>
 *   <li>理由形如 {@code => intro}、{@code not intro} 时，引用即消解；已消解的标签不能再被消解或引用</li>
 *   <li>同一路径上不能重复引入仍然打开的标签；不相交的分支可以复用编号</li>
 *   <li>同一步的两个前提不能同时带着同号的未消解假设，否则一次 {@code from N} 会同时消解两者；
 *       分情况讨论的各分支互不影响</li>
 * </ul>
 * 错误行号指向发出引用的那一步。
 */
final class LabelScopeChecker {

  private static final Pattern REFERENCE =
      Pattern.compile("\\bfrom\\s+(\\d+(?:\\s*(?:,|and)\\s*\\d+)*)");
  private static final Pattern NUMBER = Pattern.compile("\\d+");
  private static final Pattern DISCHARGE =
      Pattern.compile("(=>|⇒|\\bimplies|\\bnot|\\blnot|\\bneg|¬)\\s*-?\\s*intro", Pattern.CASE_INSENSITIVE);

  private LabelScopeChecker() {}

  static void check(ProofStep root) throws StructureException {
    visit(root, new ArrayDeque<>());
  }

  /** 子树中仍打开的标签（连同引入它的步骤）与已消解的标签 */
  private record Scope(Map<Integer, ProofStep> pending, Set<Integer> discharged) {
    void merge(Scope other) {
      pending.putAll(other.pending);
      discharged.addAll(other.discharged);
    }

    void mergePremise(Scope premise) throws StructureException {
      for (Map.Entry<Integer, ProofStep> e : premise.pending.entrySet()) {
        if (pending.containsKey(e.getKey())) {
          ProofStep again = e.getValue();
          throw new StructureException("Assumption label [" + e.getKey() + "] is open in two premises of the same step",
              again.line(), again.column());
        }
      }
      merge(premise);
    }
  }

  private static Scope visit(ProofStep step, Deque<ProofStep> ancestors) throws StructureException {
    Integer own = step.label();
    if (own != null && isOpen(own, ancestors)) {
      throw new StructureException("Assumption label [" + own + "] is already open on this branch",
          step.line(), step.column());
    }

    Scope scope = new Scope(new LinkedHashMap<>(), new HashSet<>());
    ancestors.push(step);
    for (ProofChild child : step.children()) {
      if (child instanceof ProofStep s) {
        scope.mergePremise(visit(s, ancestors));
      } else if (child instanceof CaseAnalysis cases) {
        for (CaseBranch branch : cases.branches()) {
          for (ProofStep s : branch.steps()) {
            scope.merge(visit(s, ancestors));
          }
        }
      }
    }
    ancestors.pop();

    boolean discharging = dischargesAssumptions(step.justification());
    for (Integer n : references(step.justification())) {
      boolean onPath = n.equals(own) || isOpen(n, ancestors);
      if (discharging && scope.pending.remove(n) != null) {
        scope.discharged.add(n);
      } else if (onPath || (!discharging && scope.pending.containsKey(n))) {
        continue;
      } else if (scope.discharged.contains(n)) {
        throw new StructureException("Assumption [" + n + "] has already been discharged",
            step.line(), step.column());
      } else {
        throw new StructureException("Justification references assumption [" + n + "] which is not open here",
            step.line(), step.column());
      }
    }
    if (own != null) {
      scope.pending.put(own, step);
    }
    return scope;
  }

  private static boolean isOpen(Integer label, Deque<ProofStep> ancestors) {
    for (ProofStep a : ancestors) {
      if (label.equals(a.label())) {
        return true;
      }
    }
    return false;
  }

  static List<Integer> references(String justification) {
    if (justification == null) {
      return List.of();
    }
    List<Integer> refs = new ArrayList<>();
    Matcher m = REFERENCE.matcher(justification);
    while (m.find()) {
      Matcher n = NUMBER.matcher(m.group(1));
      while (n.find()) {
        refs.add(Integer.valueOf(n.group()));
      }
    }
    return refs;
  }

  static boolean dischargesAssumptions(String justification) {
    return justification != null && DISCHARGE.matcher(justification).find();
  }
}
