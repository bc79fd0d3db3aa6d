package zed.txt2tex.proof;

import zed.txt2tex.core.ZModel.Expr;

/**
 * 证明块中的一行，尚未按缩进组织成树。
 * {@code caseTag} 非空时这一行是 {@code case X:} 标记，其余字段无意义。
 */
public record ProofLine(int line, int column, String caseTag, Integer label, boolean sibling,
                        Expr expr, String justification) {

  public static ProofLine caseLine(String tag, int line, int column) {
    return new ProofLine(line, column, tag, null, false, null, null);
  }

  public boolean isCase() {
    return caseTag != null;
  }

  /** 带编号标签或理由写作 assumption 的行是假设 */
  public boolean isAssumption() {
    return label != null || (justification != null && justification.strip().equalsIgnoreCase("assumption"));
  }
}
