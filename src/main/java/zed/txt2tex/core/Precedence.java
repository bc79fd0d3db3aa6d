package zed.txt2tex.core;

/**
 * 运算符优先级层级（由低到高）。
 *
 * <p>解析器按此表做优先级爬升，生成器用同一张表决定何处必须补括号，
 * 两者共用一份数据，保证 parse → generate 不会改变结合方式。</p>
 */
public enum Precedence {
  /** 声明/谓词分隔符 {@code ;} */
  SEQUENCING,
  /** 量词、lambda、mu、条件表达式：向右延伸到底 */
  BINDER,
  /** {@code =>} 与 {@code <=>}，右结合 */
  IMPLICATION,
  DISJUNCTION,
  CONJUNCTION,
  NEGATION,
  /** 比较、成员、子集 */
  COMPARISON,
  /** 关系/函数类型箭头，右结合 */
  FUNCTION_TYPE,
  MAPLET,
  RANGE,
  /** 集合与关系运算：并、交、差、积、限制、复合、覆盖、连接 */
  SET_RELATION,
  ADDITIVE,
  MULTIPLICATIVE,
  PREFIX,
  POSTFIX,
  APPLICATION;

  public boolean tighterThan(Precedence other) {
    return compareTo(other) > 0;
  }

  public boolean looserThan(Precedence other) {
    return compareTo(other) < 0;
  }
}
