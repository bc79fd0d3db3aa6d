package zed.txt2tex.gen;

import java.util.List;
import java.util.Locale;

/**
 * 输出方言。两者只在以下几处不同：
 * <ol>
 *   <li>基本类型 N / N1 / Z 的字形</li>
 *   <li>定义框中相邻声明之间 FUZZ 需要 {@code \\}</li>
 *   <li>前缀函数作用于函数应用时，FUZZ 给应用加括号</li>
 *   <li>特殊函数直接嵌套时，FUZZ 给内层加括号</li>
 * </ol>
 */
public enum Dialect {
  /** zed-cm / zed-maths */
  STANDARD(List.of("zed-cm", "zed-maths")),
  /** Spivey 的 fuzz 宏包 */
  FUZZ(List.of("fuzz"));

  private final List<String> packages;

  Dialect(List<String> packages) {
    this.packages = packages;
  }

  /** 本方言需要的 Z 宏包 */
  public List<String> packages() {
    return packages;
  }

  /** 基本类型字形；不是基本类型返回 null */
  public String primitiveType(String name) {
    return switch (name) {
      case "N", "ℕ" -> this == STANDARD ? "\\mathbb{N}" : "\\nat";
      case "N1", "ℕ1" -> this == STANDARD ? "\\mathbb{N}_1" : "\\nat_1";
      case "Z", "ℤ" -> this == STANDARD ? "\\mathbb{Z}" : "\\num";
      default -> null;
    };
  }

  public String declarationSeparator() {
    return this == FUZZ ? " \\\\\n" : "\n";
  }

  public boolean parenthesizesPrefixApplication() {
    return this == FUZZ;
  }

  public boolean parenthesizesNestedSpecial() {
    return this == FUZZ;
  }

  /**
   * 解析方言名（大小写不敏感）。{@code zed}、{@code zed-cm}、{@code standard} 都表示 STANDARD。
   *
   * @throws IllegalArgumentException 未知名字
   */
  public static Dialect fromName(String name) {
    String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    return switch (normalized) {
      case "standard", "zed", "zed-cm", "zedcm" -> STANDARD;
      case "fuzz" -> FUZZ;
      default -> throw new IllegalArgumentException("Unknown dialect '" + name + "' (use standard or fuzz)");
    };
  }
}
