package zed.txt2tex.runtime;

import zed.txt2tex.exceptions.ParseException;
import zed.txt2tex.exceptions.Txt2TexException;

import java.util.List;

/**
 * 错误消息统一生成工具。
 *
 * <p>异常本身只携带英文描述（测试与调用方依赖其格式）；面向用户输出时，
 * 这里补上出错行的源码、列指示符以及中英文双语的恢复提示。</p>
 */
public final class ErrorMessages {

  private ErrorMessages() {
    // 禁止实例化工具类
  }

  /**
   * 构造双语消息。
   *
   * @param zh 中文描述
   * @param en 英文描述
   * @return 按照“中文 (English)”格式拼接的字符串
   */
  public static String bilingual(String zh, String en) {
    return zh + " (" + en + ")";
  }

  /**
   * 为消息附加恢复提示，提示部分同样采用中英文双语。
   *
   * @param message 主体消息
   * @param hintZh 中文提示
   * @param hintEn 英文提示
   * @return 包含提示信息的完整消息文本
   */
  public static String withHint(String message, String hintZh, String hintEn) {
    return message + "\n提示：" + hintZh + " (Hint: " + hintEn + ")";
  }

  /**
   * 格式化转换错误：消息、出错行及前一行源码、列指示符，能识别时附带提示。
   *
   * @param source 完整源码
   * @param error  转换错误
   * @return 多行错误报告
   */
  public static String format(String source, Txt2TexException error) {
    StringBuilder sb = new StringBuilder(error.getMessage());
    List<String> lines = source == null ? List.of() : source.lines().toList();
    int line = error.line();
    if (line >= 1 && line <= lines.size()) {
      int width = String.valueOf(line).length();
      sb.append("\n\n");
      if (line >= 2) {
        sb.append(gutter(line - 1, width)).append(lines.get(line - 2)).append('\n');
      }
      sb.append(gutter(line, width)).append(lines.get(line - 1)).append('\n');
      sb.append(" ".repeat(width + 1)).append("| ")
        .append(" ".repeat(Math.max(0, error.column() - 1))).append('^');
    }
    String[] hint = hintFor(error);
    if (hint != null) {
      sb.append(withHint("", hint[0], hint[1]));
    }
    return sb.toString();
  }

  private static String gutter(int line, int width) {
    return String.format("%" + width + "d | ", line);
  }

  /** 按描述中的关键字匹配提示；返回 {中文, English} 或 null */
  static String[] hintFor(Txt2TexException error) {
    String d = error.description();
    if (d.contains("'end'")) {
      return new String[]{"每个 axdef / gendef / schema / zed 块都要以单独一行的 end 结束",
        "Close every axdef, gendef, schema or zed block with a line containing 'end'"};
    }
    if (d.startsWith("Unclosed bracket")) {
      return new String[]{"检查括号是否成对，括号内的换行会被忽略",
        "Check that brackets are balanced; line breaks inside brackets are ignored"};
    }
    if (d.startsWith("Unterminated inline math")) {
      return new String[]{"TEXT 行中的 $ 必须成对出现，字面量请写 \\$",
        "Inline math in TEXT lines needs a closing '$'; write \\$ for a literal dollar"};
    }
    if (d.startsWith("Malformed number")) {
      return new String[]{"以数字开头的名字需要下划线，例如 479_courses",
        "Names that start with a digit need an underscore, e.g. 479_courses"};
    }
    if (d.startsWith("Indentation") || d.contains("second root-level")) {
      return new String[]{"证明中的每一行都要与某个外层步骤同列，或更深一层",
        "Each proof line must line up with an enclosing step or be indented under the previous one"};
    }
    if (d.contains("not open here")) {
      return new String[]{"from N 只能引用本分支上已引入的假设 [N]",
        "'from N' can only cite an assumption [N] introduced on the same branch"};
    }
    if (d.contains("already been discharged")) {
      return new String[]{"假设只能被消解一次",
        "An assumption can be discharged only once"};
    }
    if (d.contains("open in two premises")) {
      return new String[]{"同一步的不同前提要用不同的假设编号",
        "Number the assumptions in different premises of one step differently"};
    }
    if (d.contains("'---' line")) {
      return new String[]{"INFRULE 的前提与结论之间需要单独一行 ---",
        "Separate the premises of an INFRULE from its conclusion with a '---' line"};
    }
    if (d.startsWith("Unexpected ','")) {
      return new String[]{"逗号只能出现在括号、集合、序列或声明中；名字后紧贴的 < 是小于号，序列实参请写成 f <a, b>",
        "Commas only appear inside brackets, sets, sequences or declarations; "
          + "'<' glued to a name is less-than, so write f <a, b> for a sequence argument"};
    }
    if (d.startsWith("Truth table row")) {
      return new String[]{"每一行的单元格数要与表头列数相同",
        "Every row needs as many cells as the header"};
    }
    if (d.contains("reaches a different conclusion")) {
      return new String[]{"分情况证明的每个分支必须得出相同的结论",
        "Every case branch must end with the same conclusion"};
    }
    if (error instanceof ParseException pe && !pe.expected().isEmpty()) {
      return new String[]{"此处应为 " + String.join(" / ", pe.expected()),
        "Expected " + String.join(" or ", pe.expected()) + " here"};
    }
    return null;
  }
}
