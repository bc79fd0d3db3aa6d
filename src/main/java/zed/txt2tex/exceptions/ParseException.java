package zed.txt2tex.exceptions;

import java.util.List;

/**
 * 语法错误：报告出错的词法单元以及此处可以接受的内容。
 */
public class ParseException extends Txt2TexException {
  private final String found;
  private final List<String> expected;

  public ParseException(String description, String found, List<String> expected, int line, int column) {
    super(Kind.PARSE, describe(description, expected), line, column);
    this.found = found;
    this.expected = expected == null ? List.of() : List.copyOf(expected);
  }

  /** 出错位置的词法单元文本，输入结束时为 {@code <end of input>} */
  public String found() { return found; }

  public List<String> expected() { return expected; }

  private static String describe(String description, List<String> expected) {
    if (expected == null || expected.isEmpty()) {
      return description;
    }
    return description + " (expected " + String.join(", ", expected) + ")";
  }
}
