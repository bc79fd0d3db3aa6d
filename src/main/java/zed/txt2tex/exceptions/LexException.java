package zed.txt2tex.exceptions;

/** 无法识别的字符、非法数字、未闭合的括号或 {@code $} 片段。 */
public class LexException extends Txt2TexException {
  public LexException(String description, int line, int column) {
    super(Kind.LEX, description, line, column);
  }
}
