package zed.txt2tex.exceptions;

/**
 * 结构错误：缩进不一致、假设标签越界、分情况结论不一致、真值表列数不符等。
 */
public class StructureException extends Txt2TexException {
  public StructureException(String description, int line, int column) {
    super(Kind.STRUCTURE, description, line, column);
  }
}
