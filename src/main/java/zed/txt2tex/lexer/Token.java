package zed.txt2tex.lexer;

/**
 * 词法单元：种类、源码原文以及起始行列（均从 1 开始，制表符按 4 列对齐展开）。
 */
public record Token(TokenType type, String text, int line, int column) {

  /** 紧随本单元之后的列号 */
  public int endColumn() {
    return column + text.codePointCount(0, text.length());
  }

  /** 两个单元之间没有任何空白 */
  public boolean touches(Token next) {
    return next != null && line == next.line && endColumn() == next.column;
  }

  public boolean is(TokenType t) {
    return type == t;
  }

  @Override
  public String toString() {
    return type + "('" + text + "')@" + line + ":" + column;
  }
}
