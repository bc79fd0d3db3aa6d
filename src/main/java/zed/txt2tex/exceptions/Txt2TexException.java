package zed.txt2tex.exceptions;

/**
 * 转换失败的公共父类。
 * <p>
 * 三种失败各自对应一个子类，都带行列号（均从 1 开始）。消息格式固定为
 * {@code <Kind> at line L, column C: description}，命令行和测试都依赖这一格式。
 */
public abstract class Txt2TexException extends Exception {

  public enum Kind {
    LEX("LexError"),
    PARSE("ParseError"),
    STRUCTURE("StructureError");

    private final String label;

    Kind(String label) { this.label = label; }

    public String label() { return label; }
  }

  private final Kind kind;
  private final String description;
  private final int line;
  private final int column;

  protected Txt2TexException(Kind kind, String description, int line, int column) {
    super(kind.label() + " at line " + line + ", column " + column + ": " + description);
    this.kind = kind;
    this.description = description;
    this.line = line;
    this.column = column;
  }

  public Kind kind() { return kind; }

  /** 不含位置前缀的错误描述 */
  public String description() { return description; }

  public int line() { return line; }

  public int column() { return column; }
}
