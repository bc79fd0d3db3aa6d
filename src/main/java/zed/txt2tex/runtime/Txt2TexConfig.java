package zed.txt2tex.runtime;

import zed.txt2tex.gen.Dialect;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * txt2tex 运行配置
 *
 * 集中管理所有环境变量配置，在类加载时读取一次。命令行参数优先于这里的默认值。
 */
public final class Txt2TexConfig {
  private static final Logger LOGGER = Logger.getLogger(Txt2TexConfig.class.getName());

  private Txt2TexConfig() {}

  /**
   * 调试模式开关
   * 环境变量：TXT2TEX_DEBUG
   * 启用时命令行会把阶段耗时和 AST JSON 打到 stderr
   */
  public static final boolean DEBUG = System.getenv("TXT2TEX_DEBUG") != null;

  /**
   * 默认输出方言
   * 环境变量：TXT2TEX_DIALECT（standard / zed / zed-cm / fuzz）
   * 未设置或无法识别时为 STANDARD
   */
  public static final Dialect DEFAULT_DIALECT = resolveDialect(System.getenv("TXT2TEX_DIALECT"), Dialect.STANDARD);

  /**
   * 解析方言名，无法识别时记录警告并回退
   *
   * @param name     方言名，可为 null
   * @param fallback 回退值
   */
  public static Dialect resolveDialect(String name, Dialect fallback) {
    if (name == null || name.isBlank()) {
      return fallback;
    }
    try {
      return Dialect.fromName(name);
    } catch (IllegalArgumentException e) {
      LOGGER.log(Level.WARNING, "未知的方言 ''{0}''，回退到 {1}", new Object[]{name, fallback});
      return fallback;
    }
  }
}
