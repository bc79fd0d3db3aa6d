package zed.txt2tex.runtime;

import org.junit.jupiter.api.Test;
import zed.txt2tex.gen.Dialect;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Txt2TexConfig 方言解析测试
 */
class Txt2TexConfigTest {

  @Test
  void testResolveDialect_UnsetUsesFallback() {
    assertEquals(Dialect.FUZZ, Txt2TexConfig.resolveDialect(null, Dialect.FUZZ));
    assertEquals(Dialect.STANDARD, Txt2TexConfig.resolveDialect("  ", Dialect.STANDARD));
  }

  @Test
  void testResolveDialect_Aliases() {
    assertEquals(Dialect.FUZZ, Txt2TexConfig.resolveDialect("fuzz", Dialect.STANDARD));
    assertEquals(Dialect.STANDARD, Txt2TexConfig.resolveDialect("zed", Dialect.FUZZ));
    assertEquals(Dialect.STANDARD, Txt2TexConfig.resolveDialect("ZED_CM", Dialect.FUZZ));
  }

  @Test
  void testResolveDialect_UnknownFallsBack() {
    assertEquals(Dialect.FUZZ, Txt2TexConfig.resolveDialect("latex2e", Dialect.FUZZ));
  }

  @Test
  void testDefaultDialect_IsSet() {
    assertNotNull(Txt2TexConfig.DEFAULT_DIALECT);
  }
}
