package zed.txt2tex.parser;

import zed.txt2tex.core.ZModel.Citation;
import zed.txt2tex.core.ZModel.InlineMath;
import zed.txt2tex.core.ZModel.Prose;
import zed.txt2tex.core.ZModel.Span;
import zed.txt2tex.exceptions.Txt2TexException;
import zed.txt2tex.lexer.Lexer;
import zed.txt2tex.lexer.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * 把 {@code TEXT:} 行拆成散文、{@code $...$} 内联数学片段与 {@code [cite key 定位]} 引用。
 * 数学片段按其在源文件中的真实行列重新词法分析，报错位置因此准确。
 */
final class TextSplitter {
  private static final String MARKER = "TEXT:";
  private static final String CITE = "[cite ";

  private TextSplitter() {}

  static List<Span> split(Token text) throws Txt2TexException {
    String raw = text.text();
    List<Span> spans = new ArrayList<>();
    StringBuilder prose = new StringBuilder();
    int i = MARKER.length();
    while (i < raw.length() && Character.isWhitespace(raw.charAt(i))) {
      i++;
    }
    while (i < raw.length()) {
      char c = raw.charAt(i);
      if (c == '\\' && i + 1 < raw.length() && raw.charAt(i + 1) == '$') {
        prose.append('$');
        i += 2;
        continue;
      }
      if (c == '[' && raw.startsWith(CITE, i)) {
        Citation citation = citation(raw, i);
        if (citation != null) {
          if (prose.length() > 0) {
            spans.add(new Prose(prose.toString()));
            prose.setLength(0);
          }
          spans.add(citation);
          i = raw.indexOf(']', i) + 1;
          continue;
        }
      }
      if (c != '$') {
        prose.append(c);
        i++;
        continue;
      }
      int close = raw.indexOf('$', i + 1);
      // 词法阶段已保证 $ 成对
      String math = raw.substring(i + 1, close);
      if (prose.length() > 0) {
        spans.add(new Prose(prose.toString()));
        prose.setLength(0);
      }
      int column = text.column() + raw.codePointCount(0, i + 1);
      List<Token> tokens = new Lexer(math, text.line(), column, false).tokenize();
      spans.add(new InlineMath(new Parser(tokens).parseStandaloneExpression()));
      i = close + 1;
    }
    if (prose.length() > 0) {
      spans.add(new Prose(prose.toString()));
    }
    return spans;
  }

  /** {@code [cite key]} 或 {@code [cite key p. 42]}；没有闭合方括号或没有键时按普通文字处理 */
  private static Citation citation(String raw, int start) {
    int close = raw.indexOf(']', start);
    if (close < 0) {
      return null;
    }
    String body = raw.substring(start + CITE.length(), close).strip();
    if (body.isEmpty()) {
      return null;
    }
    String[] parts = body.split("\\s+", 2);
    return new Citation(parts[0], parts.length > 1 ? parts[1] : null);
  }
}
