package zed.txt2tex.lexer;

import zed.txt2tex.exceptions.LexException;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 手写词法分析器。
 * <p>
 * 规则：
 * <ul>
 *   <li>最长匹配：{@code <=>} 先于 {@code =>}，{@code +->>} 先于 {@code +->}，{@code o9} 是整词关键字</li>
 *   <li>行首标记（{@code TEXT:}、{@code PROOF:}、{@code === 标题 ===}、{@code [1]}、{@code ::}、{@code case p:} 等）
 *       只在行首且没有未闭合括号时识别</li>
 *   <li>括号栈：括号内的换行不产生 NEWLINE，文件结束时仍有未闭合括号则报错</li>
 *   <li>ASCII {@code <} 前面不是操作数时是序列左尖括号，序列打开时 {@code >} 是右尖括号；
 *       名字后空一格紧贴内容的 {@code <a, b>} 也是序列</li>
 *   <li>制表符展开到下一个 4 的倍数列</li>
 * </ul>
 * 除空白外源码中的每个字符都落在某个单元的原文中。
 */
public final class Lexer {

  private static final Logger LOGGER = Logger.getLogger(Lexer.class.getName());

  private static final int TAB_WIDTH = 4;

  private static final Pattern TRUTH_TABLE = Pattern.compile("^TRUTH\\s+TABLE:");
  private static final Pattern PART = Pattern.compile("^\\(([a-j])\\)(?=\\s|$)");
  private static final Pattern LABEL = Pattern.compile("^\\[(\\d+)\\](?=\\s|$)");
  private static final Pattern CASE = Pattern.compile("^case\\s+([^:\\s][^:]*?)\\s*:(?=\\s|$)");
  private static final Pattern RULE_LINE = Pattern.compile("^-{3,}\\s*$");
  private static final Pattern METADATA =
    Pattern.compile("^(TITLE|SUBTITLE|AUTHOR|DATE|INSTITUTION|BIBLIOGRAPHY|BIBLIOGRAPHY_STYLE):");

  /** 这些单元结束一个操作数，其后的 {@code <} 只能是小于号 */
  private static final Set<TokenType> OPERAND_END = EnumSet.of(
    TokenType.IDENTIFIER, TokenType.NUMBER, TokenType.RPAREN, TokenType.RBRACKET,
    TokenType.RBRACE, TokenType.RANGLE, TokenType.RBAG, TokenType.RIMG,
    TokenType.EMPTY_SEQ, TokenType.EMPTY_SET, TokenType.TILDE);

  private static final Map<TokenType, TokenType> CLOSERS = Map.of(
    TokenType.RPAREN, TokenType.LPAREN,
    TokenType.RBRACKET, TokenType.LBRACKET,
    TokenType.RBRACE, TokenType.LBRACE,
    TokenType.RANGLE, TokenType.LANGLE,
    TokenType.RBAG, TokenType.LBAG,
    TokenType.RIMG, TokenType.LIMG,
    TokenType.RDATA, TokenType.LDATA);

  private final String src;
  private final boolean markers;
  private final List<Token> tokens = new ArrayList<>();
  private final Deque<Token> brackets = new ArrayDeque<>();

  private int pos;
  private int line;
  private int column;
  private boolean lineStart = true;
  /** 行首已出现过假设标签或并列标记，此后只再识别这两种标记 */
  private boolean proofPrefix;
  private TokenType last;

  public Lexer(String source) {
    this(source, 1, 1, true);
  }

  /**
   * @param source  源码
   * @param line    起始行号，用于内联数学片段按原位置报错
   * @param column  起始列号
   * @param markers 是否识别行首块标记
   */
  public Lexer(String source, int line, int column, boolean markers) {
    this.src = source == null ? "" : source;
    this.line = line;
    this.column = column;
    this.markers = markers;
  }

  /** 词法分析整个输入，结果以 EOF 单元结尾 */
  public List<Token> tokenize() throws LexException {
    while (pos < src.length()) {
      int c = src.codePointAt(pos);
      if (c == '\n') {
        newline();
        continue;
      }
      if (c == '\r') {
        pos++;
        continue;
      }
      if (c == '\t') {
        column = ((column - 1) / TAB_WIDTH + 1) * TAB_WIDTH + 1;
        pos++;
        continue;
      }
      if (Character.isWhitespace(c)) {
        pos += Character.charCount(c);
        column++;
        continue;
      }
      if (lineStart && markers && brackets.isEmpty() && lexMarker()) {
        continue;
      }
      lineStart = false;
      proofPrefix = false;
      lexToken(c);
    }
    if (!brackets.isEmpty()) {
      Token open = brackets.peek();
      throw new LexException("Unclosed bracket '" + open.text() + "'", open.line(), open.column());
    }
    tokens.add(new Token(TokenType.EOF, "", line, column));
    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.log(Level.FINE, "Tokenized {0} tokens", tokens.size());
    }
    return tokens;
  }

  private void newline() {
    if (brackets.isEmpty()) {
      tokens.add(new Token(TokenType.NEWLINE, "\n", line, column));
      last = null;
    }
    lineStart = brackets.isEmpty();
    proofPrefix = false;
    pos++;
    line++;
    column = 1;
  }

  // ============================================================
  // 行首标记
  // ============================================================

  private boolean lexMarker() throws LexException {
    String rest = restOfLine();
    if (proofPrefix) {
      return lexProofPrefix(rest);
    }
    if (rest.startsWith("TEXT:")) {
      checkInlineMath(rest);
      emitRaw(TokenType.TEXT, rest.stripTrailing());
      return true;
    }
    if (rest.startsWith("LATEX:")) {
      emitRaw(TokenType.LATEX, rest.stripTrailing());
      return true;
    }
    if (rest.startsWith("PURETEXT:")) {
      emitRaw(TokenType.PURETEXT, rest.stripTrailing());
      return true;
    }
    if (rest.startsWith("CONTENTS:")) {
      emitRaw(TokenType.CONTENTS, rest.stripTrailing());
      return true;
    }
    if (rest.startsWith("PAGEBREAK:")) {
      emitRaw(TokenType.PAGEBREAK, "PAGEBREAK:");
      return true;
    }
    if (rest.startsWith("INFRULE:")) {
      emitRaw(TokenType.INFRULE, "INFRULE:");
      return true;
    }
    if (RULE_LINE.matcher(rest).find()) {
      emitRaw(TokenType.RULE_LINE, rest.stripTrailing());
      return true;
    }
    if (rest.startsWith("PROOF:")) {
      emitRaw(TokenType.PROOF, "PROOF:");
      return true;
    }
    if (rest.startsWith("EQUIV:") || rest.startsWith("ARGUE:")) {
      emitRaw(TokenType.EQUIV, rest.substring(0, 6));
      return true;
    }
    Matcher m = METADATA.matcher(rest);
    if (m.find()) {
      emitRaw(TokenType.METADATA, rest.stripTrailing());
      return true;
    }
    m = TRUTH_TABLE.matcher(rest);
    if (m.find()) {
      emitRaw(TokenType.TRUTH_TABLE, m.group());
      return true;
    }
    if (rest.startsWith("===")) {
      int close = rest.indexOf("===", 3);
      if (close < 0) {
        throw new LexException("Unterminated section marker '==='", line, column);
      }
      emitRaw(TokenType.SECTION, rest.substring(0, close + 3));
      return true;
    }
    if (rest.startsWith("**")) {
      int close = rest.indexOf("**", 2);
      if (close < 0) {
        throw new LexException("Unterminated solution marker '**'", line, column);
      }
      emitRaw(TokenType.SOLUTION, rest.substring(0, close + 2));
      return true;
    }
    m = PART.matcher(rest);
    if (m.find()) {
      emitRaw(TokenType.PART_LABEL, m.group());
      return true;
    }
    m = CASE.matcher(rest);
    if (m.find()) {
      emitRaw(TokenType.CASE, m.group());
      return true;
    }
    return lexProofPrefix(rest);
  }

  private boolean lexProofPrefix(String rest) {
    Matcher m = LABEL.matcher(rest);
    if (m.find()) {
      emitRaw(TokenType.ASSUMPTION_LABEL, m.group());
      lineStart = true;
      proofPrefix = true;
      return true;
    }
    if (rest.startsWith("::") && !rest.startsWith("::=")) {
      emitRaw(TokenType.SIBLING, "::");
      lineStart = true;
      proofPrefix = true;
      return true;
    }
    return false;
  }

  /** 校验 TEXT 行中的 {@code $} 成对出现，{@code \$} 视为普通字符 */
  private void checkInlineMath(String rest) throws LexException {
    int open = -1;
    for (int i = 0; i < rest.length(); i++) {
      char ch = rest.charAt(i);
      if (ch == '\\' && i + 1 < rest.length() && rest.charAt(i + 1) == '$') {
        i++;
      } else if (ch == '$') {
        open = open < 0 ? i : -1;
      }
    }
    if (open >= 0) {
      int col = column + rest.codePointCount(0, open);
      throw new LexException("Unterminated inline math '$'", line, col);
    }
  }

  private String restOfLine() {
    int end = src.indexOf('\n', pos);
    String rest = end < 0 ? src.substring(pos) : src.substring(pos, end);
    return rest.endsWith("\r") ? rest.substring(0, rest.length() - 1) : rest;
  }

  private void emitRaw(TokenType type, String text) {
    tokens.add(new Token(type, text, line, column));
    pos += text.length();
    column += text.codePointCount(0, text.length());
    lineStart = false;
    last = type;
  }

  // ============================================================
  // 普通单元
  // ============================================================

  private void lexToken(int c) throws LexException {
    if (c < 128 && Character.isLetter(c)) {
      lexWord();
    } else if (c >= '0' && c <= '9') {
      if (src.startsWith("77->", pos)) {
        emit(TokenType.FFUN, "77->");
      } else {
        lexNumber();
      }
    } else if (!lexSymbol(c)) {
      if (Character.isLetter(c)) {
        lexWord();
      } else {
        throw new LexException("Unexpected character '" + new String(Character.toChars(c)) + "'", line, column);
      }
    }
  }

  private void lexWord() {
    int start = pos;
    while (pos < src.length()) {
      int c = src.codePointAt(pos);
      if (Character.isLetterOrDigit(c) || c == '_') {
        pos += Character.charCount(c);
      } else {
        break;
      }
    }
    int bare = pos;
    while (pos < src.length()) {
      char c = src.charAt(pos);
      if (c == '\'' || c == '?' || (c == '!' && !src.startsWith("!=", pos))) {
        pos++;
      } else {
        break;
      }
    }
    String text = src.substring(start, pos);
    TokenType type = TokenType.IDENTIFIER;
    if (bare == pos) {
      TokenType kw = TokenType.keyword(text);
      if (kw != null) {
        type = kw;
      }
    }
    pos = start;
    emit(type, text);
  }

  private void lexNumber() throws LexException {
    int start = pos;
    int i = pos;
    while (i < src.length() && Character.isDigit(src.charAt(i))) {
      i++;
    }
    if (i < src.length() && src.charAt(i) == '_') {
      if (i + 1 < src.length() && Character.isLetterOrDigit(src.charAt(i + 1))) {
        // 479_courses 这类以数字开头的标识符
        while (i < src.length() && (Character.isLetterOrDigit(src.charAt(i)) || src.charAt(i) == '_')) {
          i++;
        }
        emit(TokenType.IDENTIFIER, src.substring(start, i));
        return;
      }
      throw new LexException("Malformed number '" + src.substring(start, i + 1) + "'", line, column);
    }
    if (i < src.length() && Character.isLetter(src.charAt(i))) {
      int j = i;
      while (j < src.length() && Character.isLetterOrDigit(src.charAt(j))) {
        j++;
      }
      throw new LexException("Malformed number '" + src.substring(start, j) + "'", line, column);
    }
    emit(TokenType.NUMBER, src.substring(start, i));
  }

  private boolean lexSymbol(int c) {
    Token top = brackets.peek();
    if (c == '>') {
      if (top != null && top.is(TokenType.LDATA) && src.startsWith(">>", pos)) {
        emit(TokenType.RDATA, ">>");
        return true;
      }
      if (top != null && top.is(TokenType.LANGLE)
          && !src.startsWith(">=", pos) && !src.startsWith(">->", pos) && !src.startsWith(">+>", pos)) {
        emit(TokenType.RANGLE, ">");
        return true;
      }
    }
    if (c == ']' && src.startsWith("]]", pos) && top != null && top.is(TokenType.LBAG)) {
      emit(TokenType.RBAG, "]]");
      return true;
    }
    for (Map.Entry<String, TokenType> e : TokenType.symbols()) {
      if (src.startsWith(e.getKey(), pos)) {
        emit(e.getValue(), e.getKey());
        return true;
      }
    }
    if (c == '<') {
      boolean operandBefore = last != null && OPERAND_END.contains(last);
      boolean sequence = !operandBefore || (last == TokenType.IDENTIFIER && sequenceArgumentAhead());
      emit(sequence ? TokenType.LANGLE : TokenType.LESS, "<");
      return true;
    }
    if (c == '>') {
      emit(TokenType.GREATER, ">");
      return true;
    }
    return false;
  }

  /**
   * 名字后的 {@code <} 默认是小于号；{@code rev <a, b>} 这种写法（前有空格、后无空格，
   * 同一行内有紧贴内容的 {@code >} 收尾）按序列实参处理。
   */
  private boolean sequenceArgumentAhead() {
    if (pos == 0 || pos + 1 >= src.length()) {
      return false;
    }
    char before = src.charAt(pos - 1);
    char after = src.charAt(pos + 1);
    if ((before != ' ' && before != '\t') || Character.isWhitespace(after) || "<>=-|".indexOf(after) >= 0) {
      return false;
    }
    int end = src.indexOf('\n', pos);
    if (end < 0) {
      end = src.length();
    }
    for (int i = pos + 2; i < end; i++) {
      if (src.charAt(i) != '>') {
        continue;
      }
      char prev = src.charAt(i - 1);
      char next = i + 1 < end ? src.charAt(i + 1) : ' ';
      if (!Character.isWhitespace(prev) && "-+|>=".indexOf(prev) < 0 && next != '=' && next != '>') {
        return true;
      }
    }
    return false;
  }

  private void emit(TokenType type, String text) {
    Token token = new Token(type, text, line, column);
    tokens.add(token);
    pos += text.length();
    column += text.codePointCount(0, text.length());
    last = type;
    trackBrackets(token);
  }

  private void trackBrackets(Token token) {
    switch (token.type()) {
      case LPAREN, LBRACKET, LBRACE, LANGLE, LBAG, LIMG, LDATA -> brackets.push(token);
      case RPAREN, RBRACKET, RBRACE, RANGLE, RBAG, RIMG, RDATA -> {
        Token top = brackets.peek();
        if (top != null && top.type() == CLOSERS.get(token.type())) {
          brackets.pop();
        }
      }
      default -> { }
    }
  }
}
