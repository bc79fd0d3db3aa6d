package zed.txt2tex;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import zed.txt2tex.core.ZModel.Document;
import zed.txt2tex.exceptions.Txt2TexException;
import zed.txt2tex.gen.Dialect;
import zed.txt2tex.gen.LatexGenerator;
import zed.txt2tex.lexer.Lexer;
import zed.txt2tex.lexer.Token;
import zed.txt2tex.parser.Parser;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * txt2tex 转换入口
 * <p>
 * 把白板风格的 Z 记法文本转换为 LaTeX。
 * <p>
 * 转换管道：
 * <pre>
 * 源码 → Lexer（词法单元） → Parser（AST，证明块经 ProofTreeBuilder 建树并检查标签）
 *      → LatexGenerator（按方言渲染）→ LaTeX
 * </pre>
 * <p>
 * 每一步都是纯函数：同一输入与方言总得到同一输出，可以并发调用。
 */
public final class Txt2Tex {

    private static final Logger LOGGER = Logger.getLogger(Txt2Tex.class.getName());

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private Txt2Tex() {
        // 工具类，禁止实例化
    }

    /**
     * 词法分析
     *
     * @param source 源码
     * @return 以 EOF 结尾的词法单元序列
     * @throws Txt2TexException 无法识别的字符等
     */
    public static List<Token> tokenize(String source) throws Txt2TexException {
        return new Lexer(source).tokenize();
    }

    /**
     * 解析为 AST
     *
     * @param source 源码
     * @return 文档
     * @throws Txt2TexException 词法、语法或结构错误
     */
    public static Document parse(String source) throws Txt2TexException {
        long start = System.nanoTime();
        Document doc = new Parser(tokenize(source)).parseDocument();
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.log(Level.FINE, "Parsed {0} items in {1} ms",
                    new Object[]{doc.items().size(), (System.nanoTime() - start) / 1_000_000});
        }
        return doc;
    }

    /**
     * 转换为 LaTeX 片段（不含导言区）
     *
     * @param source  源码
     * @param dialect 输出方言
     * @return LaTeX 片段
     * @throws Txt2TexException 任一阶段失败
     */
    public static String convert(String source, Dialect dialect) throws Txt2TexException {
        return new LatexGenerator(dialect).generate(parse(source));
    }

    /**
     * 转换为可直接编译的完整 LaTeX 文档
     *
     * @param source  源码
     * @param dialect 输出方言
     * @return 含导言区的 LaTeX 文档
     * @throws Txt2TexException 任一阶段失败
     */
    public static String convertDocument(String source, Dialect dialect) throws Txt2TexException {
        Document doc = parse(source);
        String latex = new LatexGenerator(dialect).generateDocument(doc);
        LOGGER.log(Level.INFO, "Converted {0} items to {1} LaTeX", new Object[]{doc.items().size(), dialect});
        return latex;
    }

    /**
     * AST 导出为缩进 JSON（调试用）
     *
     * @param doc 文档
     * @return JSON 字符串
     */
    public static String toJson(Document doc) {
        try {
            return MAPPER.writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("AST JSON 序列化失败: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * 从 JSON 还原 AST，供外部构造的语法树直接进入生成器
     *
     * @param json {@link #toJson} 产出的 JSON
     * @return 文档
     */
    public static Document fromJson(String json) {
        try {
            return MAPPER.readValue(json, Document.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("AST JSON 反序列化失败: " + e.getOriginalMessage(), e);
        }
    }
}
