package zed.txt2tex;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runner 命令行测试
 *
 * 通过 run() 直接驱动，捕获 stdout / stderr 与退出码，不调用 System.exit。
 */
class RunnerTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String stdin, String... args) {
        InputStream in = new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8));
        return Runner.run(args, in,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    // ============================================================
    // 用法
    // ============================================================

    @Test
    void testHelp_ExitsZero() {
        assertEquals(0, run("", "--help"));
        assertTrue(stderr().contains("Usage: Runner"));
    }

    @Test
    void testNoInput_IsUsageError() {
        assertEquals(2, run(""));
        assertTrue(stderr().contains("no input file"));
    }

    @Test
    void testUnknownOption_IsUsageError() {
        assertEquals(2, run("", "--verbose", "-"));
        assertTrue(stderr().contains("unknown option --verbose"));
    }

    @Test
    void testUnknownDialect_IsUsageError() {
        assertEquals(2, run("", "--dialect=latex2e", "-"));
        assertTrue(stderr().contains("Unknown dialect 'latex2e'"));
    }

    @Test
    void testMissingFile_IsIoError(@TempDir Path dir) {
        assertEquals(2, run("", dir.resolve("nope.txt").toString()));
        assertTrue(stderr().contains("cannot read"));
    }

    // ============================================================
    // 转换
    // ============================================================

    @Test
    void testStdin_Fragment() {
        assertEquals(0, run("p and q", "--fragment", "-"));
        assertEquals("$p \\land q$", stdout().strip());
    }

    @Test
    void testStdin_FuzzFlag() {
        assertEquals(0, run("x in N", "--fuzz", "--fragment", "-"));
        assertEquals("$x \\in \\nat$", stdout().strip());
    }

    @Test
    void testDialectOption_SeparateValue() {
        assertEquals(0, run("x in N", "-d", "standard", "--fragment", "-"));
        assertEquals("$x \\in \\mathbb{N}$", stdout().strip());
    }

    @Test
    void testFile_ToOutputFile(@TempDir Path dir) throws Exception {
        Path input = dir.resolve("notes.txt");
        Files.writeString(input, "given Person\n", StandardCharsets.UTF_8);
        Path output = dir.resolve("notes.tex");

        assertEquals(0, run("", input.toString(), "-o", output.toString()));
        String tex = Files.readString(output, StandardCharsets.UTF_8);
        assertTrue(tex.startsWith("\\documentclass{article}"), tex);
        assertTrue(tex.contains("\\begin{zed}\n[Person]\n\\end{zed}"), tex);
        assertEquals("", stdout());
    }

    @Test
    void testJson_DumpsAst() {
        assertEquals(0, run("given A", "--json", "-"));
        assertTrue(stdout().contains("\"kind\" : \"Given\""), stdout());
    }

    @Test
    void testConversionError_ExitsOneWithReport() {
        assertEquals(1, run("schema S\n  x : N\n", "-"));
        String report = stderr();
        assertTrue(report.startsWith("ParseError at line 3, column 1:"), report);
        assertTrue(report.contains("提示："), report);
        assertEquals("", stdout());
    }
}
