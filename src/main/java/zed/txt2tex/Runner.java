package zed.txt2tex;

import zed.txt2tex.exceptions.Txt2TexException;
import zed.txt2tex.gen.Dialect;
import zed.txt2tex.runtime.ErrorMessages;
import zed.txt2tex.runtime.Txt2TexConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class Runner {
  public static void main(String[] args) {
    int code = run(args, System.in, System.out, System.err);
    if (code != 0) {
      System.exit(code);
    }
  }

  /**
   * 命令行主体，返回退出码：0 成功，1 转换失败，2 用法或 I/O 错误。
   */
  static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
    Dialect dialect = Txt2TexConfig.DEFAULT_DIALECT;
    boolean fragment = false;
    boolean json = false;
    String output = null;
    List<String> inputs = new ArrayList<>();

    // Support --dialect=<name>, --dialect <name>, --fuzz, --standard
    // Support -o <file> / --output=<file>, --fragment, --json
    for (int i = 0; i < args.length; i++) {
      String a = args[i];
      String name = null;
      if (a.startsWith("--dialect=")) name = a.substring("--dialect=".length());
      else if ("--dialect".equals(a) || "-d".equals(a)) {
        if (i + 1 >= args.length) return usage(err, "missing value for " + a);
        name = args[++i];
      }
      else if ("--fuzz".equals(a)) name = "fuzz";
      else if ("--standard".equals(a) || "--zed".equals(a)) name = "standard";
      if (name != null) {
        try {
          dialect = Dialect.fromName(name);
        } catch (IllegalArgumentException e) {
          return usage(err, e.getMessage());
        }
        continue;
      }

      if (a.startsWith("--output=")) output = a.substring("--output=".length());
      else if ("-o".equals(a) || "--output".equals(a)) {
        if (i + 1 >= args.length) return usage(err, "missing value for " + a);
        output = args[++i];
      }
      else if ("--fragment".equals(a)) fragment = true;
      else if ("--json".equals(a)) json = true;
      else if ("-h".equals(a) || "--help".equals(a)) return usage(err, null);
      else if (a.startsWith("-") && !"-".equals(a)) return usage(err, "unknown option " + a);
      else inputs.add(a);
    }

    if (inputs.size() != 1) {
      return usage(err, inputs.isEmpty() ? "no input file" : "only one input file is supported");
    }

    String source;
    try {
      source = "-".equals(inputs.get(0))
          ? new String(in.readAllBytes(), StandardCharsets.UTF_8)
          : Files.readString(Path.of(inputs.get(0)), StandardCharsets.UTF_8);
    } catch (IOException e) {
      err.println("txt2tex: cannot read " + inputs.get(0) + ": " + e.getMessage());
      return 2;
    }

    if (Txt2TexConfig.DEBUG) {
      err.println("DEBUG: input=" + inputs.get(0));
      err.println("DEBUG: dialect=" + dialect);
    }

    String result;
    try {
      if (json) {
        result = Txt2Tex.toJson(Txt2Tex.parse(source));
      } else if (fragment) {
        result = Txt2Tex.convert(source, dialect);
      } else {
        result = Txt2Tex.convertDocument(source, dialect);
      }
    } catch (Txt2TexException e) {
      err.println(ErrorMessages.format(source, e));
      return 1;
    }

    if (output == null) {
      out.println(result);
      return 0;
    }
    try {
      Files.writeString(Path.of(output), result.endsWith("\n") ? result : result + "\n", StandardCharsets.UTF_8);
    } catch (IOException e) {
      err.println("txt2tex: cannot write " + output + ": " + e.getMessage());
      return 2;
    }
    return 0;
  }

  private static int usage(PrintStream err, String problem) {
    if (problem != null) {
      err.println("txt2tex: " + problem);
    }
    err.println("Usage: Runner <input.txt | -> [--dialect=<standard|fuzz>] [-o <file>] [--fragment] [--json]");
    err.println("  --dialect=<name>  Output dialect (default: " + Txt2TexConfig.DEFAULT_DIALECT
        + ", env TXT2TEX_DIALECT)");
    err.println("  --fuzz            Same as --dialect=fuzz");
    err.println("  --standard        Same as --dialect=standard (zed-cm)");
    err.println("  -o <file>         Write output to file instead of stdout");
    err.println("  --fragment        Emit body only, without preamble");
    err.println("  --json            Dump the parsed AST as JSON");
    err.println("");
    err.println("Examples:");
    err.println("  Runner notes.txt -o notes.tex");
    err.println("  Runner notes.txt --fuzz --fragment");
    return problem == null ? 0 : 2;
  }
}
