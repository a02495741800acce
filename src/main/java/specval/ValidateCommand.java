package specval;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Stream;

import specval.core.Program;
import specval.printer.PrintMode;
import specval.printer.Printer;
import specval.runtime.ErrorMessages;
import specval.runtime.ValidatorConfig;
import specval.validator.IdSource;
import specval.validator.ModuleWiring;
import specval.validator.NameCollisionException;
import specval.validator.ValidatorOptions;
import specval.validator.WiringResult;

/**
 * {@code validate} 命令：加载程序树，接上校验器子模块，以 VALIDATION 模式打印并写回源文件。
 *
 * <p>退出码：0 成功，1 加载失败，2 参数错误，3 写文件失败。</p>
 */
public final class ValidateCommand {
  private static final Logger logger = Logger.getLogger(ValidateCommand.class.getName());

  static final int EXIT_OK = 0;
  static final int EXIT_LOAD_FAILURE = 1;
  static final int EXIT_USAGE = 2;
  static final int EXIT_WRITE_FAILURE = 3;

  private ValidateCommand() {}

  public static void main(String[] args) {
    configureLogging(System.err);
    System.exit(run(args, System.out, System.err, IdSource.random()));
  }

  private static void configureLogging(PrintStream err) {
    try (InputStream in = ValidateCommand.class.getResourceAsStream("/logging.properties")) {
      if (in != null) LogManager.getLogManager().readConfiguration(in);
    } catch (IOException e) {
      err.println("WARN: logging.properties could not be read: " + e.getMessage());
    }
  }

  /** 命令行参数解析结果。 */
  record Arguments(List<Path> inputs, ValidatorOptions options, Path outDir) {}

  static int run(String[] args, PrintStream out, PrintStream err, IdSource ids) {
    Arguments parsed;
    try {
      parsed = parse(args);
    } catch (IllegalArgumentException e) {
      err.println(ErrorMessages.usage(e.getMessage()));
      return EXIT_USAGE;
    }

    List<Path> files = new ArrayList<>();
    for (Path input : parsed.inputs()) {
      if (Files.isDirectory(input)) {
        try (Stream<Path> walk = Files.walk(input)) {
          walk.filter(p -> Files.isRegularFile(p) && p.getFileName().toString().endsWith(".json"))
              .sorted()
              .forEach(files::add);
        } catch (IOException e) {
          err.println("ERROR: cannot list " + input + ": " + e.getMessage());
          return EXIT_LOAD_FAILURE;
        }
      } else if (Files.isRegularFile(input)) {
        files.add(input);
      } else {
        err.println(ErrorMessages.usage("no such file or folder: " + input));
        return EXIT_USAGE;
      }
    }
    if (files.isEmpty()) {
      logger.warning("No program trees found under " + parsed.inputs());
    }

    int exit = EXIT_OK;
    for (Path file : files) {
      int code = validateFile(file, parsed, out, err, ids);
      if (exit == EXIT_OK) exit = code;
    }
    return exit;
  }

  private static int validateFile(Path file, Arguments args, PrintStream out, PrintStream err, IdSource ids) {
    if (ValidatorConfig.DEBUG) {
      err.println("DEBUG: input=" + file.toAbsolutePath());
      err.println("DEBUG: options=" + args.options());
    }
    Program program;
    try {
      program = new ProgramLoader().load(file);
    } catch (IOException e) {
      err.println("ERROR: " + file + ": " + e.getMessage());
      return EXIT_LOAD_FAILURE;
    }

    String text;
    try {
      WiringResult result = ModuleWiring.wire(program, args.options(), ids);
      text = Printer.print(result.program(), PrintMode.VALIDATION);
    } catch (NameCollisionException e) {
      err.println("ERROR: " + file + ": " + e.getMessage());
      return EXIT_LOAD_FAILURE;
    }

    Path target = outputPath(file, program, args.outDir());
    try {
      if (target.getParent() != null) Files.createDirectories(target.getParent());
      Files.writeString(target, text, StandardCharsets.UTF_8);
    } catch (IOException e) {
      err.println("ERROR: cannot write " + target + ": " + e.getMessage());
      return EXIT_WRITE_FAILURE;
    }
    logger.log(Level.INFO, "Validated {0} -> {1}", new Object[] {file, target});
    out.println(target);
    return EXIT_OK;
  }

  /**
   * 输出位置：程序树记录的源文件（相对 JSON 所在目录解析），否则为 JSON 旁的 {@code <程序名><扩展名>}；
   * 指定 {@code --out} 时只取文件名，写到该目录下。
   */
  static Path outputPath(Path jsonFile, Program program, Path outDir) {
    Path dir = jsonFile.toAbsolutePath().getParent();
    Path target = program.sourcePath() != null
        ? dir.resolve(program.sourcePath())
        : dir.resolve(program.name() + ValidatorConfig.OUTPUT_EXTENSION);
    return outDir == null ? target.normalize() : outDir.resolve(target.getFileName());
  }

  static Arguments parse(String[] args) {
    List<Path> inputs = new ArrayList<>();
    ValidatorOptions options = ValidatorOptions.DEFAULT;
    Path outDir = null;
    for (int i = 0; i < args.length; i++) {
      String a = args[i];
      if (!a.startsWith("--")) {
        inputs.add(Paths.get(a));
        continue;
      }
      String flag = a;
      String value = null;
      int eq = a.indexOf('=');
      if (eq >= 0) {
        flag = a.substring(0, eq);
        value = a.substring(eq + 1);
      }
      switch (flag) {
        case "--addPureCopies" -> options = options.withAddPureCopies(booleanValue(flag, value));
        case "--validatePure" -> options = options.withValidatePure(booleanValue(flag, value));
        case "--validateLemmas" -> options = options.withValidateLemmas(booleanValue(flag, value));
        case "--out" -> {
          if (value == null) {
            if (i + 1 >= args.length) throw new IllegalArgumentException("--out needs a directory");
            value = args[++i];
          }
          outDir = Paths.get(value);
        }
        default -> throw new IllegalArgumentException("unknown option " + flag);
      }
    }
    if (inputs.isEmpty()) {
      throw new IllegalArgumentException("no input file or folder");
    }
    return new Arguments(inputs, options, outDir);
  }

  private static boolean booleanValue(String flag, String value) {
    if (value == null || value.equalsIgnoreCase("true")) return true;
    if (value.equalsIgnoreCase("false")) return false;
    throw new IllegalArgumentException(flag + " expects true or false, got '" + value + "'");
  }
}
