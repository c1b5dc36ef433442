package info.isaksson.erland.hackoutline;

import info.isaksson.erland.hackoutline.core.FileOutlineService;
import info.isaksson.erland.hackoutline.core.OutlineMode;
import info.isaksson.erland.hackoutline.core.OutlineOptions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * CLI entrypoint: prints the outline of a Hack file, a directory of Hack files, or standard input.
 */
public final class Main {

    private static final Logger log = LogManager.getLogger(Main.class);

    private static final FileOutlineService SERVICE = new FileOutlineService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        return run(args, System.in, System.out, System.err);
    }

    static int run(String[] args, InputStream stdin, PrintStream stdout, PrintStream stderr) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            stderr.println("Error: " + ex.getMessage());
            stderr.println();
            CliArgs.printHelp(stderr);
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp(stdout);
            return 0;
        }

        OutlineOptions options = new OutlineOptions();
        options.mode = parsed.mode;
        options.pretty = parsed.pretty;

        final String output;
        if (parsed.path == null || parsed.path.equals("-")) {
            try {
                String content = new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
                output = SERVICE.render(content, options);
            } catch (IOException e) {
                stderr.println("Error: could not read standard input.");
                stderr.println(e.getMessage());
                return 2;
            }
        } else {
            final Path path = Paths.get(parsed.path);
            if (!Files.exists(path)) {
                stderr.println("Error: path does not exist: " + path.toAbsolutePath().normalize());
                return 1;
            }
            try {
                if (Files.isDirectory(path)) {
                    output = SERVICE.renderDirectory(path, parsed.excludes, options);
                } else {
                    options.fileName = parsed.path;
                    output = SERVICE.render(FileOutlineService.readSource(path), options);
                }
            } catch (IOException e) {
                log.debug("Outline of {} failed", path, e);
                stderr.println("Error: could not read: " + path);
                stderr.println(e.getMessage());
                return 2;
            }
        }

        stdout.print(output);
        if (!output.isEmpty() && !output.endsWith("\n")) {
            stdout.println();
        }
        stdout.flush();
        return 0;
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        OutlineMode mode = OutlineMode.JSON;
        boolean pretty = false;
        /** File, directory or "-"; null means standard input. */
        String path;
        final List<String> excludes = new ArrayList<>();

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                // support --exclude=glob
                if (a.startsWith("--exclude=")) {
                    out.excludes.add(a.substring("--exclude=".length()));
                    continue;
                }

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--mode":
                        out.mode = OutlineMode.parseCli(requireValue(args, ++i, "--mode"));
                        break;
                    case "--pretty":
                        out.pretty = parseBoolean(requireValue(args, ++i, "--pretty"), "--pretty");
                        break;
                    case "--exclude":
                        out.excludes.add(requireValue(args, ++i, "--exclude"));
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        if (out.path == null) {
                            out.path = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static boolean parseBoolean(String v, String flag) {
            if (v == null) throw new IllegalArgumentException("Missing value for " + flag);
            String s = v.trim().toLowerCase(Locale.ROOT);
            if (s.equals("true") || s.equals("1") || s.equals("yes")) return true;
            if (s.equals("false") || s.equals("0") || s.equals("no")) return false;
            throw new IllegalArgumentException("Invalid boolean for " + flag + ": " + v);
        }

        static void printHelp(PrintStream out) {
            out.println(
                    "hack-outline\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar hack-outline.jar [--mode <mode>] [--pretty <bool>] [--exclude <glob>]... [<path>|-]\n" +
                    "\n" +
                    "Reads standard input when no path (or '-') is given; positions then carry an empty file name.\n" +
                    "A directory is scanned for .php, .hh, .hack and .hck files.\n" +
                    "\n" +
                    "Options:\n" +
                    "  --mode <mode>          Output shape. Modes:\n" +
                    "                         legacy | json | debug (default: json)\n" +
                    "                         legacy: flat list of functions, classes and Class::methods\n" +
                    "                         json:   declaration tree with positions, spans and modifiers\n" +
                    "                         debug:  indented text dump\n" +
                    "  --pretty <bool>        Indent JSON output (default: false)\n" +
                    "  --exclude <glob>       Exclude paths matching glob when outlining a directory (repeatable).\n" +
                    "                         Matched against paths relative to the directory, '/' separated.\n" +
                    "                         Also supports --exclude=<glob>.\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar hack-outline.jar src/Foo.php\n" +
                    "  java -jar hack-outline.jar --mode legacy < src/Foo.php\n" +
                    "  java -jar hack-outline.jar --mode debug --exclude \"**/__tests__/**\" src\n"
            );
        }
    }
}
