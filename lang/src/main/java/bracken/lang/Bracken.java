package bracken.lang;

import static lombok.AccessLevel.PRIVATE;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor(access = PRIVATE)
public class Bracken {

    static final int EX_OK = 0;
    static final int EX_USAGE = 64;
    static final int EX_DATAERR = 65;
    static final int EX_IOERR = 74;

    private static final String USAGE = "Usage: bracken [--tokens] [--ast] [--lenient-brackets] <file>";

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        var flags = new Flags();
        String path = null;
        for (var arg : args) {
            switch (arg) {
            case "--tokens":
                flags.printTokens = true;
                break;
            case "--ast":
                flags.printAst = true;
                break;
            case "--lenient-brackets":
                flags.strictBrackets = false;
                break;
            default:
                if (path != null || (arg.startsWith("-") && arg.length() > 1)) {
                    out.println(USAGE);
                    return EX_USAGE;
                }
                path = arg;
            }
        }
        if (path == null) {
            out.println(USAGE);
            return EX_USAGE;
        }

        String source;
        try {
            var bytes = "-".equals(path) ? in.readAllBytes() : Files.readAllBytes(Paths.get(path));
            source = decode(bytes);
        } catch (IOException ex) {
            err.println("bracken: cannot read " + path + ": " + ex.getMessage());
            return EX_IOERR;
        }

        var options = CompileOptions.defaults()
            .withFileName("-".equals(path) ? "<stdin>" : path)
            .withStrictBrackets(flags.strictBrackets);

        String python;
        try {
            python = compile(new Compiler(options), source, flags, out);
        } catch (CompileException ex) {
            report(ex, err);
            return EX_DATAERR;
        }

        if ("-".equals(path)) {
            out.print(python);
            return EX_OK;
        }

        var target = outputPathFor(Paths.get(path));
        try {
            Files.writeString(target, python, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            err.println("bracken: cannot write " + target + ": " + ex.getMessage());
            return EX_IOERR;
        }

        debugBlock(out, "compiled to python", python);
        return EX_OK;
    }

    /**
     * Strict UTF-8 decoding; malformed input fails instead of turning into
     * replacement characters.
     */
    private static String decode(byte[] bytes) throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder()
            .decode(ByteBuffer.wrap(bytes))
            .toString();
    }

    private static String compile(Compiler compiler, String source, Flags flags, PrintStream out) {
        if (flags.printTokens) {
            compiler.tokens(source).forEach(out::println);
        }

        var block = compiler.parse(source);

        if (flags.printAst) {
            block.calls().forEach(out::println);
        }

        return compiler.render(block).text();
    }

    /**
     * The source path with its extension replaced by {@code .py}, or with
     * {@code .py} appended when it has none.
     */
    static Path outputPathFor(Path source) {
        var name = source.getFileName().toString();
        var dot = name.lastIndexOf('.');
        var stem = dot > 0 ? name.substring(0, dot) : name;
        return source.resolveSibling(stem + ".py");
    }

    private static void debugBlock(PrintStream out, String title, String value) {
        var delim = "-".repeat(12);
        out.println(delim + " " + title + " " + delim);
        out.println(value);
    }

    private static void report(CompileException error, PrintStream err) {
        err.println(error.stage() + ": " + error.getMessage() + " [" + error.getLocation() + "]");
    }

    private static class Flags {
        boolean printTokens = false;
        boolean printAst = false;
        boolean strictBrackets = true;
    }
}
