package bracken.lang;

import java.io.Reader;
import java.io.StringReader;
import java.util.List;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Tokenizes, parses and renders a source text. Instances are immutable and
 * may be reused; each compilation gets its own scanner and parser.
 */
@RequiredArgsConstructor
public final class Compiler {

    @Getter
    private final @NonNull CompileOptions options;

    private final PythonPrinter printer = new PythonPrinter();

    public Compiler() {
        this(CompileOptions.defaults());
    }

    public PythonPrinter.Rendering compile(@NonNull String source) {
        return compile(new StringReader(source));
    }

    public PythonPrinter.Rendering compile(@NonNull Reader source) {
        return render(parse(source));
    }

    public PythonPrinter.Rendering render(@NonNull Ast.Block block) {
        return printer.render(block);
    }

    public Ast.Block parse(@NonNull String source) {
        return parse(new StringReader(source));
    }

    public Ast.Block parse(@NonNull Reader source) {
        var parser = new Parser(stream(source), options.strictBrackets());
        return parser.parse();
    }

    /**
     * Scans the whole source, returning its tokens followed by the end marker.
     */
    public List<Token> tokens(@NonNull String source) {
        return stream(new StringReader(source)).remaining();
    }

    private TokenStream stream(Reader source) {
        return new TokenStream(new Scanner(source, options.fileName()));
    }
}
