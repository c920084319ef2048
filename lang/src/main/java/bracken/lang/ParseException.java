package bracken.lang;

import java.util.List;
import java.util.stream.Collectors;

import lombok.Getter;

/**
 * The token at the current position matches none of the grammar alternatives.
 */
@Getter
public class ParseException extends CompileException {
    private final List<Token.Type> expected;
    private final Token actual;

    ParseException(Token actual, List<Token.Type> expected, String message) {
        super(actual.location(), message + " " + describe(expected, actual));
        this.expected = List.copyOf(expected);
        this.actual = actual;
    }

    private static String describe(List<Token.Type> expected, Token actual) {
        var wanted = expected.stream()
            .map(Token.Type::description)
            .collect(Collectors.joining(" or "));
        return "(expected " + wanted + ", given " + actual.type().description() + " \"" + actual.lexeme() + "\")";
    }

    @Override
    public String stage() {
        return "parser";
    }
}
