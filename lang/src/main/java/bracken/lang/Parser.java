package bracken.lang;

import static bracken.lang.Token.Type.*;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
final class Parser {

    private static final Logger log = LogManager.getLogger(Parser.class);

    private final @NonNull TokenStream tokens;
    private final boolean strictBrackets;

    Parser(TokenStream tokens) {
        this(tokens, true);
    }

    public Ast.Block parse() {
        return program();
    }

    //// grammar rules ////

    /**
     * <pre>
     * program     :: call* EOF
     * </pre>
     */
    private Ast.Block program() {
        var calls = new ArrayList<Ast.Call>();
        while (!tokens.isAtEnd()) {
            var call = call();
            log.debug("parsed {}", call);
            calls.add(call);
        }
        return new Ast.Block(calls);
    }

    /**
     * <pre>
     * call        :: NAME "[" args? "]"
     * </pre>
     */
    private Ast.Call call() {
        var name = consume(NAME, "Expect call name.");
        bracket(BRACKET_LEFT, "Expect '[' after '" + name.lexeme() + "'.");
        var args = args();
        bracket(BRACKET_RIGHT, "Expect ']' after arguments of '" + name.lexeme() + "'.");
        return new Ast.Call(name, args);
    }

    /**
     * <pre>
     * args        :: expression ( "," expression )*
     * </pre>
     */
    private List<Ast.Expr> args() {
        var args = new ArrayList<Ast.Expr>();
        if (require("Expect argument or ']'.", BRACKET_RIGHT, NAME, NUMBER).type() == BRACKET_RIGHT) {
            return args;
        }

        args.add(expression());
        while (require("Expect ',' or ']'.", COMMA, BRACKET_RIGHT).type() == COMMA) {
            tokens.consume();
            args.add(expression());
        }
        return args;
    }

    /**
     * <pre>
     * expression  :: call | assignment | NAME | NUMBER
     * </pre>
     */
    private Ast.Expr expression() {
        var token = require("Expect expression.", NAME, NUMBER);

        if (token.type() == NUMBER) {
            tokens.consume();
            return new Ast.Literal(token);
        }

        if (token.type() == NAME) {
            var next = tokens.peek(2).type();
            if (next == BRACKET_LEFT) {
                return call();
            }
            if (next == EQUAL) {
                return assignment();
            }
            tokens.consume();
            return new Ast.Variable(token);
        }

        throw error(token, List.of(NAME, NUMBER), "Expect expression.");
    }

    /**
     * <pre>
     * assignment  :: NAME "=" expression
     * </pre>
     */
    private Ast.Assignment assignment() {
        var name = consume(NAME, "Expect assignment target.");
        consume(EQUAL, "Expect '=' after '" + name.lexeme() + "'.");
        var value = expression();
        return new Ast.Assignment(new Ast.Variable(name), value);
    }

    //// utility methods ////

    /**
     * Takes the bracket around an argument list. Without strict brackets the
     * next token is taken whatever it is, end of input included.
     */
    private void bracket(Token.Type type, String message) {
        if (strictBrackets) {
            consume(type, message);
        } else {
            tokens.next();
        }
    }

    private Token consume(Token.Type type, String message) {
        var token = require(message, type);
        if (token.type() == type) {
            tokens.consume();
            return token;
        }

        throw error(token, List.of(type), message);
    }

    /**
     * Peeks the next token, failing if the input ended where one of
     * {@code expected} was still required.
     */
    private Token require(String message, Token.Type... expected) {
        var token = tokens.peek(1);
        if (token.type() == EOF) {
            throw new UnexpectedEndOfInputException(token, List.of(expected), message);
        }
        return token;
    }

    private ParseException error(Token token, List<Token.Type> expected, String message) {
        return new ParseException(token, expected, message);
    }
}
