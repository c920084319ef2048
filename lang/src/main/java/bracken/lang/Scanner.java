package bracken.lang;

import static bracken.lang.Token.Type.*;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Pulls tokens one at a time from a character source. Nothing is read ahead
 * of the token being scanned except a single code point of lookahead.
 */
@RequiredArgsConstructor
final class Scanner {

    private static final Logger log = LogManager.getLogger(Scanner.class);

    private static final int END = -1;
    private static final int UNREAD = -2;
    private static final int BYTE_ORDER_MARK = 0xFEFF;

    private final @NonNull Reader source;
    private final @NonNull String fileName;

    private final StringBuilder lexeme = new StringBuilder();
    private int lookahead = UNREAD;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;
    private boolean started = false;

    Scanner(String source) {
        this(new StringReader(source), CompileOptions.DEFAULT_FILE_NAME);
    }

    /**
     * Scans the next token. Once the source is exhausted every call yields an
     * {@link Token.Type#EOF} token.
     */
    Token scanToken() {
        if (!started) {
            started = true;
            if (peek() == BYTE_ORDER_MARK) {
                lookahead = UNREAD;
            }
        }

        for (;;) {
            startLine = line;
            startColumn = column;
            lexeme.setLength(0);

            if (isAtEnd()) {
                return addToken(EOF);
            }

            var c = advance();
            switch (c) {
            case '[':
                return addToken(BRACKET_LEFT);
            case ']':
                return addToken(BRACKET_RIGHT);
            case ',':
                return addToken(COMMA);
            case '=':
                return addToken(EQUAL);
            case '/':
                if (!match('/')) {
                    throw error("Unexpected character: '/'");
                }
                lineComment();
                break;

            // layout
            case '\n':
            case ' ':
            case '\t':
            case 0x0B:
            case '\f':
            case '\r':
            case 0x85:
            case 0xA0:
                break;

            default:
                if (Character.isLetter(c)) {
                    return identifier();
                }
                if (Character.isDigit(c)) {
                    return number();
                }
                throw error("Unexpected character: '" + new String(Character.toChars(c)) + "'");
            }
        }
    }

    private Token identifier() {
        while (Character.isLetterOrDigit(peek())) {
            advance();
        }
        return addToken(NAME);
    }

    private Token number() {
        while (Character.isDigit(peek())) {
            advance();
        }
        return addToken(NUMBER);
    }

    private void lineComment() {
        while (!isAtEnd()) {
            if (advance() == '\n') {
                return;
            }
        }
    }

    private boolean isAtEnd() {
        return peek() == END;
    }

    private int advance() {
        var c = peek();
        lookahead = UNREAD;
        lexeme.appendCodePoint(c);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(int expected) {
        if (peek() != expected) {
            return false;
        }
        advance();
        return true;
    }

    private int peek() {
        if (lookahead == UNREAD) {
            lookahead = read();
        }
        return lookahead;
    }

    private int read() {
        try {
            var c = source.read();
            if (c == -1) {
                return END;
            }
            if (Character.isHighSurrogate((char) c)) {
                var low = source.read();
                if (low == -1 || !Character.isLowSurrogate((char) low)) {
                    throw new LexException(here(), "Malformed surrogate pair");
                }
                return Character.toCodePoint((char) c, (char) low);
            }
            return c;
        } catch (IOException ex) {
            throw new LexException(here(), "Failed to read source: " + ex.getMessage(), ex);
        }
    }

    private Token addToken(Token.Type type) {
        var token = new Token(type, lexeme.toString(), new Token.Location(fileName, startLine, startColumn));
        log.debug("scanned {}", token);
        return token;
    }

    private Token.Location here() {
        return new Token.Location(fileName, line, column);
    }

    private LexException error(String message) {
        return new LexException(new Token.Location(fileName, startLine, startColumn), message);
    }
}
