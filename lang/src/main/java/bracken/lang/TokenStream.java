package bracken.lang;

import static bracken.lang.Token.Type.EOF;

import java.util.ArrayList;
import java.util.List;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Lookahead buffer between the {@link Scanner} and the {@link Parser}.
 * Tokens are scanned on demand and kept until consumed, so the parser may
 * peek any distance ahead.
 */
@RequiredArgsConstructor
final class TokenStream {

    private final @NonNull Scanner scanner;
    private final List<Token> pending = new ArrayList<>();

    boolean isAtEnd() {
        return peek(1).type() == EOF;
    }

    /**
     * Returns the {@code n}-th token not yet consumed, counting from 1.
     */
    Token peek(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("lookahead must be at least 1, was " + n);
        }
        while (pending.size() < n) {
            pending.add(scanner.scanToken());
        }
        return pending.get(n - 1);
    }

    /**
     * Drops the front of the lookahead buffer. Only valid after a
     * {@link #peek(int)} has buffered at least one token.
     */
    void consume() {
        if (pending.isEmpty()) {
            throw new IllegalStateException("consume called with empty lookahead buffer");
        }
        pending.remove(0);
    }

    Token next() {
        if (!pending.isEmpty()) {
            return pending.remove(0);
        }
        return scanner.scanToken();
    }

    /**
     * Drains the stream, returning every remaining token up to and including
     * the end marker.
     */
    List<Token> remaining() {
        var tokens = new ArrayList<Token>();
        Token token;
        do {
            token = next();
            tokens.add(token);
        } while (token.type() != EOF);
        return tokens;
    }
}
