package bracken.lang;

import java.util.List;

/**
 * Input ended in the middle of a construct. Reaching the end between
 * top-level calls is a normal termination and never raises this.
 */
public class UnexpectedEndOfInputException extends ParseException {

    UnexpectedEndOfInputException(Token eof, List<Token.Type> expected, String message) {
        super(eof, expected, message);
    }
}
