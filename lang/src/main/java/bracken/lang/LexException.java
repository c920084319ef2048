package bracken.lang;

public class LexException extends CompileException {

    LexException(Token.Location location, String message) {
        super(location, message);
    }

    LexException(Token.Location location, String message, Throwable cause) {
        super(location, message, cause);
    }

    @Override
    public String stage() {
        return "scanner";
    }
}
