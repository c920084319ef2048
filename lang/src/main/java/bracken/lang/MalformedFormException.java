package bracken.lang;

import lombok.Getter;

/**
 * A special form was invoked with a shape the printer cannot desugar.
 */
public class MalformedFormException extends CompileException {
    @Getter
    private final String form;

    MalformedFormException(Ast.Call call, String message) {
        super(call.name().location(), call.callee() + ": " + message);
        this.form = call.callee();
    }

    @Override
    public String stage() {
        return "printer";
    }
}
