package bracken.lang;

import java.util.List;
import java.util.stream.Collectors;

import lombok.NonNull;

/**
 * Syntax tree produced by the {@link Parser}. Nodes are immutable and keep
 * the token they were built from for diagnostics.
 */
public sealed interface Ast {

    /**
     * Anything that may appear in an argument position.
     */
    sealed interface Expr extends Ast permits Call, Assignment, Variable, Literal {}

    /**
     * <pre>
     * program     :: call*
     * </pre>
     */
    record Block(@NonNull List<Call> calls) implements Ast {
        public Block {
            calls = List.copyOf(calls);
        }

        @Override
        public String toString() {
            return calls.stream()
                .map(Call::toString)
                .collect(Collectors.joining("\n"));
        }
    }

    /**
     * <pre>
     * call        :: NAME "[" args? "]"
     * </pre>
     */
    record Call(@NonNull Token name, @NonNull List<Expr> args) implements Expr {
        public Call {
            args = List.copyOf(args);
        }

        public String callee() {
            return name.lexeme();
        }

        public int arity() {
            return args.size();
        }

        @Override
        public String toString() {
            var sb = new StringBuilder("(Call ").append(callee());
            for (var arg : args) {
                sb.append(' ').append(arg);
            }
            return sb.append(')').toString();
        }
    }

    /**
     * <pre>
     * assignment  :: NAME "=" expression
     * </pre>
     */
    record Assignment(@NonNull Variable target, @NonNull Expr value) implements Expr {
        @Override
        public String toString() {
            return "(Assignment " + target.identifier() + " " + value + ")";
        }
    }

    record Variable(@NonNull Token name) implements Expr {
        public String identifier() {
            return name.lexeme();
        }

        @Override
        public String toString() {
            return "(Variable " + identifier() + ")";
        }
    }

    /**
     * Numeric literal, kept as source text.
     */
    record Literal(@NonNull Token value) implements Expr {
        public String text() {
            return value.lexeme();
        }

        @Override
        public String toString() {
            return "(Literal " + text() + ")";
        }
    }
}
