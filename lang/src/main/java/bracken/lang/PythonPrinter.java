package bracken.lang;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.NonNull;

/**
 * Renders a parsed program as Python source. Calls whose name is a special
 * form are desugared; any other call becomes a plain function call.
 * <p>
 * The printer holds no state: builtins required while rendering are
 * collected in a per-call emission context and returned with the text.
 */
public final class PythonPrinter {

    public record Rendering(@NonNull String text, @NonNull Set<Builtin> builtins) {
        public Rendering {
            var copy = EnumSet.noneOf(Builtin.class);
            copy.addAll(builtins);
            builtins = Collections.unmodifiableSet(copy);
        }

        public boolean uses(Builtin builtin) {
            return builtins.contains(builtin);
        }
    }

    private static final class Emission {
        private final EnumSet<Builtin> builtins = EnumSet.noneOf(Builtin.class);

        void require(Builtin builtin) {
            builtins.add(builtin);
        }
    }

    public Rendering render(@NonNull Ast.Block block) {
        var emission = new Emission();
        var body = block.calls().stream()
            .map(call -> renderCall(call, emission))
            .collect(Collectors.joining("\n"));

        var text = new StringBuilder();
        for (var builtin : emission.builtins) {
            text.append(builtin.definition()).append('\n');
        }
        text.append(body);
        return new Rendering(text.toString(), emission.builtins);
    }

    private String render(Ast.Expr expr, Emission emission) {
        if (expr instanceof Ast.Call call) {
            return renderCall(call, emission);
        }
        if (expr instanceof Ast.Assignment assignment) {
            return renderAssignment(assignment, emission);
        }
        if (expr instanceof Ast.Variable variable) {
            return variable.identifier();
        }
        if (expr instanceof Ast.Literal literal) {
            return literal.text();
        }
        throw new IllegalArgumentException("unsupported syntax tree: " + expr);
    }

    private String renderAssignment(Ast.Assignment assignment, Emission emission) {
        return assignment.target().identifier() + " = " + render(assignment.value(), emission);
    }

    private String renderCall(Ast.Call call, Emission emission) {
        switch (call.callee()) {
        case "Print":
            emission.require(Builtin.PRINT);
            return Builtin.PRINT.functionName() + "(" + String.join(",", renderAll(call.args(), emission)) + ")";
        case "Let":
            return let(call, emission);
        case "HashMap":
            requireArity(call, 0, 1);
            return "dict()";
        case "Map": {
            requireArity(call, 2, Integer.MAX_VALUE);
            var args = renderAll(call.args(), emission);
            return "map(" + args.get(0) + ", " + String.join(", ", args.subList(1, args.size())) + ")";
        }
        case "List":
            return "[" + String.join(", ", renderAll(call.args(), emission)) + "]";
        case "Call": {
            requireArity(call, 1, Integer.MAX_VALUE);
            var args = renderAll(call.args(), emission);
            return "((" + args.get(0) + ")(" + String.join(",", args.subList(1, args.size())) + "))";
        }
        case "Assoc": {
            requireArity(call, 3, 3);
            emission.require(Builtin.ASSOC);
            var args = renderAll(call.args(), emission);
            return Builtin.ASSOC.functionName() + "(" + String.join(", ", args) + ")";
        }
        case "Has": {
            requireArity(call, 2, 2);
            emission.require(Builtin.ASSOC);
            var args = renderAll(call.args(), emission);
            return "(" + args.get(1) + ".get(" + args.get(0) + ", None) != None)";
        }
        case "Get": {
            requireArity(call, 2, 2);
            emission.require(Builtin.ASSOC);
            var args = renderAll(call.args(), emission);
            return "(" + args.get(1) + ".get(" + args.get(0) + "))";
        }
        case "Cond": {
            requireArity(call, 3, 3);
            var args = renderAll(call.args(), emission);
            return "(" + args.get(1) + " if " + args.get(0) + " else " + args.get(2) + ")";
        }
        case "Def":
            return def(call, emission);
        case "Inc":
            return renderAll(call.args(), emission).stream()
                .map(arg -> arg + "+1")
                .collect(Collectors.joining(","));
        default:
            return call.callee() + "(" + String.join(",", renderAll(call.args(), emission)) + ")";
        }
    }

    /**
     * <pre>
     * Let[x, y = 1, body]  ->  lambda x, y = 1: body
     * </pre>
     */
    private String let(Ast.Call call, Emission emission) {
        requireArity(call, 1, Integer.MAX_VALUE);
        var args = call.args();
        var params = new ArrayList<String>();
        for (var binding : args.subList(0, args.size() - 1)) {
            if (binding instanceof Ast.Variable variable) {
                params.add(variable.identifier());
            } else if (binding instanceof Ast.Assignment assignment) {
                params.add(renderAssignment(assignment, emission));
            } else {
                throw new MalformedFormException(call, "binding must be a name or an assignment, got " + binding);
            }
        }
        return lambda(params, args.get(args.size() - 1), emission);
    }

    /**
     * <pre>
     * Def[f, Args[x, y = 1], body]  ->  f = lambda x, y = 1: body
     * Def[x = value]                ->  x = value
     * </pre>
     */
    private String def(Ast.Call call, Emission emission) {
        var args = call.args();
        if (args.size() == 1 && args.get(0) instanceof Ast.Assignment assignment) {
            return renderAssignment(assignment, emission);
        }
        if (args.size() == 3
                && args.get(0) instanceof Ast.Variable name
                && args.get(1) instanceof Ast.Call params
                && "Args".equals(params.callee())) {
            return name.identifier() + " = " + lambda(parameters(params, emission), args.get(2), emission);
        }
        throw new MalformedFormException(call, "expected Def[name, Args[...], body] or Def[name = value]");
    }

    private List<String> parameters(Ast.Call params, Emission emission) {
        var rendered = new ArrayList<String>();
        for (var param : params.args()) {
            if (param instanceof Ast.Variable variable) {
                rendered.add(variable.identifier());
            } else if (param instanceof Ast.Assignment assignment) {
                rendered.add(renderAssignment(assignment, emission));
            } else if (param instanceof Ast.Call nested && "Args".equals(nested.callee())) {
                rendered.addAll(renderAll(nested.args(), emission));
            } else if (param instanceof Ast.Call map && "HashMap".equals(map.callee())) {
                // the map's contents are never seeded, only its name is used
                if (map.arity() != 1 || !(map.args().get(0) instanceof Ast.Variable variable)) {
                    throw new MalformedFormException(map, "parameter form takes exactly one name");
                }
                rendered.add(variable.identifier() + " = dict()");
            } else {
                throw new MalformedFormException(params, "unsupported parameter " + param);
            }
        }
        return rendered;
    }

    private String lambda(List<String> params, Ast.Expr body, Emission emission) {
        return "lambda " + String.join(", ", params) + ": " + render(body, emission);
    }

    private List<String> renderAll(List<Ast.Expr> exprs, Emission emission) {
        var rendered = new ArrayList<String>(exprs.size());
        for (var expr : exprs) {
            rendered.add(render(expr, emission));
        }
        return rendered;
    }

    private static void requireArity(Ast.Call call, int min, int max) {
        var arity = call.arity();
        if (arity >= min && arity <= max) {
            return;
        }
        String expected;
        if (min == max) {
            expected = "exactly " + min;
        } else if (max == Integer.MAX_VALUE) {
            expected = "at least " + min;
        } else {
            expected = min + " to " + max;
        }
        throw new MalformedFormException(call, "expected " + expected + " argument(s), got " + arity);
    }
}
