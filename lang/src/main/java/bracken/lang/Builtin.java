package bracken.lang;

/**
 * Python support functions some special forms rely on. Declaration order
 * is the order they are emitted in, ahead of the program body.
 */
public enum Builtin {
    PRINT("builtin__print",
        "def builtin__print(*args, **kwargs):\n"
            + "  print(*args, **kwargs)\n"
            + "  return args[0]\n"),

    ASSOC("builtin__assoc",
        "def builtin__assoc(k, v, obj):\n"
            + "  obj[k] = v\n"
            + "  return obj\n");

    private final String functionName;
    private final String definition;

    Builtin(String functionName, String definition) {
        this.functionName = functionName;
        this.definition = definition;
    }

    public String functionName() {
        return functionName;
    }

    public String definition() {
        return definition;
    }
}
