package bracken.lang;

import lombok.NonNull;

public record Token(
    @NonNull Type type,
    @NonNull String lexeme,
    @NonNull Location location) {

    @Override
    public String toString() {
        return "(Token " + type + " \"" + lexeme + "\" " + location.line() + ":" + location.column() + ")";
    }

    public enum Type {
        BRACKET_LEFT("'['"),
        BRACKET_RIGHT("']'"),
        COMMA("','"),
        EQUAL("'='"),

        // literals
        NAME("name"),
        NUMBER("number"),

        // end-of-file
        EOF("end of input");

        private final String description;

        Type(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    public record Location(@NonNull String file, int line, int column) {

        @Override
        public String toString() {
            return file + ":" + line + ":" + column;
        }
    }
}
