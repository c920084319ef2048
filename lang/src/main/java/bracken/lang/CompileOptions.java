package bracken.lang;

import lombok.NonNull;

/**
 * Settings for a single compilation.
 *
 * @param fileName       name reported in token locations
 * @param strictBrackets when false, the brackets around an argument list are
 *                       consumed without checking them, so a missing
 *                       {@code ]} silently swallows the following token
 */
public record CompileOptions(@NonNull String fileName, boolean strictBrackets) {

    public static final String DEFAULT_FILE_NAME = "<input>";

    public static CompileOptions defaults() {
        return new CompileOptions(DEFAULT_FILE_NAME, true);
    }

    public CompileOptions withFileName(String fileName) {
        return new CompileOptions(fileName, strictBrackets);
    }

    public CompileOptions withStrictBrackets(boolean strictBrackets) {
        return new CompileOptions(fileName, strictBrackets);
    }
}
