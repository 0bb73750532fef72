package com.liveprecision.precision;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Supported engine operations with their accepted names. Lookup is case-insensitive.
 */
public enum Operation {
    ADD(2, "add", "+"),
    SUBTRACT(2, "subtract", "-"),
    MULTIPLY(2, "multiply", "*"),
    DIVIDE(2, "divide", "/"),
    POWER(2, "power", "**", "^"),
    SQRT(1, "sqrt", "square_root"),
    ABS(1, "abs", "absolute"),
    NEGATE(1, "negate", "negative");

    private final int arity;
    private final List<String> aliases;

    Operation(int arity, String... aliases) {
        this.arity = arity;
        this.aliases = List.of(aliases);
    }

    public static Optional<Operation> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String key = name.strip().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(op -> op.aliases.contains(key))
                .findFirst();
    }

    public boolean isBinary() {
        return arity == 2;
    }

    public int getArity() {
        return arity;
    }

    /** Canonical name, e.g. {@code "divide"}. */
    public String getName() {
        return aliases.get(0);
    }

    public List<String> getAliases() {
        return aliases;
    }
}
