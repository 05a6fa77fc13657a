package org.pragmatica.reduce.parser;

import java.util.Objects;

/**
 * Parser configuration options.
 *
 * @param leftoverPolicy how unreduced stack elements are treated at end of input
 * @param maxInputLength largest text accepted by {@link TextParser#parse(String)}; unlimited by default
 */
public record ParserConfig(
    LeftoverPolicy leftoverPolicy,
    int maxInputLength
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        LeftoverPolicy.PERMISSIVE,
        Integer.MAX_VALUE
    );

    public ParserConfig {
        Objects.requireNonNull(leftoverPolicy, "leftoverPolicy");
        if (maxInputLength < 0) {
            throw new IllegalArgumentException("maxInputLength must not be negative, got " + maxInputLength);
        }
    }

    public ParserConfig withLeftoverPolicy(LeftoverPolicy policy) {
        return new ParserConfig(policy, maxInputLength);
    }

    public ParserConfig withMaxInputLength(int length) {
        return new ParserConfig(leftoverPolicy, length);
    }
}
