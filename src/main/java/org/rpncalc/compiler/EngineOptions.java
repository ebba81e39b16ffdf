package org.rpncalc.compiler;

import com.typesafe.config.Config;
import org.rpncalc.compiler.frontend.lexer.UnknownCharacterPolicy;

/**
 * Tunables of the {@link ExpressionEngine}, read from the {@code rpncalc} block of the configuration.
 *
 * @param unknownCharacterPolicy What the lexer does with characters no rule matches.
 */
public record EngineOptions(UnknownCharacterPolicy unknownCharacterPolicy) {

    private static final String UNKNOWN_CHARACTERS_PATH = "rpncalc.lexer.unknown-characters";

    /**
     * @return Options that reject unknown characters.
     */
    public static EngineOptions defaults() {
        return new EngineOptions(UnknownCharacterPolicy.REJECT);
    }

    /**
     * Reads the options from a resolved configuration. Missing keys fall back to {@link #defaults()}.
     *
     * @param config The application configuration.
     * @return The options.
     * @throws com.typesafe.config.ConfigException.BadValue if a value is not a valid enum constant.
     */
    public static EngineOptions fromConfig(Config config) {
        UnknownCharacterPolicy policy = config.hasPath(UNKNOWN_CHARACTERS_PATH)
                ? config.getEnum(UnknownCharacterPolicy.class, UNKNOWN_CHARACTERS_PATH)
                : defaults().unknownCharacterPolicy();
        return new EngineOptions(policy);
    }

    /**
     * @param policy The policy to use instead.
     * @return A copy of these options with a different unknown-character policy.
     */
    public EngineOptions withUnknownCharacterPolicy(UnknownCharacterPolicy policy) {
        return new EngineOptions(policy);
    }
}
