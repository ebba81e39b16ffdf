package org.rpncalc.compiler.frontend.postfix;

import org.rpncalc.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a token sequence as space-separated token texts, e.g. {@code 3 a + 2 *}.
 */
public final class PostfixFormatter {

    private PostfixFormatter() {}

    public static String format(List<Token> tokens) {
        return tokens.stream()
                .map(Token::text)
                .collect(Collectors.joining(" "));
    }
}
