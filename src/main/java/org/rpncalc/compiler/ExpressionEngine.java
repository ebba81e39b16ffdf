package org.rpncalc.compiler;

import org.rpncalc.compiler.api.ExpressionErrorCode;
import org.rpncalc.compiler.api.ExpressionException;
import org.rpncalc.compiler.api.IExpressionEngine;
import org.rpncalc.compiler.diagnostics.DiagnosticsEngine;
import org.rpncalc.compiler.frontend.lexer.Lexer;
import org.rpncalc.compiler.frontend.lexer.Token;
import org.rpncalc.compiler.frontend.postfix.PostfixConverter;
import org.rpncalc.compiler.frontend.postfix.PostfixFormatter;
import org.rpncalc.compiler.frontend.tree.ExpressionTree;
import org.rpncalc.compiler.frontend.tree.ExpressionTreeBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The main engine implementation. This class orchestrates the pipeline phase by phase:
 * lexical analysis, postfix conversion and tree construction. Every call works on its own
 * state, so one engine can be shared between threads.
 */
public class ExpressionEngine implements IExpressionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionEngine.class);

    private final EngineOptions options;

    /**
     * Creates an engine with {@link EngineOptions#defaults()}.
     */
    public ExpressionEngine() {
        this(EngineOptions.defaults());
    }

    /**
     * Creates an engine with explicit options.
     * @param options The engine options.
     */
    public ExpressionEngine(EngineOptions options) {
        this.options = options;
    }

    /**
     * @return The options this engine was created with.
     */
    public EngineOptions getOptions() {
        return options;
    }

    @Override
    public List<Token> tokenize(String text) throws ExpressionException {
        // Phase 1: Lexical Analysis
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Lexer lexer = new Lexer(text, diagnostics, options.unknownCharacterPolicy());
        List<Token> tokens = lexer.scanTokens();
        if (diagnostics.hasErrors()) {
            throw new ExpressionException(ExpressionErrorCode.LEX_ERROR, diagnostics.summary());
        }
        LOG.debug("Tokenized '{}' into {} tokens", text, tokens.size());
        return tokens;
    }

    @Override
    public List<Token> toPostfix(List<Token> tokens) throws ExpressionException {
        // Phase 2: Infix to postfix
        List<Token> postfix = PostfixConverter.convert(tokens);
        if (LOG.isTraceEnabled()) {
            LOG.trace("Postfix: {}", PostfixFormatter.format(postfix));
        }
        return postfix;
    }

    @Override
    public ExpressionTree build(List<Token> postfix) throws ExpressionException {
        // Phase 3: Tree construction
        ExpressionTree tree = ExpressionTreeBuilder.build(postfix);
        LOG.debug("Built expression tree with {} variable leaves", tree.variableCount());
        return tree;
    }
}
