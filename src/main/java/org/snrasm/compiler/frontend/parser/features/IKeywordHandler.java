package org.snrasm.compiler.frontend.parser.features;

import org.snrasm.compiler.frontend.parser.ParsingContext;

/**
 * The base interface for all top-level keyword handlers.
 * Each handler is responsible for one keyword (e.g., {@code function}) and builds its node.
 */
public interface IKeywordHandler {

    /**
     * Parses the construct introduced by the current keyword token.
     *
     * @param context The context that provides access to the token stream and the tree builder.
     */
    void parse(ParsingContext context);
}
