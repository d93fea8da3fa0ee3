package org.snrasm.compiler.frontend.parser.features;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry for keyword handlers. This class holds a map of keywords
 * to their corresponding handlers.
 */
public class KeywordHandlerRegistry {
    private final Map<String, IKeywordHandler> handlers = new HashMap<>();

    /**
     * Registers a new keyword handler.
     * @param keyword The keyword (e.g., "function").
     * @param handler The handler for the keyword.
     */
    public void register(String keyword, IKeywordHandler handler) {
        handlers.put(keyword, handler);
    }

    /**
     * Gets the handler for a given keyword.
     * @param keyword The keyword.
     * @return An {@link Optional} containing the handler if it exists, otherwise empty.
     */
    public Optional<IKeywordHandler> get(String keyword) {
        return Optional.ofNullable(handlers.get(keyword));
    }

    /**
     * Initializes the registry with all the built-in handlers.
     * @return A new instance of {@link KeywordHandlerRegistry} with all handlers registered.
     */
    public static KeywordHandlerRegistry initialize() {
        KeywordHandlerRegistry registry = new KeywordHandlerRegistry();
        registry.register("def", new AliasDefHandler());
        registry.register("function", new RoutineDefHandler(false));
        registry.register("subroutine", new RoutineDefHandler(true));
        return registry;
    }
}
