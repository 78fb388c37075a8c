package com.stator;

/**
 * Thrown when a {@link StateGraph} declaration is malformed. Raised while the
 * graph is built, so a bad definition fails application startup.
 */
public class GraphDefinitionException extends RuntimeException {

    public GraphDefinitionException(String message) {
        super(message);
    }
}
