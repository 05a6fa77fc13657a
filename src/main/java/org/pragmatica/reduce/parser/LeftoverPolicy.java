package org.pragmatica.reduce.parser;

/**
 * What to do when input runs out while more than one element is left on the working stack.
 */
public enum LeftoverPolicy {
    /**
     * Return the top element as the result and report the rest as unreduced, with a warning.
     */
    PERMISSIVE,

    /**
     * Fail the parse unless the whole input reduced to a single tree.
     */
    STRICT
}
