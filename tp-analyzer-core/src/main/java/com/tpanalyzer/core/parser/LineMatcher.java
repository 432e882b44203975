package com.tpanalyzer.core.parser;

import com.tpanalyzer.core.model.Instruction;

/**
 * Recognizes one statement shape in the instruction segment.
 *
 * <p>{@link InstructionParser} tries its matchers in order and the first one returning a
 * payload wins. Statements no matcher accepts become {@link Instruction.Other}.
 */
@FunctionalInterface
public interface LineMatcher {

    /**
     * Tries to recognize a statement.
     *
     * @param statement statement text without pendant prefix and terminating semicolon
     * @return payload for the statement, or null if the shape does not match
     */
    Instruction.Payload match(String statement);
}
