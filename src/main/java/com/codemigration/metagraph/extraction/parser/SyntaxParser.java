package com.codemigration.metagraph.extraction.parser;

import com.codemigration.metagraph.exception.MalformedInputException;
import com.codemigration.metagraph.extraction.ParsedSkeleton;
import com.codemigration.metagraph.extraction.SourceUnit;

/**
 * Deterministic, side-effect free syntax pass for one language.
 *
 * <p>Every field a parser emits is tagged {@code SYNTAX}; fields it cannot decide are listed in
 * the entity's {@code unresolved} set instead of guessed.
 */
public interface SyntaxParser {

    boolean supports(String language);

    /**
     * @throws MalformedInputException when the file is not syntactically valid
     */
    ParsedSkeleton parse(SourceUnit unit);
}
