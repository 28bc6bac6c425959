package com.codemigration.metagraph.extraction.parser;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class ParserRegistry {

    private final List<SyntaxParser> parsers;

    public Optional<SyntaxParser> find(String language) {
        return parsers.stream().filter(p -> p.supports(language)).findFirst();
    }
}
