package com.suitemender.core.source;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Picks the front end responsible for a file by its extension.
 */
@Component
public class FrontEndRegistry {

    private final List<LanguageFrontEnd> frontEnds;

    public FrontEndRegistry(List<LanguageFrontEnd> frontEnds) {
        this.frontEnds = List.copyOf(frontEnds);
    }

    public Optional<LanguageFrontEnd> forPath(String relativePath) {
        return frontEnds.stream().filter(f -> f.supports(relativePath)).findFirst();
    }

    public List<LanguageFrontEnd> all() {
        return frontEnds;
    }
}
