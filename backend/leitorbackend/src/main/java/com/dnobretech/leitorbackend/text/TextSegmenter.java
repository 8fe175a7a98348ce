package com.dnobretech.leitorbackend.text;

import com.dnobretech.leitorbackend.exception.UnsupportedLanguageException;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Segmentador: (texto, idioma) -> tokens em ordem, sem perda.
 * Puro e sem estado mutavel; pode ser chamado de varias threads.
 */
@Component
public class TextSegmenter {

    private final Map<Language, WordBreaker> breakers = new EnumMap<>(Language.class);

    public TextSegmenter(List<WordBreaker> breakers) {
        for (WordBreaker b : breakers) {
            this.breakers.put(b.language(), b);
        }
    }

    public List<String> segment(String text, String languageCode) {
        return segment(text, Language.fromCode(languageCode));
    }

    public List<String> segment(String text, Language language) {
        Objects.requireNonNull(text, "text");
        WordBreaker breaker = breakers.get(language);
        if (breaker == null) throw new UnsupportedLanguageException(language.code());
        if (text.isEmpty()) return List.of();
        return List.copyOf(breaker.split(text));
    }
}
