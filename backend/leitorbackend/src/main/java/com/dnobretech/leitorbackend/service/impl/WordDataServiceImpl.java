// src/main/java/com/dnobretech/leitorbackend/service/impl/WordDataServiceImpl.java
package com.dnobretech.leitorbackend.service.impl;

import com.dnobretech.leitorbackend.domain.UserWordData;
import com.dnobretech.leitorbackend.domain.UserWordDataId;
import com.dnobretech.leitorbackend.dto.WordData;
import com.dnobretech.leitorbackend.enums.WordStatus;
import com.dnobretech.leitorbackend.repository.UserWordDataRepository;
import com.dnobretech.leitorbackend.service.WordDataService;
import com.dnobretech.leitorbackend.text.Language;
import com.dnobretech.leitorbackend.text.WordForms;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Vocabulario por (usuario, idioma). Palavras sao normalizadas com a mesma regra das
 * palavras unicas do artigo. Escritas concorrentes: vence a ultima.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WordDataServiceImpl implements WordDataService {

    private final UserWordDataRepository repo;

    @Override
    @Transactional(readOnly = true)
    public WordData get(Long userId, String lang) {
        String code = Language.fromCode(lang).code();
        return repo.findById(new UserWordDataId(userId, code))
                .map(d -> new WordData(Map.copyOf(d.getWordStatusData()), Map.copyOf(d.getWordDefinitionData())))
                .orElseGet(() -> new WordData(Map.of(), Map.of()));
    }

    @Override
    @Transactional
    public void updateStatus(Long userId, String lang, String word, WordStatus status) {
        batchUpdateStatus(userId, lang, List.of(word), status);
    }

    /** Tudo ou nada: qualquer palavra invalida aborta o lote antes de escrever. */
    @Override
    @Transactional
    public void batchUpdateStatus(Long userId, String lang, List<String> words, WordStatus status) {
        String code = Language.fromCode(lang).code();
        if (status == null) throw new IllegalArgumentException("status obrigatorio");
        List<String> keys = new ArrayList<>(words.size());
        for (String w : words) keys.add(key(w));

        UserWordData data = loadOrCreate(userId, code);
        Map<String, WordStatus> statuses = new HashMap<>(data.getWordStatusData());
        for (String k : keys) statuses.put(k, status);
        data.setWordStatusData(statuses);
        repo.save(data);

        log.debug("[words] userId={} lang={} {} palavra(s) -> {}", userId, code, keys.size(), status.getValue());
    }

    @Override
    @Transactional
    public void updateDefinition(Long userId, String lang, String word, String definition) {
        String code = Language.fromCode(lang).code();
        String k = key(word);

        UserWordData data = loadOrCreate(userId, code);
        Map<String, String> defs = new HashMap<>(data.getWordDefinitionData());
        if (definition == null || definition.isBlank()) defs.remove(k);
        else defs.put(k, definition.trim());
        data.setWordDefinitionData(defs);
        repo.save(data);
    }

    // -------- helpers ----------
    private UserWordData loadOrCreate(Long userId, String lang) {
        return repo.findById(new UserWordDataId(userId, lang))
                .orElseGet(() -> UserWordData.builder().userId(userId).lang(lang).build());
    }

    private static String key(String word) {
        if (word == null || word.isBlank()) throw new IllegalArgumentException("palavra vazia");
        return WordForms.fold(word.trim());
    }
}
