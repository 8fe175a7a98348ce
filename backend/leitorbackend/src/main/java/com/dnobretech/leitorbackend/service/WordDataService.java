package com.dnobretech.leitorbackend.service;

import com.dnobretech.leitorbackend.dto.WordData;
import com.dnobretech.leitorbackend.enums.WordStatus;

import java.util.List;

public interface WordDataService {
    WordData get(Long userId, String lang);
    void updateStatus(Long userId, String lang, String word, WordStatus status);
    void batchUpdateStatus(Long userId, String lang, List<String> words, WordStatus status);
    void updateDefinition(Long userId, String lang, String word, String definition);
}
