package com.dnobretech.leitorbackend.dto;

import com.dnobretech.leitorbackend.enums.WordStatus;

import java.util.Map;

public record WordData(
        Map<String, WordStatus> wordStatusData,
        Map<String, String> wordDefinitionData
) {}
