package com.dnobretech.leitorbackend.dto;

import com.dnobretech.leitorbackend.enums.WordStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record BatchUpdateWordStatusRequest(
        @NotBlank String lang,
        @NotEmpty List<String> words,
        @NotNull WordStatus status
) {}
