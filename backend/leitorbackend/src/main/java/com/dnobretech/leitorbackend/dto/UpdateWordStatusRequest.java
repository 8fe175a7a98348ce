package com.dnobretech.leitorbackend.dto;

import com.dnobretech.leitorbackend.enums.WordStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record UpdateWordStatusRequest(
        @NotBlank String lang,
        @NotBlank String word,
        @NotNull WordStatus status
) {}
