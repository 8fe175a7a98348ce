package com.dnobretech.leitorbackend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record UpdateWordDefinitionRequest(
        @NotBlank String lang,
        @NotBlank String word,
        @NotNull @Size(max = 2000) String definition    // em branco remove a definicao
) {}
