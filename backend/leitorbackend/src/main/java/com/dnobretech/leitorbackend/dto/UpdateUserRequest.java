package com.dnobretech.leitorbackend.dto;

import jakarta.validation.constraints.Size;

// todos opcionais: null = nao altera
public record UpdateUserRequest(
        @Size(min = 1, max = 64) String username,
        @Size(min = 6, max = 128) String password,
        String studyLang,
        String displayLang
) {}
