package com.dnobretech.leitorbackend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

public record NewArticleRequest(
        @NotBlank @Size(max = 255) String title,
        @Size(max = 255) String author,
        @NotNull String content,              // vazio e tratado pelo montador
        @NotBlank String language,
        List<String> tags,
        @JsonProperty("is_private") boolean isPrivate
) {}
