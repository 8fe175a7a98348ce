package com.dnobretech.leitorbackend.dto;

import jakarta.validation.constraints.NotBlank;

public record RefreshRequest(@NotBlank String token, @NotBlank String refreshToken) {}
