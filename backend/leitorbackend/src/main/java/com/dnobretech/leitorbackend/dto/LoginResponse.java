package com.dnobretech.leitorbackend.dto;

public record LoginResponse(String token, String refreshToken) {}
