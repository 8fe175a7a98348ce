package com.dnobretech.leitorbackend.dto;

public record RefreshResponse(String token) {}
