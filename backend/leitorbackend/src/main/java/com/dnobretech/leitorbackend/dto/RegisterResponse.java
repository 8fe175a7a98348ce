package com.dnobretech.leitorbackend.dto;

public record RegisterResponse(SimpleUser user) {}
