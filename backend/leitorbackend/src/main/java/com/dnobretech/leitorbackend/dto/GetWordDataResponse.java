package com.dnobretech.leitorbackend.dto;

public record GetWordDataResponse(WordData data) {}
