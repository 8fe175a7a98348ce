package com.dnobretech.leitorbackend.dto;

public record StatusResponse(String status) {}
