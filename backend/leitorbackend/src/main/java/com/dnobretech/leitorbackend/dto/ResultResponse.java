package com.dnobretech.leitorbackend.dto;

public record ResultResponse(boolean success) {

    public static ResultResponse ok() {
        return new ResultResponse(true);
    }
}
