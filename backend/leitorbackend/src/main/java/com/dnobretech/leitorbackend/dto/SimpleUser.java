package com.dnobretech.leitorbackend.dto;

import com.dnobretech.leitorbackend.domain.User;

public record SimpleUser(Long id, String username) {

    public static SimpleUser from(User user) {
        return new SimpleUser(user.getId(), user.getUsername());
    }
}
