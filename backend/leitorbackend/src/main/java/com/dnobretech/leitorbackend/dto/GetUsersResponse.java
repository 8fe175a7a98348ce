package com.dnobretech.leitorbackend.dto;

import java.util.List;

public record GetUsersResponse(List<SimpleUser> users, long count) {

    public static GetUsersResponse of(List<SimpleUser> users) {
        return new GetUsersResponse(users, users.size());
    }
}
