package com.dnobretech.leitorbackend.service;

import com.dnobretech.leitorbackend.dto.GetUsersResponse;
import com.dnobretech.leitorbackend.dto.RegisterRequest;
import com.dnobretech.leitorbackend.dto.SimpleUser;
import com.dnobretech.leitorbackend.dto.UpdateUserRequest;

public interface UserService {
    SimpleUser register(RegisterRequest req);
    GetUsersResponse list(Integer offset);
    SimpleUser update(Long id, UpdateUserRequest req);
}
