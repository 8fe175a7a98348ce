package com.dnobretech.leitorbackend.controller;

import com.dnobretech.leitorbackend.auth.ClaimsUser;
import com.dnobretech.leitorbackend.dto.GetUsersResponse;
import com.dnobretech.leitorbackend.dto.SimpleUser;
import com.dnobretech.leitorbackend.dto.UpdateUserRequest;
import com.dnobretech.leitorbackend.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService service;

    @GetMapping
    public GetUsersResponse list(@RequestParam(required = false) Integer offset) {
        return service.list(offset);
    }

    // identidade do token, nao do banco
    @GetMapping("/me")
    public ClaimsUser me(ClaimsUser caller) {
        return caller;
    }

    @PatchMapping("/me")
    public SimpleUser update(@RequestBody @Valid UpdateUserRequest req, ClaimsUser caller) {
        return service.update(caller.id(), req);
    }
}
