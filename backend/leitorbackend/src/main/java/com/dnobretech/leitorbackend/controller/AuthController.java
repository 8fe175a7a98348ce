package com.dnobretech.leitorbackend.controller;

import com.dnobretech.leitorbackend.auth.CredentialIssuer;
import com.dnobretech.leitorbackend.auth.RefreshRotator;
import com.dnobretech.leitorbackend.dto.*;
import com.dnobretech.leitorbackend.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final UserService userService;
    private final CredentialIssuer credentialIssuer;
    private final RefreshRotator refreshRotator;

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    public RegisterResponse register(@RequestBody @Valid RegisterRequest req) {
        return new RegisterResponse(userService.register(req));
    }

    @PostMapping("/login")
    public LoginResponse login(@RequestBody @Valid LoginRequest req) {
        return credentialIssuer.login(req.username(), req.password());
    }

    @PostMapping("/refresh")
    public RefreshResponse refresh(@RequestBody @Valid RefreshRequest req) {
        return refreshRotator.refresh(req.token(), req.refreshToken());
    }
}
