package com.dnobretech.leitorbackend.auth;

import com.dnobretech.leitorbackend.domain.User;
import com.dnobretech.leitorbackend.dto.LoginResponse;
import com.dnobretech.leitorbackend.exception.InvalidCredentialsException;
import com.dnobretech.leitorbackend.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Login: confere a senha, emite o token de acesso e um refresh token novo.
 * O refresh token novo substitui o anterior (um unico ativo por usuario).
 */
@Slf4j
@Service
public class CredentialIssuer {

    private final UserRepository users;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService tokens;
    private final RefreshTokenGenerator refreshTokens;

    // usuario inexistente tambem paga uma verificacao de hash
    private final String dummyHash;

    public CredentialIssuer(UserRepository users,
                            PasswordEncoder passwordEncoder,
                            JwtTokenService tokens,
                            RefreshTokenGenerator refreshTokens) {
        this.users = users;
        this.passwordEncoder = passwordEncoder;
        this.tokens = tokens;
        this.refreshTokens = refreshTokens;
        this.dummyHash = passwordEncoder.encode("leitor-dummy-password");
    }

    @Transactional
    public LoginResponse login(String username, String password) {
        Optional<User> found = users.findByUsername(username);
        boolean matches = passwordEncoder.matches(
                password == null ? "" : password,
                found.map(User::getPassword).orElse(dummyHash));
        if (found.isEmpty() || !matches) {
            throw new InvalidCredentialsException();
        }

        User user = found.get();
        String access = tokens.issue(ClaimsUser.from(user));
        String refresh = refreshTokens.next();
        user.setRefreshToken(refresh);
        users.save(user);

        log.info("[auth] login ok userId={}", user.getId());
        return new LoginResponse(access, refresh);
    }
}
