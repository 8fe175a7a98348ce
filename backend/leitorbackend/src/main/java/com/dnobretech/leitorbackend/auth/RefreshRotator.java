package com.dnobretech.leitorbackend.auth;

import com.dnobretech.leitorbackend.domain.User;
import com.dnobretech.leitorbackend.dto.RefreshResponse;
import com.dnobretech.leitorbackend.exception.RefreshMismatchException;
import com.dnobretech.leitorbackend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Troca (token de acesso, refresh token) por um novo token de acesso.
 * <p>
 * O token de acesso pode estar expirado, mas precisa ter assinatura valida.
 * As claims novas vem do usuario atual no banco, nao do token antigo.
 * O refresh token nao e rotacionado aqui; so um novo login o substitui.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefreshRotator {

    private final UserRepository users;
    private final JwtTokenService tokens;

    @Transactional(readOnly = true)
    public RefreshResponse refresh(String accessToken, String refreshToken) {
        TokenClaims old = tokens.decodeIgnoringExpiry(accessToken);

        User user = users.findById(old.user().id())
                .orElseThrow(RefreshMismatchException::new);
        if (!RefreshTokenGenerator.matches(user.getRefreshToken(), refreshToken)) {
            throw new RefreshMismatchException();
        }

        log.debug("[auth] refresh userId={}", user.getId());
        return new RefreshResponse(tokens.issue(ClaimsUser.from(user)));
    }
}
