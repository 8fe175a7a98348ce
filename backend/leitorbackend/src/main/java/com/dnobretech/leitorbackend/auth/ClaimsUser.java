package com.dnobretech.leitorbackend.auth;

import com.dnobretech.leitorbackend.domain.User;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Copia dos campos de identidade do usuario, tirada na emissao do token.
 * Nunca e relida do banco durante a verificacao.
 */
public record ClaimsUser(
        Long id,
        String username,
        Instant createdOn,
        String studyLang,
        String displayLang
) {

    public ClaimsUser {
        // o token carrega epoch millis
        if (createdOn != null) createdOn = createdOn.truncatedTo(ChronoUnit.MILLIS);
    }

    public static ClaimsUser from(User user) {
        return new ClaimsUser(
                user.getId(),
                user.getUsername(),
                user.getCreatedOn(),
                user.getStudyLang(),
                user.getDisplayLang()
        );
    }
}
