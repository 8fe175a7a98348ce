package com.dnobretech.leitorbackend.auth.web;

import com.dnobretech.leitorbackend.auth.ClaimsUser;
import com.dnobretech.leitorbackend.auth.JwtTokenService;
import com.dnobretech.leitorbackend.exception.TokenInvalidException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Porta de entrada das rotas protegidas: verifica o token Bearer antes do handler
 * e deixa o {@link ClaimsUser} num atributo da requisicao.
 */
@Component
@RequiredArgsConstructor
public class TokenAuthInterceptor implements HandlerInterceptor {

    public static final String CLAIMS_ATTRIBUTE = TokenAuthInterceptor.class.getName() + ".claims";
    private static final String BEARER = "Bearer ";

    private final JwtTokenService tokens;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) return true;   // preflight CORS

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
            throw new TokenInvalidException();
        }
        ClaimsUser user = tokens.verify(header.substring(BEARER.length()).trim());
        request.setAttribute(CLAIMS_ATTRIBUTE, user);
        return true;
    }
}
