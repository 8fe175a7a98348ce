package com.dnobretech.leitorbackend.auth.web;

import com.dnobretech.leitorbackend.auth.ClaimsUser;
import com.dnobretech.leitorbackend.exception.TokenInvalidException;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/** Injeta o {@link ClaimsUser} verificado pelo interceptor como parametro do handler. */
@Component
public class ClaimsUserArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return ClaimsUser.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter,
                                  ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest,
                                  WebDataBinderFactory binderFactory) {
        Object claims = webRequest.getAttribute(TokenAuthInterceptor.CLAIMS_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
        // rota sem o interceptor: nunca entrega identidade
        if (!(claims instanceof ClaimsUser user)) throw new TokenInvalidException();
        return user;
    }
}
