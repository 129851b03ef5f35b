package com.pumpd.backend.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Builds an {@link OrgContext} for controller methods from the headers set by the auth gateway.
 */
@Component
@Slf4j
public class OrgContextArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String ORGANISATION_HEADER = "X-Organisation-Id";
    public static final String USER_HEADER = "X-User-Id";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return OrgContext.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter,
                                  ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest,
                                  WebDataBinderFactory binderFactory) throws Exception {
        String organisationHeader = webRequest.getHeader(ORGANISATION_HEADER);
        if (organisationHeader == null || organisationHeader.isBlank()) {
            throw new MissingRequestHeaderException(ORGANISATION_HEADER, parameter);
        }

        Long organisationId;
        try {
            organisationId = Long.valueOf(organisationHeader.trim());
        } catch (NumberFormatException e) {
            log.debug("Rejected non-numeric organisation header: {}", organisationHeader);
            throw new ServletRequestBindingException("Invalid " + ORGANISATION_HEADER + " header", e);
        }

        String userId = webRequest.getHeader(USER_HEADER);
        return new OrgContext(organisationId, userId != null && !userId.isBlank() ? userId.trim() : null);
    }
}
