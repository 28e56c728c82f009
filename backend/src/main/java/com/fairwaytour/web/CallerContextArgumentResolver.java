package com.fairwaytour.web;

import com.fairwaytour.config.FairwayRuntimeProperties;
import org.springframework.core.MethodParameter;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

import java.util.UUID;

public class CallerContextArgumentResolver implements HandlerMethodArgumentResolver {

    private final FairwayRuntimeProperties fairwayRuntimeProperties;

    public CallerContextArgumentResolver(FairwayRuntimeProperties fairwayRuntimeProperties) {
        this.fairwayRuntimeProperties = fairwayRuntimeProperties;
    }

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return CallerContext.class.equals(parameter.getParameterType());
    }

    @Override
    public CallerContext resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory
    ) {
        FairwayRuntimeProperties.Api api = fairwayRuntimeProperties.getApi();
        String rawPlayerId = webRequest.getHeader(api.getPlayerIdHeader());
        boolean admin = isAdmin(webRequest.getHeader(api.getAdminHeader()));

        if (!StringUtils.hasText(rawPlayerId)) {
            return admin ? new CallerContext(null, true) : CallerContext.ANONYMOUS;
        }
        try {
            return new CallerContext(UUID.fromString(rawPlayerId.trim()), admin);
        } catch (IllegalArgumentException ex) {
            throw new ValidationException(api.getPlayerIdHeader() + " must be a UUID");
        }
    }

    static boolean isAdmin(String headerValue) {
        return headerValue != null && "true".equalsIgnoreCase(headerValue.trim());
    }
}
