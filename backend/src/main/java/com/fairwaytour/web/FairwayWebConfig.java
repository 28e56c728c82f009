package com.fairwaytour.web;

import com.fairwaytour.config.FairwayRuntimeProperties;
import com.fairwaytour.model.ScoringType;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;
import java.util.Locale;

@Configuration
public class FairwayWebConfig implements WebMvcConfigurer {

    static final String[] ADMIN_ROUTES = {
            "/api/participants/*/lock",
            "/api/participants/*/unlock",
            "/api/participants/*/dq",
            "/api/participants/*/manual-score",
            "/api/competitions/*/finalize",
            "/api/competitions/*/reopen"
    };

    private final FairwayRuntimeProperties fairwayRuntimeProperties;

    public FairwayWebConfig(FairwayRuntimeProperties fairwayRuntimeProperties) {
        this.fairwayRuntimeProperties = fairwayRuntimeProperties;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new AdminRouteGuardInterceptor(fairwayRuntimeProperties))
                .addPathPatterns(ADMIN_ROUTES);
    }

    @Override
    public void addFormatters(FormatterRegistry registry) {
        // ?scoring_type=net as well as NET
        registry.addConverter(
                String.class,
                ScoringType.class,
                value -> ScoringType.valueOf(value.trim().toUpperCase(Locale.ROOT))
        );
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new CallerContextArgumentResolver(fairwayRuntimeProperties));
    }
}
