package de.jwiegmann.ultraupload.config;

import de.jwiegmann.ultraupload.boundary.EnvironmentGuardInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final EnvironmentGuardInterceptor environmentGuardInterceptor;

    public WebConfig(EnvironmentGuardInterceptor environmentGuardInterceptor) {
        this.environmentGuardInterceptor = environmentGuardInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(environmentGuardInterceptor)
                .addPathPatterns("/api/errors/simulate/**", "/api/errors/simulations", "/api/errors/simulations/**");
    }
}
