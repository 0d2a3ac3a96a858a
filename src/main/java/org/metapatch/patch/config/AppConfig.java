package org.metapatch.patch.config;

import org.metapatch.render.FragmentRenderer;
import org.metapatch.shorthand.ShorthandParser;
import org.metapatch.shorthand.TypeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.UUID;
import java.util.function.Supplier;

@Configuration
public class AppConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(AppConfig.class);

    @Bean
    public TypeResolver typeResolver() {
        return new TypeResolver();
    }

    @Bean
    public ShorthandParser shorthandParser(PatchConfig config, TypeResolver typeResolver) {
        LOGGER.debug("Shorthand titles default to language '{}'", config.getDefaultLanguage());
        return new ShorthandParser(config.getDefaultLanguage(), typeResolver);
    }

    @Bean
    public Supplier<UUID> uuidSupplier() {
        return UUID::randomUUID;
    }

    @Bean
    public FragmentRenderer fragmentRenderer(PatchConfig config, Supplier<UUID> uuidSupplier) {
        return new FragmentRenderer(config.getDefaultLanguage(), uuidSupplier);
    }
}
