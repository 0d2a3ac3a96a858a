package org.metapatch.patch.config;

import org.metapatch.render.FragmentRenderer;
import org.metapatch.shorthand.ShorthandParser;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.TestConfiguration;

import static org.junit.jupiter.api.Assertions.*;

public class AppConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfiguration.class, AppConfig.class);

    @Test
    void contextLoads_andBeansCreated() {
        contextRunner.run(ctx -> {
            assertTrue(ctx.containsBean("typeResolver"));
            assertTrue(ctx.containsBean("shorthandParser"));
            assertTrue(ctx.containsBean("uuidSupplier"));
            assertTrue(ctx.containsBean("fragmentRenderer"));
            assertNotNull(ctx.getBean(FragmentRenderer.class));
        });
    }

    @Test
    void parserFollowsConfiguredLanguage() {
        contextRunner.withPropertyValues("patch.default-language=en").run(ctx ->
                assertEquals("en", ctx.getBean(ShorthandParser.class).defaultLanguage()));
    }

    @TestConfiguration
    @EnableConfigurationProperties(PatchConfig.class)
    static class PropertiesConfiguration {
    }
}
