package me.golemcore.runner;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class RunnerApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(RunnerApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(RunnerApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(RunnerApplication.class.getMethod("main", String[].class));
    }
}
