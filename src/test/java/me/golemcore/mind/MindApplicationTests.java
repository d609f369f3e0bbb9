package me.golemcore.mind;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class MindApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(MindApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(MindApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(MindApplication.class.getMethod("main", String[].class));
    }
}
