package com.example.LusLaboris.config;

import com.example.LusLaboris.controller.RagAnswerController;
import com.example.LusLaboris.controller.StatusController;
import com.example.LusLaboris.controller.VectorstoreController;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class OpenApiConfigTest {

    @Test
    void definitionDescribesLaborCodeApi() {
        OpenAPIDefinition definition = OpenApiConfig.class.getAnnotation(OpenAPIDefinition.class);

        assertEquals("Lus Laboris API", definition.info().title());
        assertTrue(definition.info().description().contains("Paraguayan Labor Code"));
        assertFalse(definition.info().contact().name().isBlank());
    }

    @Test
    void everyControllerUsesADeclaredTag() {
        Set<String> declared = Arrays.stream(OpenApiConfig.class.getAnnotation(OpenAPIDefinition.class).tags())
                .map(Tag::name)
                .collect(Collectors.toSet());

        for (Class<?> controller : new Class<?>[]{
                RagAnswerController.class, VectorstoreController.class, StatusController.class}) {
            Tag tag = controller.getAnnotation(Tag.class);
            assertNotNull(tag, controller.getSimpleName());
            assertTrue(declared.contains(tag.name()), controller.getSimpleName());
        }
    }
}
