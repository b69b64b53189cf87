package com.example.LusLaboris.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "Lus Laboris API",
                version = "v1",
                description = "Answers questions about the Paraguayan Labor Code (Ley 213/93) from its articles, "
                        + "and loads processed law files into the pgvector article store",
                contact = @Contact(name = "Lus Laboris maintainers")
        ),
        tags = {
                @Tag(name = OpenApiConfig.TagNames.RAG, description = "Question answering over labor-law articles"),
                @Tag(name = OpenApiConfig.TagNames.VECTORSTORE, description = "Ingestion jobs and article collections"),
                @Tag(name = OpenApiConfig.TagNames.STATUS, description = "Service and component status")
        }
)
public class OpenApiConfig {

    public static final class TagNames {
        public static final String RAG = "RAG";
        public static final String VECTORSTORE = "Vector store";
        public static final String STATUS = "Status";

        private TagNames() {
        }
    }
}
