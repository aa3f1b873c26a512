package br.com.topiccards.api.dto;

import br.com.topiccards.api.model.Topic;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

// DTO de leitura de Tópicos
public record TopicDTO(
        Long id,
        String name,
        @JsonProperty("created_at") LocalDateTime createdAt
) {
    /**
     * Construtor para converter a Entidade Topic em um TopicDTO
     */
    public TopicDTO(Topic topic) {
        this(
                topic.getId(),
                topic.getName(),
                topic.getCreatedAt()
        );
    }
}
