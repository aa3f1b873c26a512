package br.com.topiccards.api.dto;

import java.util.List;

/**
 * Corpo do POST /topics.
 * Ex: {"topic": "Docker volumes", "formats": ["flashcard", "summary"]}
 */
public record CreateTopicRequestDTO(
        String topic,
        List<String> formats // Um cartão por formato, na ordem recebida
) {}
