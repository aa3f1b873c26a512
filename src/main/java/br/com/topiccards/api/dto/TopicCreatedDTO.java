package br.com.topiccards.api.dto;

import java.util.List;

// Resposta do POST /topics: o tópico e os cartões gerados junto com ele
public record TopicCreatedDTO(
        TopicDTO topic,
        List<CardDTO> cards
) {}
