package br.com.topiccards.api.dto;

import br.com.topiccards.api.model.Card;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record CardDTO(
        Long id,
        @JsonProperty("topic_id") Long topicId,
        @JsonProperty("card_type") String cardType,
        String content,
        @JsonProperty("created_at") LocalDateTime createdAt
) {
    public CardDTO(Card card) {
        this(
                card.getId(),
                card.getTopic().getId(), // getId() do proxy não dispara o lazy load
                card.getCardType(),
                card.getContent(),
                card.getCreatedAt()
        );
    }
}
