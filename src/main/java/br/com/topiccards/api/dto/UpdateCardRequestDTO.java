package br.com.topiccards.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

// Campos nulos ficam inalterados no PUT /cards/{id}
public record UpdateCardRequestDTO(
        @JsonProperty("card_type") String cardType,
        String content
) {}
