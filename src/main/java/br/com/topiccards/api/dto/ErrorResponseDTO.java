package br.com.topiccards.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponseDTO(
        String error,
        @JsonProperty("allowed_types") List<String> allowedTypes // Só nos erros de card_type
) {
    public ErrorResponseDTO(String error) {
        this(error, null);
    }
}
