package br.com.topiccards.api.model.enums;

import br.com.topiccards.api.exception.InvalidRequestException;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Conjunto fechado de formatos de cartão aceitos pela API.
 * Todo endpoint que recebe ou filtra por card_type valida através daqui.
 */
public enum CardType {
    FLASHCARD("flashcard"), // Pergunta e resposta
    SUMMARY("summary"),
    QUIZ("quiz"),
    TASK("task"),           // Exercício prático
    USECASE("usecase"),
    MINDMAP("mindmap");

    private static final List<String> ALLOWED_VALUES = Arrays.stream(values())
            .map(CardType::value)
            .toList();

    private final String value;

    CardType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<CardType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (CardType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Lista dos valores aceitos, na ordem de declaração.
     */
    public static List<String> allowedValues() {
        return ALLOWED_VALUES;
    }

    /**
     * Devolve o tipo correspondente ou lança {@link InvalidRequestException} (400)
     * com a lista de tipos aceitos.
     *
     * @param value   valor recebido na requisição (case-sensitive)
     * @param message mensagem de erro devolvida ao cliente
     */
    public static CardType validate(String value, String message) {
        return fromValue(value)
                .orElseThrow(() -> new InvalidRequestException(message, ALLOWED_VALUES));
    }
}
