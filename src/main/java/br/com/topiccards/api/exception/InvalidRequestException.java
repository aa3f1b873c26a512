package br.com.topiccards.api.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.List;

@ResponseStatus(HttpStatus.BAD_REQUEST) // Retorna 400 Bad Request
public class InvalidRequestException extends RuntimeException {

    // Preenchido só quando o erro é de card_type
    private final List<String> allowedTypes;

    public InvalidRequestException(String message) {
        this(message, null);
    }

    public InvalidRequestException(String message, List<String> allowedTypes) {
        super(message);
        this.allowedTypes = allowedTypes;
    }

    public List<String> getAllowedTypes() {
        return allowedTypes;
    }
}
