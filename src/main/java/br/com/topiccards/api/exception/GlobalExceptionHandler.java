package br.com.topiccards.api.exception;

import br.com.topiccards.api.dto.ErrorResponseDTO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@ControllerAdvice // Intercepta exceções de todos os controllers
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    // Manipula nossas exceções específicas (400, 404, 409)
    @ExceptionHandler({InvalidRequestException.class, ResourceNotFoundException.class, TopicAlreadyExistsException.class})
    public ResponseEntity<ErrorResponseDTO> handleCustomExceptions(RuntimeException ex, WebRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR; // Default
        if (ex instanceof InvalidRequestException) {
            status = HttpStatus.BAD_REQUEST;
        } else if (ex instanceof ResourceNotFoundException) {
            status = HttpStatus.NOT_FOUND;
        } else if (ex instanceof TopicAlreadyExistsException) {
            status = HttpStatus.CONFLICT;
        }

        if (ex instanceof TopicAlreadyExistsException conflict) {
            logger.warn("Erro {} tratado em {}: tópico '{}' já existe", status.value(), path(request), conflict.getTopicName());
        } else {
            logger.warn("Erro {} tratado em {}: {}", status.value(), path(request), ex.getMessage());
        }

        ErrorResponseDTO body = ex instanceof InvalidRequestException invalid
                ? new ErrorResponseDTO(ex.getMessage(), invalid.getAllowedTypes())
                : new ErrorResponseDTO(ex.getMessage());
        return new ResponseEntity<>(body, status);
    }

    // JSON malformado ou com formato errado (ex: "formats" que não é lista)
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponseDTO> handleUnreadableBody(HttpMessageNotReadableException ex, WebRequest request) {
        logger.warn("Corpo inválido em {}: {}", path(request), ex.getMostSpecificCause().getMessage());
        return new ResponseEntity<>(new ErrorResponseDTO("Malformed request body"), HttpStatus.BAD_REQUEST);
    }

    // IDs de path que não são números (ex: /cards/abc)
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponseDTO> handleTypeMismatch(MethodArgumentTypeMismatchException ex, WebRequest request) {
        logger.warn("Parâmetro inválido em {}: {}={}", path(request), ex.getName(), ex.getValue());
        return new ResponseEntity<>(
                new ErrorResponseDTO("Invalid value for '" + ex.getName() + "'"),
                HttpStatus.BAD_REQUEST);
    }

    // Erros do próprio Spring MVC: rota inexistente (404), método errado (405), content-type errado (415)
    @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<ErrorResponseDTO> handleMvcErrors(Exception ex, WebRequest request) {
        HttpStatusCode status = ((ErrorResponse) ex).getStatusCode();
        logger.warn("Erro {} em {}: {}", status.value(), path(request), ex.getMessage());
        HttpStatus resolved = HttpStatus.resolve(status.value());
        String message = resolved != null ? resolved.getReasonPhrase() : "Request failed";
        return new ResponseEntity<>(new ErrorResponseDTO(message), status);
    }

    // Falha de banco: a transação já foi revertida pelo Spring
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponseDTO> handleDataAccess(DataAccessException ex, WebRequest request) {
        logger.error("Erro de banco em {}:", path(request), ex);
        return new ResponseEntity<>(new ErrorResponseDTO("Database error"), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    // Manipula QUALQUER outra exceção não tratada (retorna 500)
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDTO> handleAllUncaughtException(Exception ex, WebRequest request) {
        logger.error("Erro inesperado em {}:", path(request), ex); // Stack trace só no log, nunca para o cliente
        return new ResponseEntity<>(new ErrorResponseDTO("Internal server error"), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private String path(WebRequest request) {
        return request.getDescription(false).replace("uri=", "");
    }
}
