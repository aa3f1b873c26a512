package br.com.topiccards.api.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT) // Retorna 409 Conflict
public class TopicAlreadyExistsException extends RuntimeException {

    private final String topicName;

    public TopicAlreadyExistsException(String topicName) {
        this(topicName, null);
    }

    public TopicAlreadyExistsException(String topicName, Throwable cause) {
        super("Topic already exists", cause);
        this.topicName = topicName;
    }

    public String getTopicName() {
        return topicName;
    }
}
