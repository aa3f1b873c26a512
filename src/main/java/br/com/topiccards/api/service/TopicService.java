package br.com.topiccards.api.service;

import br.com.topiccards.api.dto.CardDTO;
import br.com.topiccards.api.dto.CreateTopicRequestDTO;
import br.com.topiccards.api.dto.TopicCreatedDTO;
import br.com.topiccards.api.dto.TopicDTO;
import br.com.topiccards.api.exception.InvalidRequestException;
import br.com.topiccards.api.exception.TopicAlreadyExistsException;
import br.com.topiccards.api.model.Card;
import br.com.topiccards.api.model.Topic;
import br.com.topiccards.api.model.enums.CardType;
import br.com.topiccards.api.repository.CardRepository;
import br.com.topiccards.api.repository.TopicRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Service
public class TopicService {

    private static final String UNIQUE_VIOLATION_SQL_STATE = "23505";

    private final TopicRepository topicRepository;
    private final CardRepository cardRepository;
    private final ContentGeneratorService contentGeneratorService;

    private static final Logger logger = LoggerFactory.getLogger(TopicService.class);

    public TopicService(TopicRepository topicRepository,
                        CardRepository cardRepository,
                        ContentGeneratorService contentGeneratorService) {
        this.topicRepository = topicRepository;
        this.cardRepository = cardRepository;
        this.contentGeneratorService = contentGeneratorService;
    }

    @Transactional(readOnly = true)
    public List<TopicDTO> listTopics() {
        return topicRepository.findAllByOrderByIdAsc().stream().map(TopicDTO::new).collect(Collectors.toList());
    }

    /**
     * Cria o tópico e um cartão para cada formato pedido, tudo na mesma transação:
     * se qualquer insert falhar, nada fica gravado.
     * As validações seguem uma ordem fixa e todas acontecem antes do primeiro insert.
     */
    @Transactional
    public TopicCreatedDTO createTopic(CreateTopicRequestDTO dto) {
        if (dto == null || dto.topic() == null) {
            throw new InvalidRequestException("Missing 'topic' in request body");
        }

        String topicName = dto.topic().strip();
        if (topicName.isEmpty()) {
            throw new InvalidRequestException("Topic name cannot be empty");
        }
        if (topicName.length() > Topic.NAME_MAX_LENGTH) {
            throw new InvalidRequestException("Topic name cannot exceed " + Topic.NAME_MAX_LENGTH + " characters");
        }

        List<String> formats = dto.formats();
        if (formats == null || formats.isEmpty()) {
            throw new InvalidRequestException("Formats must be a non-empty list");
        }

        for (String format : formats) {
            CardType.validate(format, "Invalid card_type in formats: '" + format + "'");
        }

        if (topicRepository.existsByName(topicName)) {
            throw new TopicAlreadyExistsException(topicName);
        }

        Topic topic = new Topic();
        topic.setName(topicName);
        try {
            // flush imediato: a constraint UNIQUE é quem decide em caso de corrida entre duas requisições
            topic = topicRepository.saveAndFlush(topic);
        } catch (DataIntegrityViolationException e) {
            if (isUniqueViolation(e)) {
                throw new TopicAlreadyExistsException(topicName, e);
            }
            throw e;
        }

        List<Card> cards = new ArrayList<>(formats.size());
        for (String format : formats) {
            Card card = new Card();
            card.setTopic(topic);
            card.setCardType(format);
            card.setContent(contentGeneratorService.generate(topicName, format));
            cards.add(card);
        }
        List<Card> savedCards = cardRepository.saveAll(cards);

        logger.info("Tópico '{}' criado (id={}) com {} cartões", topicName, topic.getId(), savedCards.size());

        return new TopicCreatedDTO(
                new TopicDTO(topic),
                savedCards.stream().map(CardDTO::new).collect(Collectors.toList())
        );
    }

    // Só a violação de chave única (SQLState 23505) é conflito; o resto é erro de banco
    private boolean isUniqueViolation(DataIntegrityViolationException e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException sqlException
                    && UNIQUE_VIOLATION_SQL_STATE.equals(sqlException.getSQLState())) {
                return true;
            }
        }
        return false;
    }
}
