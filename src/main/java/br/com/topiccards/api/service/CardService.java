package br.com.topiccards.api.service;

import br.com.topiccards.api.dto.CardDTO;
import br.com.topiccards.api.dto.DeletedCardDTO;
import br.com.topiccards.api.dto.UpdateCardRequestDTO;
import br.com.topiccards.api.exception.ResourceNotFoundException;
import br.com.topiccards.api.model.Card;
import br.com.topiccards.api.model.enums.CardType;
import br.com.topiccards.api.repository.CardRepository;
import br.com.topiccards.api.repository.TopicRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

@Service
public class CardService {

    private static final String INVALID_CARD_TYPE = "Invalid card_type";

    private final CardRepository cardRepository;
    private final TopicRepository topicRepository;

    private static final Logger logger = LoggerFactory.getLogger(CardService.class);

    public CardService(CardRepository cardRepository, TopicRepository topicRepository) {
        this.cardRepository = cardRepository;
        this.topicRepository = topicRepository;
    }

    /**
     * Lista todos os cartões, opcionalmente filtrando por tipo.
     * Um filtro vazio (?type=) equivale a nenhum filtro.
     */
    @Transactional(readOnly = true)
    public List<CardDTO> listCards(String type) {
        List<Card> cards;
        if (hasFilter(type)) {
            CardType.validate(type, INVALID_CARD_TYPE);
            cards = cardRepository.findByCardTypeOrderByIdAsc(type);
        } else {
            cards = cardRepository.findAllByOrderByIdAsc();
        }
        logger.debug("Listagem global de cartões (type={}): {} resultados", type, cards.size());
        return toDTOs(cards);
    }

    @Transactional(readOnly = true)
    public List<CardDTO> listCardsForTopic(Long topicId, String type) {
        // Primeiro o 404, depois a validação do filtro
        if (!topicRepository.existsById(topicId)) {
            throw new ResourceNotFoundException("Topic not found");
        }

        List<Card> cards;
        if (hasFilter(type)) {
            CardType.validate(type, INVALID_CARD_TYPE);
            cards = cardRepository.findByTopicIdAndCardTypeOrderByIdAsc(topicId, type);
        } else {
            cards = cardRepository.findByTopicIdOrderByIdAsc(topicId);
        }
        logger.debug("Cartões do tópico {} (type={}): {} resultados", topicId, type, cards.size());
        return toDTOs(cards);
    }

    @Transactional
    public CardDTO updateCard(Long cardId, UpdateCardRequestDTO dto) {
        Card card = findCard(cardId);

        if (dto != null) {
            if (dto.cardType() != null) {
                CardType.validate(dto.cardType(), INVALID_CARD_TYPE);
                card.setCardType(dto.cardType());
            }
            if (dto.content() != null) {
                card.setContent(dto.content()); // Gravado como veio, sem trim
            }
        }

        Card updatedCard = cardRepository.save(card);
        logger.info("Cartão {} atualizado (type={})", cardId, updatedCard.getCardType());
        return new CardDTO(updatedCard);
    }

    @Transactional
    public DeletedCardDTO deleteCard(Long cardId) {
        Card card = findCard(cardId);
        cardRepository.delete(card);
        logger.info("Cartão {} removido", cardId);
        return DeletedCardDTO.of(cardId);
    }

    private Card findCard(Long cardId) {
        return cardRepository.findById(cardId)
                .orElseThrow(() -> new ResourceNotFoundException("Card not found"));
    }

    private boolean hasFilter(String type) {
        return type != null && !type.isEmpty();
    }

    private List<CardDTO> toDTOs(List<Card> cards) {
        return cards.stream().map(CardDTO::new).collect(Collectors.toList());
    }
}
