package br.com.topiccards.api.controller;

import br.com.topiccards.api.dto.CardDTO;
import br.com.topiccards.api.dto.CreateTopicRequestDTO;
import br.com.topiccards.api.dto.TopicCreatedDTO;
import br.com.topiccards.api.dto.TopicDTO;
import br.com.topiccards.api.service.CardService;
import br.com.topiccards.api.service.TopicService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/topics")
public class TopicController {

    private final TopicService topicService;
    private final CardService cardService;

    public TopicController(TopicService topicService, CardService cardService) {
        this.topicService = topicService;
        this.cardService = cardService;
    }

    @GetMapping
    public ResponseEntity<List<TopicDTO>> listTopics() {
        return ResponseEntity.ok(topicService.listTopics());
    }

    /**
     * POST /topics
     * Corpo ausente chega como null e vira 400 no service.
     */
    @PostMapping
    public ResponseEntity<TopicCreatedDTO> createTopic(@RequestBody(required = false) CreateTopicRequestDTO dto) {
        TopicCreatedDTO created = topicService.createTopic(dto);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    // Rota única para os cartões de um tópico (com filtro opcional ?type=)
    @GetMapping("/{topicId}/cards")
    public ResponseEntity<List<CardDTO>> listTopicCards(
            @PathVariable Long topicId,
            @RequestParam(required = false) String type
    ) {
        return ResponseEntity.ok(cardService.listCardsForTopic(topicId, type));
    }
}
