package br.com.topiccards.api.controller;

import br.com.topiccards.api.dto.CardDTO;
import br.com.topiccards.api.dto.DeletedCardDTO;
import br.com.topiccards.api.dto.UpdateCardRequestDTO;
import br.com.topiccards.api.service.CardService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/cards")
public class CardController {

    private final CardService cardService;

    public CardController(CardService cardService) {
        this.cardService = cardService;
    }

    @GetMapping
    public ResponseEntity<List<CardDTO>> listCards(@RequestParam(required = false) String type) {
        return ResponseEntity.ok(cardService.listCards(type));
    }

    @PutMapping("/{cardId}")
    public ResponseEntity<CardDTO> updateCard(@PathVariable Long cardId,
                                              @RequestBody(required = false) UpdateCardRequestDTO dto) {
        return ResponseEntity.ok(cardService.updateCard(cardId, dto));
    }

    @DeleteMapping("/{cardId}")
    public ResponseEntity<DeletedCardDTO> deleteCard(@PathVariable Long cardId) {
        return ResponseEntity.ok(cardService.deleteCard(cardId));
    }
}
