package br.com.topiccards.api.controller;

import br.com.topiccards.api.dto.CardDTO;
import br.com.topiccards.api.dto.DeletedCardDTO;
import br.com.topiccards.api.dto.UpdateCardRequestDTO;
import br.com.topiccards.api.exception.InvalidRequestException;
import br.com.topiccards.api.exception.ResourceNotFoundException;
import br.com.topiccards.api.model.enums.CardType;
import br.com.topiccards.api.service.CardService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest({CardController.class, HealthController.class})
@ActiveProfiles("test")
class CardControllerWebMvcTest {

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    CardService cardService;

    @Test
    void health_returnsOk() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void listCards_invalidTypeReturnsFullAllowedSet() throws Exception {
        when(cardService.listCards("poem"))
                .thenThrow(new InvalidRequestException("Invalid card_type", CardType.allowedValues()));

        mockMvc.perform(get("/cards").param("type", "poem"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid card_type"))
                .andExpect(jsonPath("$.allowed_types[0]").value("flashcard"))
                .andExpect(jsonPath("$.allowed_types[5]").value("mindmap"));
    }

    @Test
    void listCards_withoutFilter() throws Exception {
        when(cardService.listCards(null)).thenReturn(List.of(
                new CardDTO(1L, 1L, "quiz", "a", null),
                new CardDTO(2L, 2L, "task", "b", null)));

        mockMvc.perform(get("/cards"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].topic_id").value(2));
    }

    @Test
    void updateCard_readsSnakeCaseBody() throws Exception {
        when(cardService.updateCard(eq(5L), any(UpdateCardRequestDTO.class)))
                .thenReturn(new CardDTO(5L, 1L, "summary", "new text", null));

        mockMvc.perform(put("/cards/{cardId}", 5L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"card_type\":\"summary\",\"content\":\"new text\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.card_type").value("summary"))
                .andExpect(jsonPath("$.content").value("new text"));

        ArgumentCaptor<UpdateCardRequestDTO> captor = ArgumentCaptor.forClass(UpdateCardRequestDTO.class);
        verify(cardService).updateCard(eq(5L), captor.capture());
        assertThat(captor.getValue().cardType()).isEqualTo("summary");
        assertThat(captor.getValue().content()).isEqualTo("new text");
    }

    @Test
    void updateCard_unknownCardReturns404() throws Exception {
        when(cardService.updateCard(eq(404L), any()))
                .thenThrow(new ResourceNotFoundException("Card not found"));

        mockMvc.perform(put("/cards/{cardId}", 404L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"x\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Card not found"));
    }

    @Test
    void deleteCard_returnsConfirmation() throws Exception {
        when(cardService.deleteCard(7L)).thenReturn(DeletedCardDTO.of(7L));

        mockMvc.perform(delete("/cards/{cardId}", 7L))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("deleted"))
                .andExpect(jsonPath("$.id").value(7));
    }

    @Test
    void unsupportedMethodReturns405() throws Exception {
        mockMvc.perform(patch("/cards/{cardId}", 7L))
                .andExpect(status().isMethodNotAllowed());
    }
}
