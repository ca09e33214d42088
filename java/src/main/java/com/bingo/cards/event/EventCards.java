package com.bingo.cards.event;

import com.bingo.cards.card.Card;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * The finished card set of one event as handed to a renderer.
 * Each card serializes as its 3x9 grid with 0 for empty cells.
 */
public record EventCards(
        @JsonProperty("round") String round,
        @JsonProperty("total_cards") int totalCards,
        @JsonProperty("all_unique") boolean allUnique,
        @JsonProperty("cards") List<Card> cards
) {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public EventCards {
        cards = List.copyOf(cards);
    }

    public String toJson() throws JsonProcessingException {
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(this);
    }
}
