package br.com.topiccards.api.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

@Entity
@Table(name = "cards", indexes = {
        @Index(name = "idx_card_topic", columnList = "topic_id"),
        @Index(name = "idx_card_type", columnList = "card_type")
})
@Getter
@Setter
public class Card {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "topic_id", nullable = false)
    private Topic topic;

    // Valor de CardType.value(); a validação acontece nos services, não no banco
    @Column(name = "card_type", nullable = false, length = 50)
    private String cardType;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now(ZoneOffset.UTC); // Sempre UTC, independente do fuso do servidor
    }
}
