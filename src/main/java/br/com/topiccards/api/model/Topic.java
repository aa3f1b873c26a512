package br.com.topiccards.api.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "topics")
@Getter
@Setter
public class Topic {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    public static final int NAME_MAX_LENGTH = 255;

    @Column(nullable = false, unique = true, length = NAME_MAX_LENGTH)
    private String name; // Ex: "Docker volumes"

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    // Tópicos não são apagados pela API, então não há cascade de remoção
    @OneToMany(mappedBy = "topic", fetch = FetchType.LAZY)
    private List<Card> cards = new ArrayList<>();

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now(ZoneOffset.UTC); // Sempre UTC, independente do fuso do servidor
    }
}
