package br.com.topiccards.api.repository;

import br.com.topiccards.api.model.Topic;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TopicRepository extends JpaRepository<Topic, Long> {

    /**
     * Busca um tópico pelo seu nome exato (case-sensitive).
     * @param name O nome do tópico (ex: "Docker volumes").
     * @return um Optional contendo o Topic se encontrado, ou um Optional vazio caso contrário.
     */
    Optional<Topic> findByName(String name);

    boolean existsByName(String name);

    // Ordem estável para a listagem
    List<Topic> findAllByOrderByIdAsc();
}
