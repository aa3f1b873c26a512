package br.com.topiccards.api.repository;

import br.com.topiccards.api.model.Card;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CardRepository extends JpaRepository<Card, Long> {

    List<Card> findAllByOrderByIdAsc();

    List<Card> findByCardTypeOrderByIdAsc(String cardType);

    List<Card> findByTopicIdOrderByIdAsc(Long topicId);

    List<Card> findByTopicIdAndCardTypeOrderByIdAsc(Long topicId, String cardType);
}
