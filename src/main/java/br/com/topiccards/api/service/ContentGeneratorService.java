package br.com.topiccards.api.service;

import org.springframework.stereotype.Service;

/**
 * Gerador de conteúdo provisório para os cartões.
 * Determinístico e sem estado; será trocado por uma chamada a um LLM.
 */
@Service
public class ContentGeneratorService {

    public String generate(String topicName, String cardType) {
        return switch (String.valueOf(cardType)) {
            case "flashcard" -> "Q: What is " + topicName + "?\nA: This is a simple explanation of " + topicName + ".";
            case "summary" -> "Summary for " + topicName + ": this is a short high-level summary.";
            case "quiz" -> "Quiz question about " + topicName + ": write one key concept related to it.";
            case "task" -> "Task for " + topicName + ": perform a small exercise that uses this topic in practice.";
            case "usecase" -> "Use case for " + topicName + ": describe when and why you would use " + topicName + ".";
            case "mindmap" -> "Mindmap structure for " + topicName + ": main idea -> subtopic A, subtopic B, subtopic C.";
            // Só é alcançado se alguém pular a validação de CardType
            default -> "Generic content for " + topicName + " (type: " + cardType + ").";
        };
    }
}
