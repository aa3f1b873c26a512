package br.com.topiccards.api.dto;

public record DeletedCardDTO(
        String status,
        Long id
) {
    public static DeletedCardDTO of(Long id) {
        return new DeletedCardDTO("deleted", id);
    }
}
