package net.neurod3.controller.dto;

/** Selectable modality facet value. */
public record ModalityOptionDto(String key, String label, int count) {
}
