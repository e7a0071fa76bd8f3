package com.ella.analyzer.classification.dto;

import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

public record TagRequestDTO(
        @NotBlank @Size(max = 50) String name,
        @NotEmpty List<String> keywords,
        String color,
        String icon,
        String parentTagId
) {
}
