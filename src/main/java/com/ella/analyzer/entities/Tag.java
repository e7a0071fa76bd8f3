package com.ella.analyzer.entities;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Tag {

    private String id;

    private String name;

    // ordem importa: a primeira keyword encontrada é a registrada no match
    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    private String color;

    private String icon;

    @Builder.Default
    private boolean defaultTag = false;

    private String parentTagId;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
