package com.ella.analyzer.classification;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.ella.analyzer.classification.dto.TagRequestDTO;
import com.ella.analyzer.classification.rules.DefaultTagTemplates;
import com.ella.analyzer.entities.Tag;
import com.ella.analyzer.exceptions.ConflictException;
import com.ella.analyzer.exceptions.InvalidTagException;
import com.ella.analyzer.exceptions.ResourceNotFoundException;
import com.ella.analyzer.repositories.TagStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@RequiredArgsConstructor
@Slf4j
public class TagService {

    static final int MAX_NAME_LENGTH = 50;

    private final TagStore tagStore;
    private final Clock clock;

    public static List<String> validateTag(String name, List<String> keywords) {
        List<String> errors = new ArrayList<>();
        if (name == null || name.isBlank()) {
            errors.add("Tag name is required");
        } else if (name.length() > MAX_NAME_LENGTH) {
            errors.add("Tag name must be 50 characters or less");
        }
        if (keywords == null || keywords.isEmpty()) {
            errors.add("At least one keyword is required");
        } else if (keywords.stream().anyMatch(k -> k == null || k.isBlank())) {
            errors.add("Keywords cannot be empty");
        }
        return errors;
    }

    public Tag createCustomTag(String name, List<String> keywords, String color, String icon) {
        LocalDateTime now = LocalDateTime.now(clock);
        return Tag.builder()
                .id("tag-" + UUID.randomUUID())
                .name(name.trim())
                .keywords(cleanKeywords(keywords))
                .color(color == null || color.isBlank() ? pickColor(name) : color)
                .icon(icon)
                .defaultTag(false)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public Tag updateTag(Tag tag, TagRequestDTO changes) {
        Tag.TagBuilder builder = tag.toBuilder().updatedAt(LocalDateTime.now(clock));
        if (changes.name() != null) {
            builder.name(changes.name().trim());
        }
        if (changes.keywords() != null) {
            builder.keywords(cleanKeywords(changes.keywords()));
        }
        if (changes.color() != null) {
            builder.color(changes.color());
        }
        if (changes.icon() != null) {
            builder.icon(changes.icon());
        }
        if (changes.parentTagId() != null) {
            builder.parentTagId(changes.parentTagId().isBlank() ? null : changes.parentTagId());
        }
        return builder.build();
    }

    public List<Tag> defaultTags() {
        return DefaultTagTemplates.toTags(LocalDateTime.now(clock));
    }

    /**
     * Tags padrão seguidas das do usuário; descarta as padrão cujo id ou nome (sem caixa) o usuário já tem.
     */
    public List<Tag> mergeWithDefaults(List<Tag> userTags) {
        List<Tag> safeUserTags = userTags == null ? List.of() : userTags;
        Set<String> userIds = new HashSet<>();
        Set<String> userNames = new HashSet<>();
        for (Tag t : safeUserTags) {
            userIds.add(t.getId());
            if (t.getName() != null) {
                userNames.add(t.getName().toLowerCase(Locale.ROOT));
            }
        }

        List<Tag> merged = new ArrayList<>();
        for (Tag d : defaultTags()) {
            if (!userIds.contains(d.getId()) && !userNames.contains(d.getName().toLowerCase(Locale.ROOT))) {
                merged.add(d);
            }
        }
        merged.addAll(safeUserTags);
        return merged;
    }

    /**
     * Recoloca as tags padrão que foram apagadas. Tags existentes, inclusive padrão editadas, ficam como estão.
     */
    public List<Tag> restoreDefaults() {
        int before = tagStore.count();
        List<Tag> tags = tagStore.update(this::mergeWithDefaults);
        log.info("[Tags] defaults restored added={} total={}", tags.size() - before, tags.size());
        return tags;
    }

    public List<Tag> listTags() {
        return tagStore.findAll();
    }

    public Tag getTag(String id) {
        return tagStore.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Tag not found: " + id));
    }

    public Tag create(TagRequestDTO request) {
        List<String> errors = validateTag(request.name(), request.keywords());
        errors.addAll(validateParent(null, request.parentTagId()));
        if (!errors.isEmpty()) {
            throw new InvalidTagException(errors);
        }

        Tag tag = createCustomTag(request.name(), request.keywords(), request.color(), request.icon());
        if (request.parentTagId() != null && !request.parentTagId().isBlank()) {
            tag.setParentTagId(request.parentTagId());
        }
        tagStore.update(current -> withUniqueName(current, tag));
        log.info("[Tags] created id={} name='{}' keywords={}", tag.getId(), tag.getName(), tag.getKeywords().size());
        return tag;
    }

    public Tag update(String id, TagRequestDTO request) {
        Tag existing = getTag(id);
        Tag updated = updateTag(existing, request);

        List<String> errors = validateTag(updated.getName(), updated.getKeywords());
        errors.addAll(validateParent(id, updated.getParentTagId()));
        if (!errors.isEmpty()) {
            throw new InvalidTagException(errors);
        }

        tagStore.update(current -> withUniqueName(current, updated));
        log.info("[Tags] updated id={} name='{}'", id, updated.getName());
        return updated;
    }

    public void delete(String id) {
        if (!tagStore.deleteById(id)) {
            throw new ResourceNotFoundException("Tag not found: " + id);
        }
        log.info("[Tags] deleted id={}", id);
    }

    // nome único sem caixa; a tag com o mesmo id é trocada na mesma posição
    private static List<Tag> withUniqueName(List<Tag> current, Tag tag) {
        List<Tag> next = new ArrayList<>(current.size() + 1);
        boolean replaced = false;
        for (Tag t : current) {
            if (t.getId().equals(tag.getId())) {
                next.add(tag);
                replaced = true;
                continue;
            }
            if (t.getName() != null && t.getName().equalsIgnoreCase(tag.getName())) {
                throw new ConflictException("Tag name already exists: " + tag.getName());
            }
            next.add(t);
        }
        if (!replaced) {
            next.add(tag);
        }
        return next;
    }

    // hierarquia de um nível só: o pai precisa existir e não pode ter pai
    private List<String> validateParent(String tagId, String parentTagId) {
        if (parentTagId == null || parentTagId.isBlank()) {
            return List.of();
        }
        if (parentTagId.equals(tagId)) {
            return List.of("A tag cannot be its own parent");
        }
        return tagStore.findById(parentTagId)
                .map(parent -> parent.getParentTagId() == null
                        ? List.<String>of()
                        : List.of("Parent tag must be a top-level tag"))
                .orElseGet(() -> List.of("Parent tag not found: " + parentTagId));
    }

    private static List<String> cleanKeywords(List<String> keywords) {
        List<String> out = new ArrayList<>();
        for (String k : keywords) {
            if (k != null && !k.isBlank()) {
                out.add(k.trim().toLowerCase(Locale.ROOT));
            }
        }
        return out;
    }

    private static String pickColor(String name) {
        List<String> palette = DefaultTagTemplates.TAG_COLORS;
        return palette.get(Math.floorMod(name.hashCode(), palette.size()));
    }
}
