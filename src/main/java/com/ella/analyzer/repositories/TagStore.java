package com.ella.analyzer.repositories;

import com.ella.analyzer.entities.Tag;

public interface TagStore extends EntityStore<Tag> {
}
