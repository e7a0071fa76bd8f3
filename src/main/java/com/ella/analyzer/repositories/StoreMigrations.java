package com.ella.analyzer.repositories;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

import com.ella.analyzer.classification.rules.DefaultTagTemplates;

public final class StoreMigrations {

    private StoreMigrations() {
    }

    public static List<StoreMigration> defaults(Clock clock) {
        return List.of(createCollections(), seedDefaultTags(clock));
    }

    static StoreMigration createCollections() {
        return new StoreMigration() {
            @Override
            public int version() {
                return 1;
            }

            @Override
            public String description() {
                return "create transaction, tag and budget collections";
            }

            @Override
            public void apply(StatementStore store) {
                store.createCollections();
            }
        };
    }

    static StoreMigration seedDefaultTags(Clock clock) {
        return new StoreMigration() {
            @Override
            public int version() {
                return 2;
            }

            @Override
            public String description() {
                return "seed default tags";
            }

            @Override
            public void apply(StatementStore store) {
                if (store.tags().count() == 0) {
                    store.tags().saveAll(DefaultTagTemplates.toTags(LocalDateTime.now(clock)));
                }
            }
        };
    }
}
