package com.ella.analyzer.repositories;

/**
 * Passo de evolução do schema local. Aplicado uma única vez, em ordem de versão, quando o store é aberto.
 */
public interface StoreMigration {

    int version();

    String description();

    void apply(StatementStore store);
}
