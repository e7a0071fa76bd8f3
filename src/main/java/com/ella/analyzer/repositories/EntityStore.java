package com.ella.analyzer.repositories;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Contrato mínimo do armazenamento local: carregar tudo, salvar tudo (upsert por id) e remover por id.
 */
public interface EntityStore<T> {

    List<T> findAll();

    Optional<T> findById(String id);

    void saveAll(Collection<T> entities);

    /**
     * Substitui a coleção inteira de uma vez; leitores veem o conjunto antigo ou o novo, nunca um meio-termo.
     */
    void replaceAll(Collection<T> entities);

    /**
     * Leitura-modificação-escrita atômica: a função recebe o conjunto atual e devolve o novo conjunto inteiro.
     * Nenhuma outra escrita acontece entre a leitura e a publicação.
     */
    List<T> update(UnaryOperator<List<T>> change);

    boolean deleteById(String id);

    int count();
}
