package com.example.chatsync.tracking;

/**
 * Persistence port for one entity type. Implementations run inside the transaction opened by
 * {@link ChangeTracker#commit()}; {@link #insert} must leave the generated id on the entity.
 */
public interface EntityMapper<T> {

    Class<T> entityType();

    void insert(T entity);

    void update(T entity);

    void delete(T entity);
}
