package com.example.chatsync.tracking;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class MapperRegistry {

    private final Map<Class<?>, EntityMapper<?>> mappers = new HashMap<>();

    public MapperRegistry(List<EntityMapper<?>> mappers) {
        for (EntityMapper<?> mapper : mappers) {
            EntityMapper<?> previous = this.mappers.put(mapper.entityType(), mapper);
            if (previous != null) {
                throw new IllegalStateException("Duplicate mapper for " + mapper.entityType().getName());
            }
        }
    }

    @SuppressWarnings("unchecked")
    public <T> EntityMapper<T> mapperFor(T entity) {
        EntityMapper<?> mapper = mappers.get(entity.getClass());
        if (mapper == null) {
            throw new IllegalStateException("No mapper registered for " + entity.getClass().getName());
        }
        return (EntityMapper<T>) mapper;
    }
}
