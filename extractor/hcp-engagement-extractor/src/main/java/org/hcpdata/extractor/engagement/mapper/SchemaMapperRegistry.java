package org.hcpdata.extractor.engagement.mapper;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.hcpdata.extractor.engagement.model.SourceType;
import org.springframework.stereotype.Component;

/**
 * Looks up the mapper of a source. Every source must have exactly one mapper.
 */
@Component
public class SchemaMapperRegistry {

    private final Map<SourceType, SchemaMapper> mappers = new EnumMap<>(SourceType.class);

    public SchemaMapperRegistry(List<SchemaMapper> schemaMappers) {
        for (SchemaMapper mapper : schemaMappers) {
            SchemaMapper previous = mappers.put(mapper.sourceType(), mapper);
            if (previous != null) {
                throw new IllegalStateException("Duplicate mappers for source " + mapper.sourceType() + ": "
                    + previous.getClass().getSimpleName() + ", " + mapper.getClass().getSimpleName());
            }
        }
        List<SourceType> unmapped = Arrays.stream(SourceType.values())
            .filter(source -> !mappers.containsKey(source))
            .toList();
        if (!unmapped.isEmpty()) {
            throw new IllegalStateException("No mapper for sources " + unmapped);
        }
    }

    /**
     * Registry holding the built-in mapper of every source.
     *
     * @return a new registry
     */
    public static SchemaMapperRegistry withDefaultMappers() {
        return new SchemaMapperRegistry(List.of(
            new CallSchemaMapper(),
            new EdetailSchemaMapper(),
            new EventsSchemaMapper(),
            new ReachSchemaMapper()
        ));
    }

    public SchemaMapper forSource(SourceType source) {
        return mappers.get(source);
    }
}
