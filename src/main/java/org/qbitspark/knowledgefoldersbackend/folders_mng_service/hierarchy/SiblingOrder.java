package org.qbitspark.knowledgefoldersbackend.folders_mng_service.hierarchy;

import org.qbitspark.knowledgefoldersbackend.folders_mng_service.entity.FolderEntity;

import java.util.Comparator;
import java.util.function.Function;
import java.util.function.ToIntFunction;

/**
 * The one ordering of folders that share a parent: {@code position} ascending, then
 * name by code point with null names first. Every view sorts siblings in memory with
 * it, so the result never depends on the database collation.
 */
public final class SiblingOrder {

    public static final Comparator<FolderEntity> FOLDERS = of(FolderEntity::getPosition, FolderEntity::getName);

    private SiblingOrder() {
    }

    public static <T> Comparator<T> of(ToIntFunction<T> position, Function<T, String> name) {
        return Comparator.comparingInt(position)
                .thenComparing(name, Comparator.nullsFirst(Comparator.<String>naturalOrder()));
    }
}
