package com.nevis.dataroom.repository;

import com.nevis.dataroom.model.DataRoomIndex;

import java.util.Optional;

public interface IndexRepository {

    /**
     * @return the persisted index, or empty when none has been written yet
     * @throws com.nevis.dataroom.exception.PersistenceException if the file exists but cannot be read
     */
    Optional<DataRoomIndex> load();

    /**
     * Replaces the persisted index. Readers see either the previous or the new content, never a mix.
     *
     * @throws com.nevis.dataroom.exception.PersistenceException on any write failure
     */
    void save(DataRoomIndex index);
}
