package com.pickshot.repository;

import com.pickshot.entity.RatingEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;

@Repository
public interface RatingRepository extends JpaRepository<RatingEntity, String> {

    /**
     * Inserts or fully replaces the row for {@code id} in a single statement.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "MERGE INTO ratings (id, rating, updated_at, source_modified_at) KEY (id) "
            + "VALUES (:id, :rating, :updatedAt, :sourceModifiedAt)", nativeQuery = true)
    int upsertVerified(@Param("id") String id,
            @Param("rating") int rating,
            @Param("updatedAt") long updatedAt,
            @Param("sourceModifiedAt") long sourceModifiedAt);

    /**
     * Same as {@link #upsertVerified} but leaves the source modification time
     * unknown.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "MERGE INTO ratings (id, rating, updated_at, source_modified_at) KEY (id) "
            + "VALUES (:id, :rating, :updatedAt, NULL)", nativeQuery = true)
    int upsertUnverified(@Param("id") String id,
            @Param("rating") int rating,
            @Param("updatedAt") long updatedAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "UPDATE ratings SET id = :newId WHERE id = :oldId", nativeQuery = true)
    int renameId(@Param("oldId") String oldId, @Param("newId") String newId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM RatingEntity r WHERE r.id IN :ids")
    int deleteByIdIn(@Param("ids") Collection<String> ids);
}
