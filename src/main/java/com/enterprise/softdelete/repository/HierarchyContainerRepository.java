package com.enterprise.softdelete.repository;

import com.enterprise.softdelete.domain.entity.HierarchyContainer;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface HierarchyContainerRepository extends JpaRepository<HierarchyContainer, UUID> {

    /**
     * Row lock on the container, held until the calling transaction ends
     *
     * WHO: Delete initiator
     * WHAT: SELECT ... FOR UPDATE on one container
     * WHY: Admission counts and the insert that follows must not interleave
     *      with another admission in the same container
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM HierarchyContainer c WHERE c.id = :id")
    Optional<HierarchyContainer> findByIdForUpdate(@Param("id") UUID id);
}
