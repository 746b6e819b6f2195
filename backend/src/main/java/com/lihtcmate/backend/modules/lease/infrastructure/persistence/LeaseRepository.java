package com.lihtcmate.backend.modules.lease.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.lihtcmate.backend.modules.lease.domain.Lease;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LeaseRepository extends JpaRepository<Lease, UUID> {

    /**
     * Leases still waiting to appear on a rent roll: created in the given snapshot, never listed on a
     * rent roll, and not marked processed. Without a snapshot (no upload yet) these are the leases
     * entered by hand; once copied forward those originals are out of scope.
     */
    default List<Lease> findFutureLeases(UUID propertyId, UUID snapshotId) {
        return snapshotId == null
                ? findFutureLeasesWithoutSnapshot(propertyId)
                : findFutureLeasesInSnapshot(propertyId, snapshotId);
    }

    @Query("""
            select l from Lease l
              join fetch l.unit u
             where u.property.id = :propertyId
               and l.snapshot.id = :snapshotId
               and l.name not like '[PROCESSED]%'
               and not exists (select t.id from Tenancy t where t.lease = l)
             order by u.unitNumber asc, l.createdAt asc
            """)
    List<Lease> findFutureLeasesInSnapshot(@Param("propertyId") UUID propertyId, @Param("snapshotId") UUID snapshotId);

    @Query("""
            select l from Lease l
              join fetch l.unit u
             where u.property.id = :propertyId
               and l.snapshot is null
               and l.name not like '[PROCESSED]%'
               and not exists (select t.id from Tenancy t where t.lease = l)
             order by u.unitNumber asc, l.createdAt asc
            """)
    List<Lease> findFutureLeasesWithoutSnapshot(@Param("propertyId") UUID propertyId);

    @Query("""
            select l from Lease l
              join fetch l.unit u
             where u.id = :unitId
             order by l.createdAt desc
            """)
    List<Lease> findByUnitIdNewestFirst(@Param("unitId") UUID unitId);

    @Query("""
            select l from Lease l
              join fetch l.unit u
             where u.id = :unitId
               and l.snapshot.id = :snapshotId
               and l.name not like '[PROCESSED]%'
             order by l.createdAt desc
            """)
    List<Lease> findActiveScopeLeasesForUnit(@Param("unitId") UUID unitId, @Param("snapshotId") UUID snapshotId);

    @Query("""
            select l from Lease l
              join fetch l.unit u
              join fetch u.property
              left join fetch l.snapshot
             where l.id = :leaseId
            """)
    Optional<Lease> findDetailedById(@Param("leaseId") UUID leaseId);
}
