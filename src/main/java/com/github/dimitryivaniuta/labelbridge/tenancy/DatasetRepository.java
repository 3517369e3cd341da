package com.github.dimitryivaniuta.labelbridge.tenancy;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface DatasetRepository extends JpaRepository<Dataset, Long> {

    Optional<Dataset> findByIdAndProject_Id(Long id, Long projectId);

    @Query("""
            select count(d) from Dataset d
            where d.project.organization.id = :organizationId
            """)
    long countByOrganization(@Param("organizationId") Long organizationId);

    @Query("""
            select coalesce(sum(d.itemCount), 0) from Dataset d
            where d.project.organization.id = :organizationId
            """)
    long sumItemsByOrganization(@Param("organizationId") Long organizationId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Dataset d set d.itemCount = d.itemCount + :delta
            where d.id = :id
            """)
    int addItems(@Param("id") Long id, @Param("delta") long delta);
}
