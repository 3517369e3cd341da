package com.github.dimitryivaniuta.labelbridge.tenancy;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface ProjectRepository extends JpaRepository<Project, Long> {

    Optional<Project> findByIdAndOrganization_Id(Long id, Long organizationId);

    long countByOrganization_Id(Long organizationId);

    @Query("""
            select count(p) from Project p
            where p.organization.id = :organizationId and p.status = :status
            """)
    long countByOrganizationAndStatus(@Param("organizationId") Long organizationId,
                                      @Param("status") TenantStatus status);
}
