package com.github.dimitryivaniuta.labelbridge.credential;

import com.github.dimitryivaniuta.labelbridge.authz.Role;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface RoleBindingRepository extends JpaRepository<RoleBinding, Long> {

    List<RoleBinding> findByPrincipalId(Long principalId);

    Optional<RoleBinding> findByPrincipalIdAndOrganizationIdAndProjectIdIsNull(Long principalId, Long organizationId);

    Optional<RoleBinding> findByPrincipalIdAndOrganizationIdAndProjectId(Long principalId, Long organizationId, Long projectId);

    long countByOrganizationIdAndProjectIdIsNullAndRole(Long organizationId, Role role);

    boolean existsByPrincipalIdAndOrganizationId(Long principalId, Long organizationId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            delete from RoleBinding b
            where b.principalId = :principalId and b.organizationId = :organizationId
            """)
    int deleteByPrincipalAndOrganization(@Param("principalId") Long principalId,
                                         @Param("organizationId") Long organizationId);

    @Query("""
            select count(distinct b.principalId)
            from RoleBinding b
            where b.organizationId = :organizationId
            """)
    long countMembers(@Param("organizationId") Long organizationId);
}
