package com.github.dimitryivaniuta.labelbridge.tenancy;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface OrganizationRepository extends JpaRepository<Organization, Long> {

    List<Organization> findByIdInOrderByIdAsc(Collection<Long> ids);

    List<Organization> findAllByOrderByIdAsc();
}
