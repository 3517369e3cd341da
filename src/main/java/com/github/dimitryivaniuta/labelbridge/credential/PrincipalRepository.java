package com.github.dimitryivaniuta.labelbridge.credential;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface PrincipalRepository extends JpaRepository<Principal, Long> {

    Optional<Principal> findByIdentifier(String identifier);

    boolean existsByIdentifier(String identifier);
}
