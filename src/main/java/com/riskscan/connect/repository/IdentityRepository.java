package com.riskscan.connect.repository;

import com.riskscan.connect.entity.Identity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface IdentityRepository extends JpaRepository<Identity, Long> {

    Optional<Identity> findByExternalId(String externalId);

    /**
     * Row-locked read used by upsert so concurrent re-authorizations apply one after the other.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM Identity i WHERE i.externalId = :externalId")
    Optional<Identity> findByExternalIdForUpdate(@Param("externalId") String externalId);

    /**
     * Latest connected identity by creation order
     */
    Optional<Identity> findFirstByOrderByIdDesc();
}
