package com.riskscan.connect.repository;

import com.riskscan.connect.entity.ContentItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

@Repository
public interface ContentItemRepository extends JpaRepository<ContentItem, Long> {

    Optional<ContentItem> findByExternalItemId(String externalItemId);

    /**
     * Which of the given remote ids are already stored
     */
    @Query("SELECT c.externalItemId FROM ContentItem c WHERE c.externalItemId IN :ids")
    Set<String> findExistingExternalItemIds(@Param("ids") Collection<String> ids);
}
