package com.caura.txmapper.service;

import com.caura.txmapper.domain.ReconciliationRunEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for ReconciliationRunEntity.
 * Provides database operations for persisting and retrieving reconciliation runs.
 */
@Repository
public interface ReconciliationRunRepository extends JpaRepository<ReconciliationRunEntity, String> {

    /**
     * Finds the runs of one platform, newest first.
     *
     * @param platform source platform, e.g. {@code stripe} or {@code stripe_post_review}
     * @return runs of the platform
     */
    List<ReconciliationRunEntity> findByPlatformOrderByCreatedAtDesc(String platform);
}
