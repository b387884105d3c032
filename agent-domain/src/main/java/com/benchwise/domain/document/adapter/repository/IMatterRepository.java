package com.benchwise.domain.document.adapter.repository;

import com.benchwise.domain.document.model.entity.MatterEntity;

/**
 * Matter lookup.
 *
 * @author benchwise
 * @since 2026-03-04
 */
public interface IMatterRepository {

    /**
     * Find by ID, null when absent
     */
    MatterEntity findById(Long id);
}
