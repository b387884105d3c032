package com.benchwise.domain.document.adapter.repository;

import com.benchwise.domain.document.model.entity.DocumentEntity;

import java.util.List;

/**
 * Document source.
 *
 * @author benchwise
 * @since 2026-03-04
 */
public interface IDocumentRepository {

    /**
     * Find documents by explicit ID list
     */
    List<DocumentEntity> findByIds(List<Long> ids);

    /**
     * Find all documents of a matter
     */
    List<DocumentEntity> findByMatterId(Long matterId);
}
