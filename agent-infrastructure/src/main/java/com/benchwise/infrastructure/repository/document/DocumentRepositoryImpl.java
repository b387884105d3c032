package com.benchwise.infrastructure.repository.document;

import com.benchwise.domain.document.adapter.repository.IDocumentRepository;
import com.benchwise.domain.document.model.entity.DocumentEntity;
import com.benchwise.infrastructure.dao.DocumentDao;
import com.benchwise.infrastructure.dao.po.DocumentPO;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Document repository implementation.
 *
 * @author benchwise
 * @since 2026-03-07
 */
@Repository
public class DocumentRepositoryImpl implements IDocumentRepository {

    private final DocumentDao documentDao;

    public DocumentRepositoryImpl(DocumentDao documentDao) {
        this.documentDao = documentDao;
    }

    @Override
    public List<DocumentEntity> findByIds(List<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return Collections.emptyList();
        }
        return documentDao.selectByIds(ids).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<DocumentEntity> findByMatterId(Long matterId) {
        if (matterId == null) {
            return Collections.emptyList();
        }
        return documentDao.selectByMatterId(matterId).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private DocumentEntity toEntity(DocumentPO po) {
        DocumentEntity entity = new DocumentEntity();
        entity.setId(po.getId());
        entity.setMatterId(po.getMatterId());
        entity.setFilename(po.getFilename());
        entity.setExtractedText(po.getExtractedText());
        entity.setFileType(po.getFileType());
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }
}
