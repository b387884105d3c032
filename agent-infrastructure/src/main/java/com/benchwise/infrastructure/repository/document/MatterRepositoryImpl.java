package com.benchwise.infrastructure.repository.document;

import com.benchwise.domain.document.adapter.repository.IMatterRepository;
import com.benchwise.domain.document.model.entity.MatterEntity;
import com.benchwise.infrastructure.dao.MatterDao;
import com.benchwise.infrastructure.dao.po.MatterPO;
import com.google.common.cache.Cache;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.concurrent.ExecutionException;

/**
 * Matter repository implementation. Lookups go through a short-lived local cache.
 *
 * @author benchwise
 * @since 2026-03-07
 */
@Repository
public class MatterRepositoryImpl implements IMatterRepository {

    private final MatterDao matterDao;
    private final Cache<Long, Optional<MatterEntity>> matterCache;

    public MatterRepositoryImpl(MatterDao matterDao,
                                @Qualifier("matterCache") Cache<Long, Optional<MatterEntity>> matterCache) {
        this.matterDao = matterDao;
        this.matterCache = matterCache;
    }

    @Override
    public MatterEntity findById(Long id) {
        if (id == null) {
            return null;
        }
        try {
            return matterCache.get(id, () -> Optional.ofNullable(toEntity(matterDao.selectById(id)))).orElse(null);
        } catch (ExecutionException ex) {
            throw new IllegalStateException("Failed to load matter " + id, ex.getCause());
        }
    }

    private MatterEntity toEntity(MatterPO po) {
        if (po == null) {
            return null;
        }
        MatterEntity entity = new MatterEntity();
        entity.setId(po.getId());
        entity.setName(po.getName());
        entity.setDescription(po.getDescription());
        entity.setClientName(po.getClientName());
        entity.setMatterNumber(po.getMatterNumber());
        entity.setPracticeArea(po.getPracticeArea());
        entity.setStatus(po.getStatus());
        return entity;
    }
}
