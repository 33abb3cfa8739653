package com.contentflow.test.support;

import com.contentflow.domain.submission.adapter.repository.IContentSubmissionRepository;
import com.contentflow.domain.submission.model.entity.ContentSubmissionEntity;
import com.contentflow.domain.submission.model.valobj.SubmissionFilter;
import com.contentflow.types.enums.ApprovalStateEnum;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 内存内容提交仓储：保存与读取均为深拷贝，按版本号更新。
 */
public class InMemoryContentSubmissionRepository implements IContentSubmissionRepository {

    private static final Comparator<ContentSubmissionEntity> NEWEST_FIRST =
            Comparator.comparing(ContentSubmissionEntity::getCreatedAt).reversed();

    private final Map<Long, ContentSubmissionEntity> store = new LinkedHashMap<>();
    private long nextId = 1;
    private int conflictCount;

    @Override
    public synchronized ContentSubmissionEntity save(ContentSubmissionEntity entity) {
        entity.validate();
        entity.setId(nextId++);
        if (entity.getVersion() == null) {
            entity.setVersion(0);
        }
        store.put(entity.getId(), entity.copy());
        return entity;
    }

    @Override
    public synchronized boolean updateWithVersion(ContentSubmissionEntity entity) {
        entity.validate();
        ContentSubmissionEntity stored = store.get(entity.getId());
        if (stored == null || !Objects.equals(stored.getVersion(), entity.getVersion())) {
            conflictCount++;
            return false;
        }
        entity.incrementVersion();
        store.put(entity.getId(), entity.copy());
        return true;
    }

    @Override
    public synchronized ContentSubmissionEntity findById(Long id) {
        ContentSubmissionEntity stored = store.get(id);
        return stored == null ? null : stored.copy();
    }

    @Override
    public synchronized List<ContentSubmissionEntity> findPendingByOrganizationId(String organizationId) {
        return store.values().stream()
                .filter(item -> Objects.equals(organizationId, item.getOrganizationId()))
                .filter(item -> item.getCurrentState() == ApprovalStateEnum.PENDING)
                .sorted(NEWEST_FIRST)
                .map(ContentSubmissionEntity::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<ContentSubmissionEntity> findByFilter(SubmissionFilter filter) {
        return store.values().stream()
                .filter(item -> Objects.equals(filter.getOrganizationId(), item.getOrganizationId()))
                .filter(item -> filter.getState() == null || filter.getState() == item.getCurrentState())
                .filter(item -> filter.getContentType() == null || filter.getContentType() == item.getContentType())
                .filter(item -> filter.getSubmittedBy() == null || filter.getSubmittedBy().equals(item.getSubmittedBy()))
                .sorted(NEWEST_FIRST)
                .limit(filter.getLimit() == null ? Long.MAX_VALUE : filter.getLimit())
                .map(ContentSubmissionEntity::copy)
                .collect(Collectors.toList());
    }

    public synchronized int getConflictCount() {
        return conflictCount;
    }
}
