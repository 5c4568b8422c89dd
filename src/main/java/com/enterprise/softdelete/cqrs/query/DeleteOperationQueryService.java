package com.enterprise.softdelete.cqrs.query;

import com.enterprise.softdelete.config.CascadeDeleteProperties;
import com.enterprise.softdelete.domain.entity.DeleteOperation;
import com.enterprise.softdelete.repository.DeleteOperationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Query Service - read side of the operation ledger.
 *
 * Never writes. Expired operations are invisible even before cleanup removes them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeleteOperationQueryService {

    private final DeleteOperationRepository repo;
    private final CascadeDeleteProperties properties;

    @Transactional(readOnly = true)
    public DeleteOperation getOperation(UUID containerId, UUID operationId) {
        return repo.findByIdAndContainerId(operationId, containerId)
                .filter(op -> !op.isExpired(LocalDateTime.now()))
                .orElseThrow(() -> new OperationNotFoundException("Delete operation not found: " + operationId));
    }

    /**
     * Newest first. A null limit means the default, anything else is clamped to 1..max.
     */
    @Transactional(readOnly = true)
    public List<DeleteOperation> listRecent(UUID containerId, Integer limit) {
        int effective = clampLimit(limit);
        return repo.findRecent(containerId, LocalDateTime.now(), PageRequest.of(0, effective));
    }

    int clampLimit(Integer limit) {
        if (limit == null) {
            return properties.getListLimitDefault();
        }
        return Math.max(1, Math.min(limit, properties.getListLimitMax()));
    }

    // ---------------------------------------------------------
    public static class OperationNotFoundException extends RuntimeException {
        public OperationNotFoundException(String msg) { super(msg); }
    }
}
