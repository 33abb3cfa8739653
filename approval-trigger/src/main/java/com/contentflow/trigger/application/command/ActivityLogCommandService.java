package com.contentflow.trigger.application.command;

import com.contentflow.domain.activity.adapter.repository.IActivityLogRepository;
import com.contentflow.domain.activity.model.entity.ActivityLogEntity;
import com.contentflow.domain.submission.adapter.gateway.IUserDirectoryGateway;
import com.contentflow.types.enums.ActivityActionEnum;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * 团队操作日志写用例。
 * <p>
 * 日志写入失败只记录告警与计数，不向调用方抛出异常。
 * </p>
 */
@Slf4j
@Service
public class ActivityLogCommandService {

    private final IActivityLogRepository activityLogRepository;
    private final IUserDirectoryGateway userDirectoryGateway;
    private final Clock clock;
    private final Counter failureCounter;

    public ActivityLogCommandService(IActivityLogRepository activityLogRepository,
                                     IUserDirectoryGateway userDirectoryGateway,
                                     Clock clock) {
        this.activityLogRepository = activityLogRepository;
        this.userDirectoryGateway = userDirectoryGateway;
        this.clock = clock;
        this.failureCounter = Counter.builder("approval.activity.log.failure.total").register(Metrics.globalRegistry);
    }

    public void logActivity(String organizationId,
                            String userId,
                            ActivityActionEnum action,
                            String resource,
                            String resourceId,
                            Map<String, Object> details) {
        try {
            ActivityLogEntity entity = new ActivityLogEntity();
            entity.setOrganizationId(organizationId);
            entity.setUserId(userId);
            entity.setUserName(userDirectoryGateway.findDisplayName(userId));
            entity.setAction(action);
            entity.setResource(resource);
            entity.setResourceId(resourceId);
            entity.setDetails(details == null ? new HashMap<>() : new HashMap<>(details));
            entity.setCreatedAt(LocalDateTime.now(clock));
            activityLogRepository.save(entity);
        } catch (Exception ex) {
            failureCounter.increment();
            log.warn("ACTIVITY_LOG_FAILED organizationId={}, userId={}, action={}, resourceId={}, error={}",
                    organizationId,
                    userId,
                    action == null ? null : action.getCode(),
                    resourceId,
                    ex.getMessage());
        }
    }
}
