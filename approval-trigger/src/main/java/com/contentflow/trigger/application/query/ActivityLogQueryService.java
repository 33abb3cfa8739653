package com.contentflow.trigger.application.query;

import com.contentflow.api.dto.ActivityLogDTO;
import com.contentflow.domain.activity.adapter.repository.IActivityLogRepository;
import com.contentflow.trigger.application.common.ApprovalViewAssembler;
import com.contentflow.types.common.Constants;
import com.contentflow.types.enums.ResponseCode;
import com.contentflow.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 团队操作日志查询用例。
 */
@Service
public class ActivityLogQueryService {

    private final IActivityLogRepository activityLogRepository;
    private final ApprovalViewAssembler approvalViewAssembler;

    public ActivityLogQueryService(IActivityLogRepository activityLogRepository,
                                   ApprovalViewAssembler approvalViewAssembler) {
        this.activityLogRepository = activityLogRepository;
        this.approvalViewAssembler = approvalViewAssembler;
    }

    public List<ActivityLogDTO> listActivities(String organizationId, Integer limit) {
        if (StringUtils.isBlank(organizationId)) {
            throw AppException.of(ResponseCode.MISSING_REQUIRED_FIELD, "organizationId is required");
        }
        int safeLimit = limit == null || limit <= 0 ? Constants.DEFAULT_QUERY_LIMIT : Math.min(limit, Constants.MAX_QUERY_LIMIT);
        return activityLogRepository.findByOrganizationId(organizationId, safeLimit).stream()
                .map(approvalViewAssembler::toActivityLogDTO)
                .collect(Collectors.toList());
    }
}
