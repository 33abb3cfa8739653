package com.contentflow.trigger.http;

import com.contentflow.api.dto.ActivityLogDTO;
import com.contentflow.api.response.Response;
import com.contentflow.trigger.application.query.ActivityLogQueryService;
import com.contentflow.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 团队操作日志 API。
 */
@RestController
@RequestMapping("/api/activities")
public class ActivityLogController {

    private final ActivityLogQueryService activityLogQueryService;

    public ActivityLogController(ActivityLogQueryService activityLogQueryService) {
        this.activityLogQueryService = activityLogQueryService;
    }

    @GetMapping
    public Response<List<ActivityLogDTO>> listActivities(@RequestParam("organizationId") String organizationId,
                                                         @RequestParam(value = "limit", required = false) Integer limit) {
        return Response.<List<ActivityLogDTO>>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(activityLogQueryService.listActivities(organizationId, limit))
                .build();
    }
}
