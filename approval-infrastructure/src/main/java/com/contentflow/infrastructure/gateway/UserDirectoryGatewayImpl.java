package com.contentflow.infrastructure.gateway;

import com.contentflow.domain.submission.adapter.gateway.IUserDirectoryGateway;
import com.contentflow.infrastructure.dao.UserDao;
import com.contentflow.infrastructure.dao.po.UserPO;
import com.google.common.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ExecutionException;

/**
 * 基于 users 表的显示名查询，结果（含未找到）写入本地缓存。
 * <p>
 * 显示名优先取 name，为空时取 email。查询失败返回 null，不影响调用方。
 * </p>
 */
@Slf4j
@Component
public class UserDirectoryGatewayImpl implements IUserDirectoryGateway {

    private final UserDao userDao;
    private final Cache<String, Optional<String>> displayNameCache;

    public UserDirectoryGatewayImpl(UserDao userDao,
                                    @Qualifier("displayNameCache") Cache<String, Optional<String>> displayNameCache) {
        this.userDao = userDao;
        this.displayNameCache = displayNameCache;
    }

    @Override
    public String findDisplayName(String userId) {
        if (StringUtils.isBlank(userId)) {
            return null;
        }
        try {
            return displayNameCache.get(userId, () -> loadDisplayName(userId)).orElse(null);
        } catch (ExecutionException | RuntimeException ex) {
            log.warn("Failed to resolve user display name. userId={}, error={}", userId, ex.getMessage());
            return null;
        }
    }

    private Optional<String> loadDisplayName(String userId) {
        UserPO user = userDao.selectById(userId);
        if (user == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(StringUtils.firstNonBlank(user.getName(), user.getEmail()));
    }
}
