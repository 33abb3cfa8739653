package com.contentflow.domain.submission.adapter.gateway;

/**
 * 用户目录端口：解析用户显示名。
 */
public interface IUserDirectoryGateway {

    /**
     * 查询用户显示名。
     *
     * @param userId 用户 ID
     * @return 显示名，用户不存在或查询失败时返回 null
     */
    String findDisplayName(String userId);
}
