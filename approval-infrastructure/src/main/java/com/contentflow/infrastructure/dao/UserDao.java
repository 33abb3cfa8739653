package com.contentflow.infrastructure.dao;

import com.contentflow.infrastructure.dao.po.UserPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * 用户 DAO
 */
@Mapper
public interface UserDao {

    UserPO selectById(@Param("id") String id);
}
