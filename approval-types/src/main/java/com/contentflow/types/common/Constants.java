package com.contentflow.types.common;

/**
 * 全局常量定义类。
 * <p>
 * 定义操作日志资源类型、明细字段名以及查询默认值等通用配置。
 * </p>
 *
 * @author contentflow
 * @since 2026-03-02
 */
public class Constants {

    /** 逗号分隔符，用于字符串分割操作 */
    public final static String SPLIT = ",";

    /** 操作日志资源类型：审批流程 */
    public final static String RESOURCE_WORKFLOW = "workflow";

    /** 提交列表默认条数 */
    public final static int DEFAULT_QUERY_LIMIT = 50;

    /** 提交列表最大条数 */
    public final static int MAX_QUERY_LIMIT = 200;

    public final static String DETAIL_NAME = "name";
    public final static String DETAIL_TYPE = "type";
    public final static String DETAIL_WORKFLOW_ID = "workflowId";
    public final static String DETAIL_WORKFLOW_NAME = "workflowName";
    public final static String DETAIL_STEP = "step";
    public final static String DETAIL_COMMENT = "comment";

}
