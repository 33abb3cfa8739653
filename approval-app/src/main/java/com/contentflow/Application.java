package com.contentflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 内容审批流程服务启动类。
 * <p>
 * Application 类位于顶层包路径，确保能够扫描到所有子模块中的组件。
 * </p>
 *
 * @author contentflow
 * @since 2026-03-02
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
