package com.chatstream;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 会话流式状态服务启动类。
 * <p>
 * 位于顶层包路径，确保能够扫描到 trigger / infrastructure 模块中的组件。
 * </p>
 *
 * @author chatstream
 * @since 2026-03-02
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
