package com.batchflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 作业编排服务启动类。
 * <p>
 * 位于顶层包路径，确保能够扫描到 types、domain、infrastructure、trigger 各模块中的组件。
 * </p>
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
