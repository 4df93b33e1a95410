package com.zzimage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 文生图凭证池中转服务 - 启动类。
 */
@SpringBootApplication(scanBasePackages = "com.zzimage")
@EnableScheduling
public class ZzImageApplication {

    public static void main(String[] args) throws Exception {
        // SQLite 不会自动创建父目录
        Files.createDirectories(Path.of("data"));
        SpringApplication.run(ZzImageApplication.class, args);
    }
}
