package org.vmapconv;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

import java.nio.file.Files;
import java.nio.file.Path;

@SpringBootApplication
public class VmapConverterApplication {
    public static void main(String[] args) {
        ensureLogDirectory();
        ConfigurableApplicationContext context = SpringApplication.run(VmapConverterApplication.class, args);
        if (hasCommand(args)) {
            System.exit(SpringApplication.exit(context));
        }
    }

    /**
     * 位置参数（非 {@code --} 选项）表示一次命令行转换，转换结束后按退出码退出进程。
     */
    static boolean hasCommand(String[] args) {
        for (String arg : args) {
            if (!arg.startsWith("--")) {
                return true;
            }
        }
        return false;
    }

    /**
     * 提前创建日志目录（避免 logback 的 RollingFileAppender 因目录不存在而初始化失败）。
     * <p>
     * 规则与 logback-spring.xml 保持一致：优先读取系统属性/环境变量 LOG_PATH，默认使用 ./logs
     */
    private static void ensureLogDirectory() {
        String logPath = System.getProperty("LOG_PATH");
        if (logPath == null || logPath.isBlank()) {
            logPath = System.getenv("LOG_PATH");
        }
        if (logPath == null || logPath.isBlank()) {
            logPath = "logs";
        }
        try {
            Files.createDirectories(Path.of(logPath));
        } catch (Exception e) {
            System.err.println("无法创建日志目录 " + logPath + "：" + e.getMessage());
        }
    }
}
