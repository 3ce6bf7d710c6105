package cn.bafuka.recall.example;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Recall 示例应用启动类
 * 以 HTTP 接口扮演工具调用前后的 hook
 */
@SpringBootApplication
public class RecallExampleApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecallExampleApplication.class, args);
        System.out.println("\n========================================");
        System.out.println("  Recall Example Application Started!");
        System.out.println("  Hooks: POST /api/hooks/pre-tool, /api/hooks/post-tool");
        System.out.println("========================================\n");
    }
}
