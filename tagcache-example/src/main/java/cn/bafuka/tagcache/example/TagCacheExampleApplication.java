package cn.bafuka.tagcache.example;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * TagCache 示例应用启动类
 */
@SpringBootApplication
public class TagCacheExampleApplication {

    public static void main(String[] args) {
        SpringApplication.run(TagCacheExampleApplication.class, args);
        System.out.println("\n========================================");
        System.out.println("  TagCache Example Application Started!");
        System.out.println("  Stats: http://localhost:8080/api/diagnostic/stats");
        System.out.println("========================================\n");
    }
}
