package cn.bafuka.metricsieve.example;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * MetricSieve 示例应用启动类
 */
@SpringBootApplication
public class MetricSieveExampleApplication {

    public static void main(String[] args) {
        SpringApplication.run(MetricSieveExampleApplication.class, args);
        System.out.println("\n========================================");
        System.out.println("  MetricSieve Example Application Started!");
        System.out.println("  Diagnostics: http://localhost:8080/api/diagnostic/stages");
        System.out.println("========================================\n");
    }
}
