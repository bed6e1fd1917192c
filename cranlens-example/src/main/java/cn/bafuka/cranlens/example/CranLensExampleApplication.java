package cn.bafuka.cranlens.example;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * CranLens 示例应用启动类
 */
@SpringBootApplication
public class CranLensExampleApplication {

    public static void main(String[] args) {
        SpringApplication.run(CranLensExampleApplication.class, args);
        System.out.println("\n========================================");
        System.out.println("  CranLens Example Application Started!");
        System.out.println("  Cache stats: http://localhost:8080/api/diagnostic/cache");
        System.out.println("========================================\n");
    }
}
