package com.afsun.tablelineage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * SQL表级血缘抽取应用主类
 *
 * @author afsun
 * @date 2025-12-01日 10:02
 */
@SpringBootApplication(scanBasePackages = "com.afsun.tablelineage")
@ConfigurationPropertiesScan
public class SqlTableLineageApplication {
    public static void main(String[] args) {
        SpringApplication.run(SqlTableLineageApplication.class, args);
    }
}
