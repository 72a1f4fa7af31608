package com.spreadsheet.calc;

import com.spreadsheet.calc.config.SpreadsheetProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Entry point of the spreadsheet calculation service.
 */
@SpringBootApplication
@EnableConfigurationProperties(SpreadsheetProperties.class)
public class AppApplication {

    public static void main(String[] args) {
        SpringApplication.run(AppApplication.class, args);
    }
}
