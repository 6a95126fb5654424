package com.dehazing;

import com.dehazing.patchRecurrence.AirlightConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AirlightConfig.class)
public class DehazingApplication {

    public static void main(String[] args) {
        SpringApplication.run(DehazingApplication.class, args);
    }
}
