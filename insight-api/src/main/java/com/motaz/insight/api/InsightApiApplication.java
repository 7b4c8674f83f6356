package com.motaz.insight.api;

import com.motaz.insight.engine.EngineConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;


@SpringBootApplication
@Import(EngineConfig.class)
public class InsightApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(InsightApiApplication.class, args);
    }

}
