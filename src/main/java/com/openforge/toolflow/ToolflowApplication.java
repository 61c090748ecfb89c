package com.openforge.toolflow;

import com.openforge.toolflow.agent.OrchestrationProperties;
import com.openforge.toolflow.tool.ToolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({ToolProperties.class, OrchestrationProperties.class})
public class ToolflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(ToolflowApplication.class, args);
    }
}
