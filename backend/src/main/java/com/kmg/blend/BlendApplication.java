package com.kmg.blend;

import com.kmg.blend.config.BlendProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(BlendProperties.class)
public class BlendApplication {
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(BlendApplication.class, args)));
    }
}
