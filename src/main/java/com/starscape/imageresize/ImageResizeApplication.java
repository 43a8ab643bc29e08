package com.starscape.imageresize;

import com.starscape.imageresize.common.config.ProcessingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ProcessingProperties.class)
public class ImageResizeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ImageResizeApplication.class, args);
    }
}
