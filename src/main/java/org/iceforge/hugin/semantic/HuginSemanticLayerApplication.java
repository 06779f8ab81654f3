package org.iceforge.hugin.semantic;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HuginSemanticLayerApplication {

    public static void main(String[] args) {
        SpringApplication.run(HuginSemanticLayerApplication.class, args);
    }
}
