package com.gexloader;

import com.gexloader.config.TokenPresenceCheck;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GexLoaderApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(GexLoaderApplication.class);
        application.addListeners(new TokenPresenceCheck());
        System.exit(SpringApplication.exit(application.run(args)));
    }
}
