package tech.noetzold.trust_engine_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableAsync
@EnableScheduling
public class TrustEngineApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrustEngineApiApplication.class, args);
    }
}
