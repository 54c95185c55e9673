package io.github.riemr.fleet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FleetPlannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FleetPlannerApplication.class, args);
    }
}
