package com.seismicrisk.retrofit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Seismic Retrofit Advisor
 *
 * Turns probabilistic seismic hazard into per-asset average annual losses and decides
 * whether a structural retrofit pays for itself over the structure's remaining life.
 * Hazard curves are computed once per set of hazard parameters and reused across runs.
 */
@SpringBootApplication
@EnableCaching
@EnableScheduling
public class RetrofitAdvisorApplication {

    public static void main(String[] args) {
        SpringApplication.run(RetrofitAdvisorApplication.class, args);
    }
}
