package com.baladi.common.config;

import feign.Request;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
public class FeignConfig {

    /** connect 3s, read 5s. The settlement close holds its lock while waiting on the ads service. */
    @Bean
    public Request.Options feignRequestOptions() {
        return new Request.Options(
                3, TimeUnit.SECONDS,
                5, TimeUnit.SECONDS,
                true
        );
    }
}
