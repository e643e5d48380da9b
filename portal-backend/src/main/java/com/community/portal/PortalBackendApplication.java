package com.community.portal;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication
public class PortalBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(PortalBackendApplication.class, args);
        log.info("Portal Backend Application 已启动");
    }

}
