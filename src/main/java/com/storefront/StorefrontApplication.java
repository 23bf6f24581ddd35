package com.storefront;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Storefront 애플리케이션 메인 클래스
 *
 * 활성화된 기능:
 * - @EnableRetry: 결제 트랜잭션의 락 획득 실패 재시도 (CheckoutTransactionService)
 * - @ConfigurationPropertiesScan: storefront.* 설정 바인딩 (StorefrontProperties)
 */
@EnableRetry
@ConfigurationPropertiesScan
@SpringBootApplication
public class StorefrontApplication {

    public static void main(String[] args) {
        SpringApplication.run(StorefrontApplication.class, args);
    }

}
