package com.playmarket.ecommerce;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

/**
 * PlayMarket 애플리케이션 메인 클래스
 *
 * - @EnableAspectJAutoProxy: @DistributedLock Aspect 프록시 생성
 * - 재시도(@EnableRetry), 캐시(@EnableCaching), Kafka(@EnableKafka)는 각 Config 클래스에서 활성화
 */
@EnableAspectJAutoProxy
@SpringBootApplication
public class PlayMarketApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlayMarketApplication.class, args);
    }

}
