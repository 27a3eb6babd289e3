package com.playmarket.ecommerce.infrastructure.config;

import com.playmarket.ecommerce.domain.product.VariantPriceCalculator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 도메인 서비스 Bean 등록
 *
 * 도메인 계층 클래스는 Spring 어노테이션 없이 작성하고 여기서 Bean으로 등록한다.
 */
@Configuration
public class DomainServiceConfig {

    @Bean
    public VariantPriceCalculator variantPriceCalculator() {
        return new VariantPriceCalculator();
    }
}
