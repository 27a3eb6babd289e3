package com.playmarket.ecommerce.application.product;

import com.playmarket.ecommerce.application.product.dto.HomeProductResponse;
import com.playmarket.ecommerce.application.product.dto.ProductLookupResponse;
import com.playmarket.ecommerce.application.product.dto.ProductSummaryResponse;
import com.playmarket.ecommerce.common.exception.InvalidRequestException;
import com.playmarket.ecommerce.domain.product.ModelGroup;
import com.playmarket.ecommerce.domain.product.ProductFamilyRepository;
import com.playmarket.ecommerce.domain.product.ProductRepository;
import com.playmarket.ecommerce.domain.product.ProductVariant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 카탈로그 보조 조회
 *
 * - ID 목록 조회: 요청한 상품과 같은 상품군의 다른 변형 (최대 10개)
 * - 홈 화면: 타입별 기본 상품을 모델로 묶어 모델 최저 정가와 함께
 * - 상품명 조회 / 존재 여부
 */
@Service
public class ProductCatalogService {

    private static final Logger log = LoggerFactory.getLogger(ProductCatalogService.class);

    static final int RELATED_VARIANT_LIMIT = 10;

    private final ProductRepository productRepository;
    private final ProductFamilyRepository familyRepository;

    public ProductCatalogService(ProductRepository productRepository,
                                 ProductFamilyRepository familyRepository) {
        this.productRepository = productRepository;
        this.familyRepository = familyRepository;
    }

    /**
     * 존재하지 않는 ID는 결과에서 빠진다. products는 요청 ID 순서를 따른다.
     */
    @Transactional(readOnly = true)
    public ProductLookupResponse retrieveByIds(List<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return ProductLookupResponse.builder()
                    .products(new ArrayList<>())
                    .variants(new ArrayList<>())
                    .build();
        }
        Set<Long> requested = new LinkedHashSet<>(ids);
        List<Long> order = new ArrayList<>(requested);

        List<ProductVariant> products = new ArrayList<>(productRepository.findAllByIds(requested));
        products.sort(Comparator.comparingInt(v -> order.indexOf(v.getId())));

        Set<Long> familyIds = products.stream()
                .map(v -> v.getFamily().getId())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        List<ProductVariant> variants =
                productRepository.findVariantsOfFamilies(familyIds, requested, RELATED_VARIANT_LIMIT);

        log.debug("[ProductCatalogService] ID 조회 - requested={}, found={}, variants={}",
                requested.size(), products.size(), variants.size());
        return ProductLookupResponse.builder()
                .products(toSummaries(products))
                .variants(toSummaries(variants))
                .build();
    }

    @Transactional(readOnly = true)
    public List<HomeProductResponse> listForHome(String productType) {
        if (productType == null || productType.isBlank()) {
            throw new InvalidRequestException("product_type은 필수입니다");
        }
        return ModelGroup.group(productRepository.findBasesByProductType(productType.trim())).stream()
                .map(HomeProductResponse::from)
                .collect(Collectors.toList());
    }

    /**
     * 상품군의 모든 구성원 (기본 상품 먼저). 없는 이름이면 빈 목록
     */
    @Transactional(readOnly = true)
    public List<ProductSummaryResponse> listByName(String name) {
        return familyRepository.findByName(name)
                .map(family -> toSummaries(family.membersBaseFirst()))
                .orElseGet(ArrayList::new);
    }

    @Transactional(readOnly = true)
    public boolean exists(String name) {
        return familyRepository.findByName(name).isPresent();
    }

    private static List<ProductSummaryResponse> toSummaries(List<ProductVariant> variants) {
        return variants.stream()
                .map(ProductSummaryResponse::from)
                .collect(Collectors.toList());
    }
}
