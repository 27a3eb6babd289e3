package com.playmarket.ecommerce.domain.product;

import com.playmarket.ecommerce.common.util.PageParams;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 상품 변형 저장소 (Port)
 *
 * 상품군 공통 필드(이름, 타입, 브랜드)로 거르는 조회도 이 포트가 담당한다.
 */
public interface ProductRepository {

    /**
     * slug로 변형 조회. 상품군과 상품군의 모든 구성원을 함께 로딩한다.
     */
    Optional<ProductVariant> findBySlugWithFamily(String slug);

    boolean existsBySlug(String slug);

    /**
     * 여러 변형을 한 번에 조회 (상품군 포함). 존재하지 않는 ID는 결과에서 빠진다.
     */
    List<ProductVariant> findAllByIds(Collection<Long> variantIds);

    /**
     * 필터에 맞는 상품군별 대표 변형 한 페이지 (상품군마다 노출 순서상 첫 후보)
     *
     * 노출 순서 오름차순(미지정은 마지막), ID 오름차순으로 정렬한다.
     */
    List<ProductVariant> findRepresentatives(ProductListingQuery query, PageParams page);

    /**
     * 필터에 맞는 후보가 하나 이상 있는 상품군 수
     */
    long countFamilies(ProductListingQuery query);

    /**
     * 타입별 기본 상품 (variant = false). 노출 순서, ID 순.
     */
    List<ProductVariant> findBasesByProductType(String productType);

    /**
     * 주어진 상품군들의 변형 (variant = true) 중 excludeIds를 뺀 최대 limit개, ID 순
     */
    List<ProductVariant> findVariantsOfFamilies(Collection<Long> familyIds, Collection<Long> excludeIds, int limit);

    List<String> findDistinctProductTypes();

    List<String> findDistinctBrands(String productType);

    List<String> findDistinctConditions(String productType, String brand);

    PriceRange findEffectivePriceRange(String productType, String brand, String condition);

    /**
     * (상품 타입, 상품명, 옵션 조합)과 일치하는 변형
     */
    Optional<ProductVariant> findByTuple(String productType, String name, VariantAttributes attributes);

    ProductVariant save(ProductVariant variant);

    /**
     * 저장 후 즉시 flush. 유니크 제약 위반은 DataIntegrityViolationException으로 드러난다.
     */
    ProductVariant saveAndFlush(ProductVariant variant);

    void delete(ProductVariant variant);
}
