package com.playmarket.ecommerce.infrastructure.persistence.product;

import com.playmarket.ecommerce.common.util.PageParams;
import com.playmarket.ecommerce.domain.product.PriceRange;
import com.playmarket.ecommerce.domain.product.ProductListingQuery;
import com.playmarket.ecommerce.domain.product.ProductRepository;
import com.playmarket.ecommerce.domain.product.ProductVariant;
import com.playmarket.ecommerce.domain.product.VariantAttributes;
import org.springframework.context.annotation.Primary;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * MySQL 기반 상품 변형 Repository 구현
 */
@Repository
@Primary
public class MySQLProductRepository implements ProductRepository {

    private final ProductVariantJpaRepository variantJpaRepository;
    private final ProductFamilyJpaRepository familyJpaRepository;

    public MySQLProductRepository(ProductVariantJpaRepository variantJpaRepository,
                                  ProductFamilyJpaRepository familyJpaRepository) {
        this.variantJpaRepository = variantJpaRepository;
        this.familyJpaRepository = familyJpaRepository;
    }

    @Override
    public Optional<ProductVariant> findBySlugWithFamily(String slug) {
        Optional<ProductVariant> variant = variantJpaRepository.findBySlugWithFamily(slug);
        // 같은 영속성 컨텍스트에서 family.variants 컬렉션을 fetch join으로 초기화
        variant.ifPresent(v -> familyJpaRepository.findWithVariantsById(v.getFamily().getId()));
        return variant;
    }

    @Override
    public boolean existsBySlug(String slug) {
        return variantJpaRepository.existsBySlug(slug);
    }

    @Override
    public List<ProductVariant> findAllByIds(Collection<Long> variantIds) {
        if (variantIds.isEmpty()) {
            return List.of();
        }
        return variantJpaRepository.findAllWithFamilyByIdIn(variantIds);
    }

    @Override
    public List<ProductVariant> findRepresentatives(ProductListingQuery query, PageParams page) {
        List<Long> ids = variantJpaRepository.findRepresentativeIds(
                query.isVariantListing(),
                query.getProductRef(),
                query.getProductType(),
                query.getBrand(),
                query.getCondition(),
                toLikePattern(query.getSearch()),
                query.getMinPrice(),
                query.getMaxPrice(),
                PageRequest.of(page.getPage() - 1, page.getLimit())
        );
        if (ids.isEmpty()) {
            return List.of();
        }
        // IN 조회 결과를 대표 ID 순서로 되돌린다
        Map<Long, ProductVariant> byId = variantJpaRepository.findAllWithFamilyByIdIn(ids).stream()
                .collect(Collectors.toMap(ProductVariant::getId, Function.identity()));
        return ids.stream()
                .map(byId::get)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    @Override
    public long countFamilies(ProductListingQuery query) {
        return variantJpaRepository.countFamilies(
                query.isVariantListing(),
                query.getProductRef(),
                query.getProductType(),
                query.getBrand(),
                query.getCondition(),
                toLikePattern(query.getSearch()),
                query.getMinPrice(),
                query.getMaxPrice()
        );
    }

    @Override
    public List<ProductVariant> findBasesByProductType(String productType) {
        return variantJpaRepository.findBasesByProductType(productType);
    }

    @Override
    public List<ProductVariant> findVariantsOfFamilies(Collection<Long> familyIds, Collection<Long> excludeIds,
                                                       int limit) {
        if (familyIds.isEmpty()) {
            return List.of();
        }
        // NOT IN ()은 JPQL에서 허용되지 않으므로 제외 대상이 없으면 존재할 수 없는 ID를 넣는다
        Collection<Long> excluded = excludeIds.isEmpty() ? List.of(-1L) : excludeIds;
        return variantJpaRepository.findVariantsOfFamilies(familyIds, excluded, PageRequest.of(0, limit));
    }

    @Override
    public List<String> findDistinctProductTypes() {
        return familyJpaRepository.findDistinctProductTypes();
    }

    @Override
    public List<String> findDistinctBrands(String productType) {
        return familyJpaRepository.findDistinctBrands(productType);
    }

    @Override
    public List<String> findDistinctConditions(String productType, String brand) {
        return variantJpaRepository.findDistinctConditions(productType, brand);
    }

    @Override
    public PriceRange findEffectivePriceRange(String productType, String brand, String condition) {
        List<Object[]> rows = variantJpaRepository.findEffectivePriceRange(productType, brand, condition);
        if (rows.isEmpty()) {
            return PriceRange.EMPTY;
        }
        Object[] row = rows.get(0);
        return PriceRange.ofNullable((BigDecimal) row[0], (BigDecimal) row[1]);
    }

    @Override
    public Optional<ProductVariant> findByTuple(String productType, String name, VariantAttributes attributes) {
        return variantJpaRepository.findByTuple(productType, name, attributes.key());
    }

    @Override
    public ProductVariant save(ProductVariant variant) {
        return variantJpaRepository.save(variant);
    }

    @Override
    public ProductVariant saveAndFlush(ProductVariant variant) {
        return variantJpaRepository.saveAndFlush(variant);
    }

    @Override
    public void delete(ProductVariant variant) {
        variantJpaRepository.delete(variant);
    }

    /**
     * 대소문자 무시 부분 일치 패턴. LIKE 와일드카드는 '!'로 이스케이프한다.
     */
    static String toLikePattern(String search) {
        if (search == null || search.isBlank()) {
            return null;
        }
        String escaped = search.trim().toLowerCase(Locale.ROOT)
                .replace("!", "!!")
                .replace("%", "!%")
                .replace("_", "!_");
        return "%" + escaped + "%";
    }
}
