package com.playmarket.ecommerce.infrastructure.persistence.product;

import com.playmarket.ecommerce.common.util.PageParams;
import com.playmarket.ecommerce.domain.product.PriceRange;
import com.playmarket.ecommerce.domain.product.ProductFamily;
import com.playmarket.ecommerce.domain.product.ProductListingQuery;
import com.playmarket.ecommerce.domain.product.ProductRepository;
import com.playmarket.ecommerce.domain.product.ProductVariant;
import com.playmarket.ecommerce.domain.product.VariantAttributes;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * InMemoryProductRepository - 상품 변형 저장소 (테스트용 인메모리)
 *
 * 목록 조회 조건은 ProductVariantJpaRepository의 JPQL과 같은 의미로 메모리에서 평가한다.
 */
public class InMemoryProductRepository implements ProductRepository {

    private static final Comparator<ProductVariant> DISPLAY_ORDER = Comparator
            .comparing((ProductVariant v) -> v.getFamily().getDisplayOrder(),
                    Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(ProductVariant::getId);

    private final InMemoryProductFamilyRepository familyRepository;
    private final AtomicLong sequence = new AtomicLong(5000L);

    public InMemoryProductRepository(InMemoryProductFamilyRepository familyRepository) {
        this.familyRepository = familyRepository;
    }

    /**
     * 상품군과 구성원을 한 번에 등록 (ID가 이미 부여된 테스트 데이터용)
     */
    public void register(ProductFamily family) {
        familyRepository.save(family);
    }

    @Override
    public Optional<ProductVariant> findBySlugWithFamily(String slug) {
        return allVariants().filter(v -> v.getSlug().equals(slug)).findFirst();
    }

    @Override
    public boolean existsBySlug(String slug) {
        return findBySlugWithFamily(slug).isPresent();
    }

    @Override
    public List<ProductVariant> findAllByIds(Collection<Long> variantIds) {
        return allVariants().filter(v -> variantIds.contains(v.getId())).collect(Collectors.toList());
    }

    @Override
    public List<ProductVariant> findRepresentatives(ProductListingQuery query, PageParams page) {
        return representatives(query).stream()
                .skip(page.getOffset())
                .limit(page.getLimit())
                .collect(Collectors.toList());
    }

    @Override
    public long countFamilies(ProductListingQuery query) {
        return representatives(query).size();
    }

    @Override
    public List<ProductVariant> findBasesByProductType(String productType) {
        return allVariants()
                .filter(v -> !v.isVariant())
                .filter(v -> v.getProductType().equals(productType))
                .sorted(DISPLAY_ORDER)
                .collect(Collectors.toList());
    }

    @Override
    public List<ProductVariant> findVariantsOfFamilies(Collection<Long> familyIds, Collection<Long> excludeIds,
                                                       int limit) {
        return allVariants()
                .filter(ProductVariant::isVariant)
                .filter(v -> familyIds.contains(v.getFamily().getId()))
                .filter(v -> !excludeIds.contains(v.getId()))
                .sorted(Comparator.comparing(ProductVariant::getId))
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public List<String> findDistinctProductTypes() {
        return familyRepository.findAll().stream()
                .map(ProductFamily::getProductType)
                .distinct().sorted()
                .collect(Collectors.toList());
    }

    @Override
    public List<String> findDistinctBrands(String productType) {
        return familyRepository.findAll().stream()
                .filter(f -> productType == null || productType.equals(f.getProductType()))
                .map(ProductFamily::getBrand)
                .filter(Objects::nonNull)
                .distinct().sorted()
                .collect(Collectors.toList());
    }

    @Override
    public List<String> findDistinctConditions(String productType, String brand) {
        return allVariants()
                .filter(v -> productType == null || productType.equals(v.getProductType()))
                .filter(v -> brand == null || brand.equals(v.getBrand()))
                .map(v -> v.getAttributes().getCondition())
                .filter(Objects::nonNull)
                .distinct().sorted()
                .collect(Collectors.toList());
    }

    @Override
    public PriceRange findEffectivePriceRange(String productType, String brand, String condition) {
        List<BigDecimal> prices = allVariants()
                .filter(v -> productType == null || productType.equals(v.getProductType()))
                .filter(v -> brand == null || brand.equals(v.getBrand()))
                .filter(v -> condition == null || condition.equals(v.getAttributes().getCondition()))
                .map(ProductVariant::effectivePrice)
                .collect(Collectors.toList());
        if (prices.isEmpty()) {
            return PriceRange.EMPTY;
        }
        return PriceRange.ofNullable(
                prices.stream().min(Comparator.naturalOrder()).get(),
                prices.stream().max(Comparator.naturalOrder()).get());
    }

    @Override
    public Optional<ProductVariant> findByTuple(String productType, String name, VariantAttributes attributes) {
        return allVariants()
                .filter(v -> v.getProductType().equals(productType))
                .filter(v -> v.getName().equals(name))
                .filter(v -> v.getAttributesKey().equals(attributes.key()))
                .findFirst();
    }

    @Override
    public ProductVariant save(ProductVariant variant) {
        if (variant.getId() == null) {
            ReflectionTestUtils.setField(variant, "id", sequence.incrementAndGet());
        }
        familyRepository.save(variant.getFamily());
        return variant;
    }

    /**
     * (family_id, attributes_key), slug 유니크 제약을 흉내 낸다.
     */
    @Override
    public ProductVariant saveAndFlush(ProductVariant variant) {
        boolean duplicated = allVariants()
                .filter(other -> other != variant)
                .anyMatch(other -> other.getSlug().equals(variant.getSlug())
                        || (other.getFamily() == variant.getFamily()
                            && other.getAttributesKey().equals(variant.getAttributesKey())));
        if (duplicated) {
            throw new DataIntegrityViolationException(
                    "Duplicate entry for uk_variant_attributes - slug=" + variant.getSlug());
        }
        return save(variant);
    }

    @Override
    public void delete(ProductVariant variant) {
        variant.getFamily().getVariants().remove(variant);
    }

    private static boolean matches(ProductVariant variant, String search) {
        String keyword = search.toLowerCase(Locale.ROOT);
        String description = variant.getFamily().getDescription();
        return variant.getName().toLowerCase(Locale.ROOT).contains(keyword)
                || (description != null && description.toLowerCase(Locale.ROOT).contains(keyword));
    }

    /**
     * 필터에 맞는 후보를 노출 순서로 정렬한 뒤 상품군마다 첫 후보만 남긴다.
     */
    private List<ProductVariant> representatives(ProductListingQuery query) {
        Map<Long, ProductVariant> firstByFamily = new LinkedHashMap<>();
        allVariants()
                .filter(v -> v.isVariant() == query.isVariantListing())
                .filter(v -> query.getProductRef() == null || query.getProductRef().equals(v.getProductRef()))
                .filter(v -> query.getProductType() == null || query.getProductType().equals(v.getProductType()))
                .filter(v -> query.getBrand() == null || query.getBrand().equals(v.getBrand()))
                .filter(v -> query.getCondition() == null
                        || query.getCondition().equals(v.getAttributes().getCondition()))
                .filter(v -> query.getSearch() == null || matches(v, query.getSearch()))
                .filter(v -> query.getMinPrice() == null || v.effectivePrice().compareTo(query.getMinPrice()) >= 0)
                .filter(v -> query.getMaxPrice() == null || v.effectivePrice().compareTo(query.getMaxPrice()) <= 0)
                .sorted(DISPLAY_ORDER)
                .forEach(v -> firstByFamily.putIfAbsent(v.getFamily().getId(), v));
        return new ArrayList<>(firstByFamily.values());
    }

    private Stream<ProductVariant> allVariants() {
        return familyRepository.findAll().stream()
                .flatMap(family -> family.getVariants().stream());
    }
}
