package com.playmarket.ecommerce.application.product;

import com.playmarket.ecommerce.application.product.dto.OptionDeltaResponse;
import com.playmarket.ecommerce.application.product.dto.ProductDetailResponse;
import com.playmarket.ecommerce.application.product.dto.ProductSummaryResponse;
import com.playmarket.ecommerce.application.product.dto.RelatedProductResponse;
import com.playmarket.ecommerce.domain.product.PriceDelta;
import com.playmarket.ecommerce.domain.product.ProductFamily;
import com.playmarket.ecommerce.domain.product.ProductFamilyRepository;
import com.playmarket.ecommerce.domain.product.ProductNotFoundException;
import com.playmarket.ecommerce.domain.product.ProductRepository;
import com.playmarket.ecommerce.domain.product.ProductVariant;
import com.playmarket.ecommerce.domain.product.VariantAttribute;
import com.playmarket.ecommerce.domain.product.VariantPriceCalculator;
import com.playmarket.ecommerce.domain.review.RatingSummary;
import com.playmarket.ecommerce.domain.review.ReviewRepository;
import com.playmarket.ecommerce.infrastructure.config.CacheNames;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 상품 상세 조회 (slug 기준)
 *
 * 상품 본문 + 옵션별 가격 차이 + 리뷰 요약 + 연관 상품.
 * 결과는 Redis에 캐시되며 상품/리뷰 변경 시 무효화된다.
 */
@Service
public class ProductDetailService {

    private static final Map<VariantAttribute, String> OPTION_KEYS = Map.of(
            VariantAttribute.MODEL, "models",
            VariantAttribute.CONTROLLER, "controllers",
            VariantAttribute.CONDITION, "conditions",
            VariantAttribute.MEMORY, "memories"
    );

    private final ProductRepository productRepository;
    private final ProductFamilyRepository familyRepository;
    private final ReviewRepository reviewRepository;
    private final VariantPriceCalculator priceCalculator;

    public ProductDetailService(ProductRepository productRepository,
                                ProductFamilyRepository familyRepository,
                                ReviewRepository reviewRepository,
                                VariantPriceCalculator priceCalculator) {
        this.productRepository = productRepository;
        this.familyRepository = familyRepository;
        this.reviewRepository = reviewRepository;
        this.priceCalculator = priceCalculator;
    }

    @Cacheable(value = CacheNames.PRODUCT_DETAIL, key = "#slug")
    @Transactional(readOnly = true)
    public ProductDetailResponse getProductBySlug(String slug) {
        ProductVariant viewed = productRepository.findBySlugWithFamily(slug)
                .orElseThrow(() -> new ProductNotFoundException(slug));
        ProductFamily family = viewed.getFamily();

        Map<VariantAttribute, List<PriceDelta>> deltas =
                priceCalculator.calculate(viewed, family.membersBaseFirst());

        RatingSummary rating = reviewRepository.summarize(family.getName());

        return ProductDetailResponse.builder()
                .product(ProductSummaryResponse.from(viewed))
                .options(toOptionResponse(deltas))
                .reviews(new ProductDetailResponse.ReviewSummary(rating.getAverage(), rating.getCount()))
                .relatedProducts(relatedProducts(family))
                .build();
    }

    private Map<String, List<OptionDeltaResponse>> toOptionResponse(Map<VariantAttribute, List<PriceDelta>> deltas) {
        Map<String, List<OptionDeltaResponse>> options = new LinkedHashMap<>();
        for (VariantAttribute attribute : VariantAttribute.values()) {
            options.put(OPTION_KEYS.get(attribute), deltas.get(attribute).stream()
                    .map(OptionDeltaResponse::from)
                    .collect(Collectors.toCollection(ArrayList::new)));
        }
        return options;
    }

    /**
     * 연관 상품군마다 대표(기본 상품) 하나와 그 정가. 노출 순서(미지정은 마지막), 가격 순
     */
    private List<RelatedProductResponse> relatedProducts(ProductFamily family) {
        if (family.getRelatedProducts().isEmpty()) {
            return new ArrayList<>();
        }

        List<RelatedProductResponse> related = new ArrayList<>();
        for (ProductFamily relatedFamily : familyRepository.findAllWithVariantsByNameIn(family.getRelatedProducts())) {
            Optional<ProductVariant> representative = relatedFamily.findBase()
                    .or(() -> relatedFamily.membersBaseFirst().stream().findFirst());
            if (representative.isEmpty()) {
                continue;
            }
            ProductVariant base = representative.get();
            related.add(RelatedProductResponse.builder()
                    .name(relatedFamily.getName())
                    .slug(base.getSlug())
                    .productType(relatedFamily.getProductType())
                    .brand(relatedFamily.getBrand())
                    .image(base.firstImage())
                    .order(relatedFamily.getDisplayOrder())
                    .minPrice(base.getPrice())
                    .build());
        }

        related.sort(Comparator
                .comparing(RelatedProductResponse::getOrder, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(RelatedProductResponse::getMinPrice));
        return related;
    }
}
