package com.playmarket.ecommerce.application.product;

import com.playmarket.ecommerce.application.product.dto.ProductListFilter;
import com.playmarket.ecommerce.application.product.dto.ProductListResponse;
import com.playmarket.ecommerce.application.product.dto.ProductSummaryResponse;
import com.playmarket.ecommerce.common.exception.InvalidRequestException;
import com.playmarket.ecommerce.common.util.PageParams;
import com.playmarket.ecommerce.domain.product.ListingSort;
import com.playmarket.ecommerce.domain.product.PriceRange;
import com.playmarket.ecommerce.domain.product.ProductListing;
import com.playmarket.ecommerce.domain.product.ProductListingQuery;
import com.playmarket.ecommerce.domain.product.ProductRepository;
import com.playmarket.ecommerce.domain.product.ProductVariant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 상품 목록 / 패싯 조회
 *
 * 처리 순서:
 * 1. 필터에 맞는 후보를 상품군으로 그룹핑한 대표 변형을 노출 순서대로 한 페이지만 조회
 * 2. 전체 건수는 후보가 있는 상품군 수
 * 3. 페이지 안에서만 정렬 (max_price / min_price / order)
 * 5. 패싯: 타입 전체, 브랜드(타입 기준), 상태(타입+브랜드 기준), 가격 범위(타입+브랜드+상태 기준)
 */
@Service
public class ProductListingService {

    private static final Logger log = LoggerFactory.getLogger(ProductListingService.class);

    private final ProductRepository productRepository;
    private final int defaultLimit;
    private final int maxLimit;

    public ProductListingService(ProductRepository productRepository,
                                 @Value("${playmarket.listing.default-limit:5}") int defaultLimit,
                                 @Value("${playmarket.listing.max-limit:100}") int maxLimit) {
        this.productRepository = productRepository;
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }

    @Transactional(readOnly = true)
    public ProductListResponse listProducts(ProductListFilter filter) {
        PageParams pageParams = PageParams.parse(filter.getPage(), filter.getLimit(), defaultLimit, maxLimit);
        ListingSort sort = ListingSort.fromParameter(filter.getSort());

        ProductListingQuery query = ProductListingQuery.builder()
                .productType(emptyToNull(filter.getProductType()))
                .brand(emptyToNull(filter.getBrand()))
                .condition(emptyToNull(filter.getCondition()))
                .search(emptyToNull(filter.getSearch()))
                .minPrice(parsePrice("min_price", filter.getMinPrice()))
                .maxPrice(parsePrice("max_price", filter.getMaxPrice()))
                .productRef(emptyToNull(filter.getProductRef()))
                .build();

        long totalCount = productRepository.countFamilies(query);
        List<ProductVariant> page = ProductListing.sortPage(
                productRepository.findRepresentatives(query, pageParams), sort);

        log.debug("[ProductListingService] 목록 조회 - families={}, page={}, limit={}, sort={}",
                totalCount, pageParams.getPage(), pageParams.getLimit(), sort);

        return ProductListResponse.builder()
                .products(page.stream()
                        .map(ProductSummaryResponse::from)
                        .collect(Collectors.toList()))
                .meta(ProductListResponse.Meta.builder()
                        .pagination(ProductListResponse.Pagination.builder()
                                .totalProductCount(totalCount)
                                .totalPages(pageParams.totalPages(totalCount))
                                .currentPage(pageParams.getPage())
                                .currentProductLimit(pageParams.getLimit())
                                .build())
                        .productMeta(facets(query))
                        .current(ProductListResponse.CurrentFilters.builder()
                                .productType(query.getProductType())
                                .brand(query.getBrand())
                                .condition(query.getCondition())
                                .search(query.getSearch())
                                .minPrice(query.getMinPrice())
                                .maxPrice(query.getMaxPrice())
                                .productRef(query.getProductRef())
                                .sort(sort.getParameter())
                                .build())
                        .build())
                .build();
    }

    private ProductListResponse.Facets facets(ProductListingQuery query) {
        PriceRange priceRange = productRepository.findEffectivePriceRange(
                query.getProductType(), query.getBrand(), query.getCondition());

        return ProductListResponse.Facets.builder()
                .productTypes(productRepository.findDistinctProductTypes())
                .brands(productRepository.findDistinctBrands(query.getProductType()))
                .conditions(productRepository.findDistinctConditions(query.getProductType(), query.getBrand()))
                .minPrice(priceRange.getMin())
                .maxPrice(priceRange.getMax())
                .build();
    }

    private static BigDecimal parsePrice(String name, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidRequestException(name + "는 숫자여야 합니다: " + raw);
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
