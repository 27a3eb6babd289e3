package com.playmarket.ecommerce.unit.application.product;

import com.playmarket.ecommerce.application.product.ProductListingService;
import com.playmarket.ecommerce.application.product.dto.ProductListFilter;
import com.playmarket.ecommerce.application.product.dto.ProductListResponse;
import com.playmarket.ecommerce.application.product.dto.ProductSummaryResponse;
import com.playmarket.ecommerce.common.exception.InvalidRequestException;
import com.playmarket.ecommerce.domain.product.ProductFamily;
import com.playmarket.ecommerce.infrastructure.persistence.product.InMemoryProductFamilyRepository;
import com.playmarket.ecommerce.infrastructure.persistence.product.InMemoryProductRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

import static com.playmarket.ecommerce.config.TestDataFactory.attrs;
import static com.playmarket.ecommerce.config.TestDataFactory.family;
import static com.playmarket.ecommerce.config.TestDataFactory.variant;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ProductListingServiceTest - 목록 / 패싯
 *
 * 카탈로그:
 * - Xbox Series X (console, order 1): 499.00 (할인 379.00)
 * - DualSense (accessory, order 1): 69.99
 * - PlayStation 5 (console, order 2): 기본 499.99 + 변형 4개 (449.99, 할인 399.99, 599.99, 429.99)
 * - Zelda TOTK (game, order 3): 59.99
 * - Switch OLED (console, order 없음): 349.99
 */
@DisplayName("ProductListingService 단위 테스트")
class ProductListingServiceTest {

    private ProductListingService productListingService;

    @BeforeEach
    void setUp() {
        InMemoryProductFamilyRepository familyRepository = new InMemoryProductFamilyRepository();
        InMemoryProductRepository productRepository = new InMemoryProductRepository(familyRepository);

        ProductFamily xbox = family(1L, "Xbox Series X", "console", "Microsoft", 1);
        variant(xbox, 21L, attrs("X", null, "New", "1TB"), "499.00", "379.00", 4, false);

        ProductFamily dualSense = family(2L, "DualSense", "accessory", "Sony", 1);
        variant(dualSense, 41L, attrs(null, "White", "New", null), "69.99", null, 20, false);

        ProductFamily ps5 = family(3L, "PlayStation 5", "console", "Sony", 2);
        variant(ps5, 11L, attrs("Disc", null, "New", "825GB"), "499.99", null, 10, false);
        variant(ps5, 12L, attrs("Digital", null, "New", "825GB"), "449.99", null, 10, true);
        variant(ps5, 13L, attrs("Disc", null, "Used", "825GB"), "499.99", "399.99", 10, true);
        variant(ps5, 14L, attrs("Disc", null, "New", "2TB"), "599.99", null, 10, true);
        variant(ps5, 15L, attrs("Digital", null, "Used", "2TB"), "429.99", null, 10, true);

        ProductFamily zelda = family(4L, "Zelda TOTK", "game", "Nintendo", 3);
        variant(zelda, 51L, attrs(null, null, "New", null), "59.99", null, 50, false);

        ProductFamily sw = family(5L, "Switch OLED", "console", "Nintendo", null);
        variant(sw, 31L, attrs("OLED", null, "New", "64GB"), "349.99", null, 3, false);

        List.of(xbox, dualSense, ps5, zelda, sw).forEach(productRepository::register);

        productListingService = new ProductListingService(productRepository, 5, 100);
    }

    // ========== 그룹핑 / 페이지 ==========

    @Test
    @DisplayName("기본 조회 - 상품군마다 하나, 노출 순서(미지정은 마지막), 기본 limit 5")
    void testListProducts_Default() {
        // When
        ProductListResponse response = productListingService.listProducts(ProductListFilter.builder().build());

        // Then
        assertEquals(List.of("Xbox Series X", "DualSense", "PlayStation 5", "Zelda TOTK", "Switch OLED"),
                names(response));
        assertEquals(5, response.getMeta().getPagination().getTotalProductCount());
        assertEquals(1, response.getMeta().getPagination().getCurrentPage());
        assertEquals(5, response.getMeta().getPagination().getCurrentProductLimit());
        assertEquals("order", response.getMeta().getCurrent().getSort());
    }

    @Test
    @DisplayName("구성원 5개인 상품군도 목록에서는 한 건, 전체 건수는 상품군 수")
    void testListProducts_GroupsFamilyMembers() {
        // When
        ProductListResponse response = productListingService.listProducts(
                ProductListFilter.builder().productType("console").build());

        // Then
        assertEquals(3, response.getMeta().getPagination().getTotalProductCount());
        assertEquals(1, response.getProducts().stream().filter(p -> p.getName().equals("PlayStation 5")).count());
        ProductSummaryResponse ps5 = response.getProducts().stream()
                .filter(p -> p.getName().equals("PlayStation 5")).findFirst().orElseThrow();
        assertFalse(ps5.isVariant());
    }

    @Test
    @DisplayName("product_ref - 해당 상품군의 변형만 후보, 상품군 이름으로 묶여 한 건")
    void testListProducts_ProductRef() {
        // When
        ProductListResponse response = productListingService.listProducts(
                ProductListFilter.builder().productRef("PlayStation 5").build());

        // Then
        assertEquals(1, response.getMeta().getPagination().getTotalProductCount());
        assertTrue(response.getProducts().get(0).isVariant());
        assertEquals("PlayStation 5", response.getProducts().get(0).getProductRef());
    }

    @Test
    @DisplayName("페이지 절단은 그룹핑 이후 - limit 2, page 2")
    void testListProducts_PageAfterGrouping() {
        // When
        ProductListResponse response = productListingService.listProducts(
                ProductListFilter.builder().page("2").limit("2").build());

        // Then
        assertEquals(List.of("PlayStation 5", "Zelda TOTK"), names(response));
        assertEquals(5, response.getMeta().getPagination().getTotalProductCount());
        assertEquals(3, response.getMeta().getPagination().getTotalPages());
    }

    @Test
    @DisplayName("잘못된 page/limit은 오류 없이 기본값, limit 최대 100")
    void testListProducts_InvalidPaging() {
        ProductListResponse invalid = productListingService.listProducts(
                ProductListFilter.builder().page("abc").limit("-1").build());
        assertEquals(1, invalid.getMeta().getPagination().getCurrentPage());
        assertEquals(5, invalid.getMeta().getPagination().getCurrentProductLimit());

        ProductListResponse clamped = productListingService.listProducts(
                ProductListFilter.builder().limit("1000").build());
        assertEquals(100, clamped.getMeta().getPagination().getCurrentProductLimit());
    }

    // ========== 가격 필터 / 정렬 ==========

    @Test
    @DisplayName("가격 필터는 실구매가 기준 - 할인가가 범위 밖이면 제외")
    void testListProducts_EffectivePriceFilter() {
        // When: Xbox 정가 499.00은 범위 안이지만 할인가 379.00은 범위 밖
        ProductListResponse response = productListingService.listProducts(
                ProductListFilter.builder().productType("console").minPrice("380").maxPrice("500").build());

        // Then
        assertEquals(List.of("PlayStation 5"), names(response));
        assertEquals(new BigDecimal("380"), response.getMeta().getCurrent().getMinPrice());
    }

    @Test
    @DisplayName("가격 필터 - 할인가가 범위 안이면 포함")
    void testListProducts_OfferPriceIncluded() {
        ProductListResponse response = productListingService.listProducts(
                ProductListFilter.builder().productType("console").maxPrice("400").build());

        assertEquals(List.of("Xbox Series X", "Switch OLED"), names(response));
    }

    @Test
    @DisplayName("숫자가 아닌 가격 필터는 400")
    void testListProducts_InvalidPrice() {
        assertThrows(InvalidRequestException.class, () -> productListingService.listProducts(
                ProductListFilter.builder().minPrice("cheap").build()));
    }

    @Test
    @DisplayName("max_price / min_price 정렬은 실구매가 기준")
    void testListProducts_SortByPrice() {
        ProductListResponse desc = productListingService.listProducts(
                ProductListFilter.builder().productType("console").sort("max_price").build());
        assertEquals(List.of("PlayStation 5", "Xbox Series X", "Switch OLED"), names(desc));

        ProductListResponse asc = productListingService.listProducts(
                ProductListFilter.builder().productType("console").sort("min_price").build());
        assertEquals(List.of("Switch OLED", "Xbox Series X", "PlayStation 5"), names(asc));
    }

    @Test
    @DisplayName("search - 이름/설명 대소문자 무시 부분 일치")
    void testListProducts_Search() {
        ProductListResponse response = productListingService.listProducts(
                ProductListFilter.builder().search("STATION").build());

        assertEquals(List.of("PlayStation 5"), names(response));
    }

    // ========== 패싯 ==========

    @Test
    @DisplayName("패싯 - 타입은 전체, 브랜드는 타입 기준, 가격 범위는 변형 포함 실구매가")
    void testListProducts_Facets() {
        // When
        ProductListResponse.Facets facets = productListingService.listProducts(
                ProductListFilter.builder().productType("console").build()).getMeta().getProductMeta();

        // Then
        assertEquals(List.of("accessory", "console", "game"), facets.getProductTypes());
        assertEquals(List.of("Microsoft", "Nintendo", "Sony"), facets.getBrands());
        assertEquals(List.of("New", "Used"), facets.getConditions());
        assertEquals(new BigDecimal("349.99"), facets.getMinPrice());
        assertEquals(new BigDecimal("599.99"), facets.getMaxPrice());
    }

    @Test
    @DisplayName("패싯 - 일치하는 상품이 없으면 가격 범위 0")
    void testListProducts_EmptyFacets() {
        ProductListResponse response = productListingService.listProducts(
                ProductListFilter.builder().productType("vr").build());

        assertTrue(response.getProducts().isEmpty());
        assertEquals(0, response.getMeta().getPagination().getTotalProductCount());
        assertEquals(0, BigDecimal.ZERO.compareTo(response.getMeta().getProductMeta().getMinPrice()));
        assertEquals(0, BigDecimal.ZERO.compareTo(response.getMeta().getProductMeta().getMaxPrice()));
    }

    private static List<String> names(ProductListResponse response) {
        return response.getProducts().stream()
                .map(ProductSummaryResponse::getName)
                .collect(Collectors.toList());
    }
}
