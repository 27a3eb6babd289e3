package com.playmarket.ecommerce.unit.application.product;

import com.playmarket.ecommerce.application.product.ProductDetailService;
import com.playmarket.ecommerce.application.product.dto.OptionDeltaResponse;
import com.playmarket.ecommerce.application.product.dto.ProductDetailResponse;
import com.playmarket.ecommerce.application.product.dto.RelatedProductResponse;
import com.playmarket.ecommerce.domain.product.ProductFamily;
import com.playmarket.ecommerce.domain.product.ProductNotFoundException;
import com.playmarket.ecommerce.domain.product.ProductVariant;
import com.playmarket.ecommerce.domain.product.VariantPriceCalculator;
import com.playmarket.ecommerce.domain.review.Review;
import com.playmarket.ecommerce.infrastructure.persistence.product.InMemoryProductFamilyRepository;
import com.playmarket.ecommerce.infrastructure.persistence.product.InMemoryProductRepository;
import com.playmarket.ecommerce.infrastructure.persistence.review.InMemoryReviewRepository;
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
 * ProductDetailServiceTest - 상세 조회 (옵션 가격 차이, 리뷰 요약, 연관 상품)
 */
@DisplayName("ProductDetailService 단위 테스트")
class ProductDetailServiceTest {

    private InMemoryReviewRepository reviewRepository;
    private ProductDetailService productDetailService;

    private ProductVariant ps5Disc;
    private ProductVariant ps5DigitalUsed2tb;

    @BeforeEach
    void setUp() {
        InMemoryProductFamilyRepository familyRepository = new InMemoryProductFamilyRepository();
        InMemoryProductRepository productRepository = new InMemoryProductRepository(familyRepository);
        reviewRepository = new InMemoryReviewRepository();

        ProductFamily ps5 = family(1L, "PlayStation 5", "console", "Sony", 2);
        ps5Disc = variant(ps5, 11L, attrs("Disc", null, "New", "825GB"), "499.99", null, 10, false);
        variant(ps5, 12L, attrs("Digital", null, "New", "825GB"), "449.99", null, 10, true);
        variant(ps5, 13L, attrs("Disc", null, "Used", "825GB"), "499.99", "399.99", 10, true);
        variant(ps5, 14L, attrs("Disc", null, "New", "2TB"), "599.99", null, 10, true);
        ps5DigitalUsed2tb = variant(ps5, 15L, attrs("Digital", null, "Used", "2TB"), "429.99", null, 10, true);
        ps5.replaceRelatedProducts(List.of("Zelda TOTK", "Switch OLED", "DualSense", "Unknown Family"));

        ProductFamily dualSense = family(2L, "DualSense", "accessory", "Sony", 1);
        variant(dualSense, 21L, attrs(null, "White", "New", null), "69.99", null, 20, false);
        variant(dualSense, 22L, attrs(null, "Black", "New", null), "74.99", "59.99", 20, true);

        ProductFamily zelda = family(3L, "Zelda TOTK", "game", "Nintendo", 3);
        variant(zelda, 31L, attrs(null, null, "New", null), "59.99", null, 50, false);

        ProductFamily sw = family(4L, "Switch OLED", "console", "Nintendo", null);
        variant(sw, 41L, attrs("OLED", null, "New", "64GB"), "349.99", null, 3, false);

        List.of(ps5, dualSense, zelda, sw).forEach(productRepository::register);

        productDetailService = new ProductDetailService(
                productRepository, familyRepository, reviewRepository, new VariantPriceCalculator());
    }

    // ========== 옵션 가격 차이 ==========

    @Test
    @DisplayName("기본 상품 조회 - 속성 하나만 바꾼 조합과의 실구매가 차이")
    void testGetProductBySlug_OptionDeltas() {
        // When
        ProductDetailResponse response = productDetailService.getProductBySlug(ps5Disc.getSlug());

        // Then
        assertEquals("PlayStation 5", response.getProduct().getName());
        assertEquals(List.of("Disc:+0", "Digital:-50.00"), render(response.getOptions().get("models")));
        assertEquals(List.of("New:+0", "Used:-100.00"), render(response.getOptions().get("conditions")));
        assertEquals(List.of("825GB:+0", "2TB:+100.00"), render(response.getOptions().get("memories")));
        assertTrue(response.getOptions().get("controllers").isEmpty());
    }

    @Test
    @DisplayName("변형 조회 - 한 속성만 바꾼 조합이 없으면 +0")
    void testGetProductBySlug_MissingCombination() {
        // When: Digital/Used/2TB 에서 Disc/Used/2TB 조합은 없음
        ProductDetailResponse response = productDetailService.getProductBySlug(ps5DigitalUsed2tb.getSlug());

        // Then
        assertEquals(List.of("Disc:+0", "Digital:+0"), render(response.getOptions().get("models")));
        assertEquals(List.of("New:+0", "Used:+0"), render(response.getOptions().get("conditions")));
        assertTrue(response.getProduct().isVariant());
        assertEquals("PlayStation 5", response.getProduct().getProductRef());
    }

    @Test
    @DisplayName("존재하지 않는 slug는 ProductNotFoundException")
    void testGetProductBySlug_NotFound() {
        assertThrows(ProductNotFoundException.class,
                () -> productDetailService.getProductBySlug("no-such-product"));
    }

    // ========== 리뷰 요약 ==========

    @Test
    @DisplayName("리뷰 요약 - 평균은 소수 첫째 자리 반올림")
    void testGetProductBySlug_ReviewSummary() {
        // Given
        reviewRepository.saveAndFlush(Review.write(1L, "PlayStation 5", 5, "좋아요", "Kim", null));
        reviewRepository.saveAndFlush(Review.write(2L, "PlayStation 5", 4, "괜찮아요", "Lee", null));
        reviewRepository.saveAndFlush(Review.write(3L, "PlayStation 5", 4, null, "Park", null));

        // When
        ProductDetailResponse response = productDetailService.getProductBySlug(ps5Disc.getSlug());

        // Then
        assertEquals(new BigDecimal("4.3"), response.getReviews().getAverageRating());
        assertEquals(3, response.getReviews().getCount());
    }

    @Test
    @DisplayName("리뷰가 없으면 0.0 / 0")
    void testGetProductBySlug_NoReviews() {
        ProductDetailResponse response = productDetailService.getProductBySlug(ps5Disc.getSlug());

        assertEquals(0, BigDecimal.ZERO.compareTo(response.getReviews().getAverageRating()));
        assertEquals(0, response.getReviews().getCount());
    }

    // ========== 연관 상품 ==========

    @Test
    @DisplayName("연관 상품 - 노출 순서(미지정 마지막), 기본 상품 정가(할인가 미반영), 없는 이름은 제외")
    void testGetProductBySlug_RelatedProducts() {
        // When
        List<RelatedProductResponse> related =
                productDetailService.getProductBySlug(ps5Disc.getSlug()).getRelatedProducts();

        // Then
        assertEquals(List.of("DualSense", "Zelda TOTK", "Switch OLED"),
                related.stream().map(RelatedProductResponse::getName).collect(Collectors.toList()));

        RelatedProductResponse dualSense = related.get(0);
        // 변형 Black의 할인가 59.99는 반영하지 않는다
        assertEquals(new BigDecimal("69.99"), dualSense.getMinPrice());
        assertTrue(dualSense.getSlug().startsWith("dualsense"));
        assertEquals("uploads/" + dualSense.getSlug() + ".jpg", dualSense.getImage());
    }

    private static List<String> render(List<OptionDeltaResponse> deltas) {
        return deltas.stream()
                .map(d -> d.getValue() + ":" + d.getPriceDelta())
                .collect(Collectors.toList());
    }
}
