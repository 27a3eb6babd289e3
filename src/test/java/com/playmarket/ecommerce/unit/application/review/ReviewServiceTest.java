package com.playmarket.ecommerce.unit.application.review;

import com.playmarket.ecommerce.application.review.ReviewService;
import com.playmarket.ecommerce.application.review.ReviewTransactionService;
import com.playmarket.ecommerce.application.review.dto.ReviewCommand;
import com.playmarket.ecommerce.application.review.dto.ReviewListResponse;
import com.playmarket.ecommerce.application.review.dto.ReviewResponse;
import com.playmarket.ecommerce.common.exception.InvalidRequestException;
import com.playmarket.ecommerce.domain.customer.CustomerNotFoundException;
import com.playmarket.ecommerce.domain.product.ProductFamily;
import com.playmarket.ecommerce.domain.product.ProductNotFoundException;
import com.playmarket.ecommerce.domain.review.Review;
import com.playmarket.ecommerce.domain.review.ReviewNotFoundException;
import com.playmarket.ecommerce.domain.storage.FileStorage;
import com.playmarket.ecommerce.infrastructure.persistence.customer.InMemoryCustomerRepository;
import com.playmarket.ecommerce.infrastructure.persistence.product.InMemoryProductFamilyRepository;
import com.playmarket.ecommerce.infrastructure.persistence.review.InMemoryReviewRepository;
import com.playmarket.ecommerce.unit.BaseUnitTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;

import java.math.BigDecimal;

import static com.playmarket.ecommerce.config.TestDataFactory.customer;
import static com.playmarket.ecommerce.config.TestDataFactory.family;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * ReviewServiceTest - 리뷰 작성(upsert), 관리자 등록/수정, 목록, 삭제와 상품군 평점 갱신
 */
@DisplayName("ReviewService 단위 테스트")
class ReviewServiceTest extends BaseUnitTest {

    @Mock
    private FileStorage fileStorage;

    private InMemoryReviewRepository reviewRepository;
    private ReviewService reviewService;
    private ProductFamily ps5;

    @BeforeEach
    void setUp() {
        reviewRepository = new InMemoryReviewRepository();
        InMemoryProductFamilyRepository familyRepository = new InMemoryProductFamilyRepository();
        InMemoryCustomerRepository customerRepository = new InMemoryCustomerRepository();

        ps5 = familyRepository.save(family(1L, "PlayStation 5", "console", "Sony", 1));
        familyRepository.save(family(2L, "DualSense", "accessory", "Sony", 1));
        customerRepository.save(customer(1L, "Kim"));
        customerRepository.save(customer(2L, "Lee"));

        reviewService = new ReviewService(reviewRepository, familyRepository, customerRepository,
                new ReviewTransactionService(reviewRepository, familyRepository, fileStorage));
    }

    // ========== 작성 ==========

    @Test
    @DisplayName("첫 작성 - 고객 이름/아바타 스냅샷, 상품군 평점 갱신")
    void testStore_Creates() {
        // When
        ReviewResponse response = reviewService.store(1L, "PlayStation 5", 5, "최고");

        // Then
        assertNotNull(response.getId());
        assertEquals("Kim", response.getCustomerName());
        assertEquals("uploads/avatars/1.png", response.getCustomerAvatar());
        assertEquals(new BigDecimal("5.0"), ps5.getRatings());
        assertEquals(1, ps5.getReviewCount());
    }

    @Test
    @DisplayName("같은 고객이 다시 작성 - 새 리뷰 없이 기존 리뷰 갱신")
    void testStore_UpsertsSameCustomer() {
        // Given
        ReviewResponse first = reviewService.store(1L, "PlayStation 5", 5, "최고");

        // When
        ReviewResponse second = reviewService.store(1L, "PlayStation 5", 2, "발열이 심함");

        // Then
        assertEquals(first.getId(), second.getId());
        assertEquals(2, second.getRating());
        assertEquals(1, reviewRepository.count("PlayStation 5"));
        assertEquals(new BigDecimal("2.0"), ps5.getRatings());
    }

    @Test
    @DisplayName("평균 평점은 소수 첫째 자리 반올림")
    void testStore_AverageRating() {
        reviewService.store(1L, "PlayStation 5", 5, null);
        reviewService.store(2L, "PlayStation 5", 4, null);

        assertEquals(new BigDecimal("4.5"), ps5.getRatings());
        assertEquals(2, ps5.getReviewCount());
    }

    @Test
    @DisplayName("평점 범위 밖 / 상품명 없음은 400")
    void testStore_InvalidInput() {
        assertThrows(InvalidRequestException.class, () -> reviewService.store(1L, "PlayStation 5", 0, null));
        assertThrows(InvalidRequestException.class, () -> reviewService.store(1L, "PlayStation 5", 6, null));
        assertThrows(InvalidRequestException.class, () -> reviewService.store(1L, "PlayStation 5", null, null));
        assertThrows(InvalidRequestException.class, () -> reviewService.store(1L, " ", 3, null));
    }

    @Test
    @DisplayName("없는 상품군 / 없는 고객은 404")
    void testStore_NotFound() {
        assertThrows(ProductNotFoundException.class, () -> reviewService.store(1L, "Dreamcast", 3, null));
        assertThrows(CustomerNotFoundException.class, () -> reviewService.store(99L, "PlayStation 5", 3, null));
    }

    // ========== 관리자 등록/수정 ==========

    @Test
    @DisplayName("관리자 등록 - 고객 참조 없이 작성자 지정, 같은 상품군에 여러 개")
    void testCreate_AdminReview() {
        // Given
        reviewService.store(1L, "PlayStation 5", 5, null);

        // When
        ReviewResponse first = reviewService.create(adminReview("Editor", "uploads/avatars/editor.png", 3));
        ReviewResponse second = reviewService.create(adminReview("Editor", null, 4));

        // Then
        assertNotEquals(first.getId(), second.getId());
        assertEquals("Editor", first.getCustomerName());
        assertNull(reviewRepository.findById(first.getId()).orElseThrow().getCustomerId());
        assertEquals(3, reviewRepository.count("PlayStation 5"));
        assertEquals(new BigDecimal("4.0"), ps5.getRatings());
    }

    @Test
    @DisplayName("관리자 등록 - 작성자 이름/평점 누락은 400, 없는 상품군은 404")
    void testCreate_InvalidInput() {
        assertThrows(InvalidRequestException.class, () -> reviewService.create(adminReview(" ", null, 3)));
        assertThrows(InvalidRequestException.class, () -> reviewService.create(adminReview("Editor", null, null)));
        assertThrows(ProductNotFoundException.class, () -> reviewService.create(ReviewCommand.builder()
                .productName("Dreamcast").rating(3).customerName("Editor").build()));
    }

    @Test
    @DisplayName("수정 - 부분 수정, 평점 재계산, 교체된 관리자 아바타 삭제")
    void testUpdate_ReplacesAdminAvatar() {
        // Given
        ReviewResponse created = reviewService.create(adminReview("Editor", "uploads/avatars/old.png", 2));

        // When
        ReviewResponse updated = reviewService.update(created.getId(), ReviewCommand.builder()
                .rating(5).customerAvatar("uploads/avatars/new.png").build());

        // Then
        assertEquals(5, updated.getRating());
        assertEquals("Editor", updated.getCustomerName());
        assertEquals("uploads/avatars/new.png", updated.getCustomerAvatar());
        assertEquals(new BigDecimal("5.0"), ps5.getRatings());
        verify(fileStorage).deleteFile("uploads/avatars/old.png");
    }

    @Test
    @DisplayName("수정 - 고객 리뷰의 아바타 파일은 유지")
    void testUpdate_KeepsCustomerAvatar() {
        // Given
        ReviewResponse kim = reviewService.store(1L, "PlayStation 5", 5, null);

        // When
        reviewService.update(kim.getId(), ReviewCommand.builder()
                .comment("패드 감도 좋음").customerAvatar("uploads/avatars/other.png").build());

        // Then
        verify(fileStorage, never()).deleteFile(anyString());
    }

    @Test
    @DisplayName("수정 - 없는 리뷰 404, 범위 밖 평점 400")
    void testUpdate_Invalid() {
        assertThrows(ReviewNotFoundException.class,
                () -> reviewService.update(404L, ReviewCommand.builder().rating(3).build()));

        ReviewResponse created = reviewService.create(adminReview("Editor", null, 3));
        assertThrows(InvalidRequestException.class,
                () -> reviewService.update(created.getId(), ReviewCommand.builder().rating(9).build()));
    }

    // ========== 목록 ==========

    @Test
    @DisplayName("목록 - 상품명 필터와 페이지 메타")
    void testList() {
        // Given
        reviewService.store(1L, "PlayStation 5", 5, null);
        reviewService.store(2L, "PlayStation 5", 4, null);
        reviewService.store(1L, "DualSense", 3, null);

        // When
        ReviewListResponse filtered = reviewService.list(null, null, "PlayStation 5");
        ReviewListResponse paged = reviewService.list("2", "2", null);

        // Then
        assertEquals(2, filtered.getTotal());
        assertEquals(10, filtered.getLimit());
        assertEquals(3, paged.getTotal());
        assertEquals(1, paged.getReviews().size());
        assertEquals(2, paged.getTotalPages());
    }

    // ========== 삭제 ==========

    @Test
    @DisplayName("삭제 - 평점 재계산, 고객 참조가 있으면 아바타 파일 유지")
    void testDelete_KeepsCustomerAvatar() {
        // Given
        ReviewResponse kim = reviewService.store(1L, "PlayStation 5", 5, null);
        reviewService.store(2L, "PlayStation 5", 3, null);

        // When
        reviewService.delete(kim.getId());

        // Then
        assertEquals(new BigDecimal("3.0"), ps5.getRatings());
        assertEquals(1, ps5.getReviewCount());
        verify(fileStorage, never()).deleteFile(anyString());
    }

    @Test
    @DisplayName("삭제 - 고객 참조가 없는 리뷰는 스냅샷 아바타 파일도 삭제")
    void testDelete_OrphanAvatar() {
        // Given
        Review orphan = reviewRepository.saveAndFlush(
                Review.write(null, "PlayStation 5", 4, "탈퇴 고객", "Ghost", "uploads/avatars/ghost.png"));

        // When
        reviewService.delete(orphan.getId());

        // Then
        verify(fileStorage).deleteFile("uploads/avatars/ghost.png");
        assertEquals(0, ps5.getReviewCount());
    }

    @Test
    @DisplayName("삭제 - 관리자 리뷰의 아바타 파일 삭제")
    void testDelete_AdminAvatar() {
        // Given
        ReviewResponse created = reviewService.create(adminReview("Editor", "uploads/avatars/editor.png", 4));

        // When
        reviewService.delete(created.getId());

        // Then
        verify(fileStorage).deleteFile("uploads/avatars/editor.png");
    }

    @Test
    @DisplayName("없는 리뷰 삭제는 404")
    void testDelete_NotFound() {
        assertThrows(ReviewNotFoundException.class, () -> reviewService.delete(404L));
    }

    private static ReviewCommand adminReview(String customerName, String customerAvatar, Integer rating) {
        return ReviewCommand.builder()
                .productName("PlayStation 5")
                .rating(rating)
                .comment("관리자 등록")
                .customerName(customerName)
                .customerAvatar(customerAvatar)
                .build();
    }
}
