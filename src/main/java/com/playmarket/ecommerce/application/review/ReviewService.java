package com.playmarket.ecommerce.application.review;

import com.playmarket.ecommerce.application.review.dto.ReviewCommand;
import com.playmarket.ecommerce.application.review.dto.ReviewListResponse;
import com.playmarket.ecommerce.application.review.dto.ReviewResponse;
import com.playmarket.ecommerce.common.exception.InvalidRequestException;
import com.playmarket.ecommerce.common.util.PageParams;
import com.playmarket.ecommerce.domain.customer.Customer;
import com.playmarket.ecommerce.domain.customer.CustomerNotFoundException;
import com.playmarket.ecommerce.domain.customer.CustomerRepository;
import com.playmarket.ecommerce.domain.product.ProductFamily;
import com.playmarket.ecommerce.domain.product.ProductFamilyRepository;
import com.playmarket.ecommerce.domain.product.ProductNotFoundException;
import com.playmarket.ecommerce.domain.review.Review;
import com.playmarket.ecommerce.domain.review.ReviewRepository;
import com.playmarket.ecommerce.infrastructure.config.CacheNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 상품 리뷰
 *
 * - 작성: 상품군과 고객이 존재해야 함. 고객 이름/아바타를 스냅샷으로 복사, (고객, 상품군)당 하나
 * - 목록: 최신순, 상품군 이름으로 필터
 * - 관리자 등록: 고객 없이 작성자 이름/아바타를 직접 지정, 같은 상품군에 여러 개 가능
 * - 수정: review_id 기준 부분 수정. 없으면 404
 * - 삭제: 고객 참조가 없는 리뷰(관리자 등록)는 아바타 파일도 삭제
 */
@Service
public class ReviewService {

    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private static final int DEFAULT_LIMIT = 10;
    private static final int MAX_LIMIT = 100;

    private final ReviewRepository reviewRepository;
    private final ProductFamilyRepository familyRepository;
    private final CustomerRepository customerRepository;
    private final ReviewTransactionService reviewTransactionService;

    public ReviewService(ReviewRepository reviewRepository,
                         ProductFamilyRepository familyRepository,
                         CustomerRepository customerRepository,
                         ReviewTransactionService reviewTransactionService) {
        this.reviewRepository = reviewRepository;
        this.familyRepository = familyRepository;
        this.customerRepository = customerRepository;
        this.reviewTransactionService = reviewTransactionService;
    }

    @CacheEvict(value = CacheNames.PRODUCT_DETAIL, allEntries = true)
    public ReviewResponse store(Long customerId, String productName, Integer rating, String comment) {
        ProductFamily family = requireFamily(productName);
        requireRating(rating);
        Customer customer = customerRepository.findById(customerId)
                .orElseThrow(() -> new CustomerNotFoundException(customerId));

        Review saved = reviewTransactionService.upsert(customer, family, rating, comment);
        log.info("[ReviewService] 리뷰 저장 - reviewId={}, customerId={}, product={}, rating={}",
                saved.getId(), customerId, family.getName(), rating);
        return ReviewResponse.from(saved);
    }

    @CacheEvict(value = CacheNames.PRODUCT_DETAIL, allEntries = true)
    public ReviewResponse create(ReviewCommand command) {
        ProductFamily family = requireFamily(command.getProductName());
        requireRating(command.getRating());
        if (command.getCustomerName() == null || command.getCustomerName().isBlank()) {
            throw new InvalidRequestException("customer_name은 필수입니다");
        }

        Review saved = reviewTransactionService.create(family, command);
        log.info("[ReviewService] 관리자 리뷰 등록 - reviewId={}, product={}, rating={}",
                saved.getId(), family.getName(), saved.getRating());
        return ReviewResponse.from(saved);
    }

    @CacheEvict(value = CacheNames.PRODUCT_DETAIL, allEntries = true)
    public ReviewResponse update(Long reviewId, ReviewCommand command) {
        if (command.getRating() != null) {
            requireRating(command.getRating());
        }
        Review saved = reviewTransactionService.update(reviewId, command);
        log.info("[ReviewService] 리뷰 수정 - reviewId={}, product={}", reviewId, saved.getProductName());
        return ReviewResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public ReviewListResponse list(String page, String limit, String productName) {
        PageParams pageParams = PageParams.parse(page, limit, DEFAULT_LIMIT, MAX_LIMIT);
        String filter = productName == null || productName.isBlank() ? null : productName.trim();

        List<ReviewResponse> reviews = reviewRepository.findPage(filter, pageParams).stream()
                .map(ReviewResponse::from)
                .collect(Collectors.toList());
        long total = reviewRepository.count(filter);

        return new ReviewListResponse(reviews, total, pageParams.getPage(), pageParams.getLimit(),
                pageParams.totalPages(total));
    }

    @CacheEvict(value = CacheNames.PRODUCT_DETAIL, allEntries = true)
    public void delete(Long reviewId) {
        Review deleted = reviewTransactionService.delete(reviewId);
        log.info("[ReviewService] 리뷰 삭제 - reviewId={}, product={}", reviewId, deleted.getProductName());
    }

    private ProductFamily requireFamily(String productName) {
        if (productName == null || productName.isBlank()) {
            throw new InvalidRequestException("product_name은 필수입니다");
        }
        return familyRepository.findByName(productName.trim())
                .orElseThrow(() -> new ProductNotFoundException(productName));
    }

    private static void requireRating(Integer rating) {
        if (rating == null || rating < Review.MIN_RATING || rating > Review.MAX_RATING) {
            throw new InvalidRequestException("rating은 1 이상 5 이하여야 합니다");
        }
    }
}
