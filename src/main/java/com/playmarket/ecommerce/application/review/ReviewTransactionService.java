package com.playmarket.ecommerce.application.review;

import com.playmarket.ecommerce.application.review.dto.ReviewCommand;
import com.playmarket.ecommerce.common.util.AfterCommit;
import com.playmarket.ecommerce.domain.customer.Customer;
import com.playmarket.ecommerce.domain.product.ProductFamily;
import com.playmarket.ecommerce.domain.product.ProductFamilyRepository;
import com.playmarket.ecommerce.domain.review.RatingSummary;
import com.playmarket.ecommerce.domain.review.Review;
import com.playmarket.ecommerce.domain.review.ReviewNotFoundException;
import com.playmarket.ecommerce.domain.review.ReviewRepository;
import com.playmarket.ecommerce.domain.storage.FileStorage;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 리뷰 쓰기 (트랜잭션 경계)
 *
 * 작성/수정/삭제 후 같은 트랜잭션에서 상품군의 평점 요약(ratings, reviewCount)을 다시 계산한다.
 * 관리자 리뷰(고객 참조 없음)의 아바타 파일은 교체되거나 리뷰가 삭제되면 커밋 이후 지운다.
 */
@Service
public class ReviewTransactionService {

    private final ReviewRepository reviewRepository;
    private final ProductFamilyRepository familyRepository;
    private final FileStorage fileStorage;

    public ReviewTransactionService(ReviewRepository reviewRepository,
                                    ProductFamilyRepository familyRepository,
                                    FileStorage fileStorage) {
        this.reviewRepository = reviewRepository;
        this.familyRepository = familyRepository;
        this.fileStorage = fileStorage;
    }

    /**
     * (고객, 상품군) 리뷰 upsert
     *
     * 같은 고객의 최초 작성이 동시에 들어오면 한쪽은 유니크 제약에 걸린다.
     * 재시도하면 이미 저장된 리뷰를 찾아 갱신 경로로 처리된다.
     */
    @Transactional
    @Retryable(
            retryFor = DataIntegrityViolationException.class,
            maxAttempts = 2,
            backoff = @Backoff(delay = 20)
    )
    public Review upsert(Customer customer, ProductFamily family, int rating, String comment) {
        Review review = reviewRepository.findByCustomerIdAndProductName(customer.getId(), family.getName())
                .map(existing -> {
                    existing.rewrite(rating, comment, customer.getName(), customer.getAvatar());
                    return existing;
                })
                .orElseGet(() -> Review.write(customer.getId(), family.getName(), rating, comment,
                        customer.getName(), customer.getAvatar()));

        Review saved = reviewRepository.saveAndFlush(review);
        refreshRatings(family.getName());
        return saved;
    }

    /**
     * 관리자 리뷰 등록 (고객 참조 없음)
     */
    @Transactional
    public Review create(ProductFamily family, ReviewCommand command) {
        Review saved = reviewRepository.saveAndFlush(Review.write(null, family.getName(), command.getRating(),
                command.getComment(), command.getCustomerName().trim(), command.getCustomerAvatar()));
        refreshRatings(family.getName());
        return saved;
    }

    @Transactional
    public Review update(Long reviewId, ReviewCommand command) {
        Review review = reviewRepository.findById(reviewId)
                .orElseThrow(() -> new ReviewNotFoundException(reviewId));
        String replacedAvatar = review.edit(command.getRating(), command.getComment(),
                command.getCustomerName(), command.getCustomerAvatar());

        Review saved = reviewRepository.saveAndFlush(review);
        refreshRatings(saved.getProductName());
        if (!saved.hasCustomerReference() && replacedAvatar != null) {
            AfterCommit.run(() -> fileStorage.deleteFile(replacedAvatar));
        }
        return saved;
    }

    /**
     * @return 삭제된 리뷰
     */
    @Transactional
    public Review delete(Long reviewId) {
        Review review = reviewRepository.findById(reviewId)
                .orElseThrow(() -> new ReviewNotFoundException(reviewId));
        reviewRepository.delete(review);
        refreshRatings(review.getProductName());
        if (!review.hasCustomerReference() && review.getCustomerAvatar() != null) {
            String avatar = review.getCustomerAvatar();
            AfterCommit.run(() -> fileStorage.deleteFile(avatar));
        }
        return review;
    }

    private void refreshRatings(String productName) {
        familyRepository.findByName(productName).ifPresent(family -> {
            RatingSummary summary = reviewRepository.summarize(productName);
            family.applyReviewSummary(summary.getAverage(), (int) summary.getCount());
            familyRepository.save(family);
        });
    }
}
