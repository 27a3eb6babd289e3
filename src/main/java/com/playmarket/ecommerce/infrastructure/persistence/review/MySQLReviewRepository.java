package com.playmarket.ecommerce.infrastructure.persistence.review;

import com.playmarket.ecommerce.common.util.PageParams;
import com.playmarket.ecommerce.domain.review.RatingSummary;
import com.playmarket.ecommerce.domain.review.Review;
import com.playmarket.ecommerce.domain.review.ReviewRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@Primary
public class MySQLReviewRepository implements ReviewRepository {

    private final ReviewJpaRepository reviewJpaRepository;

    public MySQLReviewRepository(ReviewJpaRepository reviewJpaRepository) {
        this.reviewJpaRepository = reviewJpaRepository;
    }

    @Override
    public Optional<Review> findById(Long reviewId) {
        return reviewJpaRepository.findById(reviewId);
    }

    @Override
    public Optional<Review> findByCustomerIdAndProductName(Long customerId, String productName) {
        return reviewJpaRepository.findByCustomerIdAndProductName(customerId, productName);
    }

    @Override
    public List<Review> findPage(String productName, PageParams pageParams) {
        return reviewJpaRepository.findPage(productName,
                PageRequest.of(pageParams.getPage() - 1, pageParams.getLimit(),
                        Sort.by(Sort.Direction.DESC, "createdAt")));
    }

    @Override
    public long count(String productName) {
        return reviewJpaRepository.countByProductName(productName);
    }

    @Override
    public RatingSummary summarize(String productName) {
        List<Object[]> rows = reviewJpaRepository.summarize(productName);
        if (rows.isEmpty()) {
            return RatingSummary.EMPTY;
        }
        Object[] row = rows.get(0);
        Double average = row[0] == null ? null : ((Number) row[0]).doubleValue();
        long count = row[1] == null ? 0L : ((Number) row[1]).longValue();
        return RatingSummary.of(average, count);
    }

    @Override
    public Review saveAndFlush(Review review) {
        return reviewJpaRepository.saveAndFlush(review);
    }

    @Override
    public void delete(Review review) {
        reviewJpaRepository.delete(review);
    }
}
