package com.playmarket.ecommerce.infrastructure.persistence.review;

import com.playmarket.ecommerce.domain.review.Review;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ReviewJpaRepository extends JpaRepository<Review, Long> {

    Optional<Review> findByCustomerIdAndProductName(Long customerId, String productName);

    @Query("SELECT r FROM Review r WHERE (:productName IS NULL OR r.productName = :productName)")
    List<Review> findPage(@Param("productName") String productName, Pageable pageable);

    @Query("SELECT COUNT(r) FROM Review r WHERE (:productName IS NULL OR r.productName = :productName)")
    long countByProductName(@Param("productName") String productName);

    @Query("SELECT AVG(r.rating), COUNT(r) FROM Review r WHERE r.productName = :productName")
    List<Object[]> summarize(@Param("productName") String productName);
}
