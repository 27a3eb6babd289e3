package com.playmarket.ecommerce.domain.review;

import com.playmarket.ecommerce.common.exception.DomainException;
import com.playmarket.ecommerce.common.exception.ErrorCode;

public class ReviewNotFoundException extends DomainException {

    public ReviewNotFoundException(Long reviewId) {
        super(ErrorCode.REVIEW_NOT_FOUND, "Review ID: " + reviewId);
    }
}
