package com.playmarket.ecommerce.domain.payment;

public enum TransactionType {
    SELL
}
