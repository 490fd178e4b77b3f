package com.duelo.entity;

public enum TransactionType {
    PURCHASE,
    CONSUMPTION,
    REFUND,
    ADMIN_ADJUSTMENT
}
