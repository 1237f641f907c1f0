package com.flagship.pawnshop.transaction;

public enum TransactionType {
    PAWN,
    REDEMPTION,
    SALE,
    PAYMENT,
    EXTENSION,
    REFUND,
    ADJUSTMENT
}
