package com.flagship.pawnshop.inventory;

public enum ItemCategory {
    JEWELRY,
    ELECTRONICS,
    MUSICAL_INSTRUMENTS,
    TOOLS,
    WATCHES,
    FIREARMS,
    COLLECTIBLES,
    LUXURY_ITEMS,
    OTHER
}
