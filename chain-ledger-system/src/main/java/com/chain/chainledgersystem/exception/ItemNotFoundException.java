package com.chain.chainledgersystem.exception;

public class ItemNotFoundException extends RuntimeException {

    private final String itemId;

    public ItemNotFoundException(String itemId) {
        super("物品不存在: " + itemId);
        this.itemId = itemId;
    }

    public String getItemId() {
        return itemId;
    }
}
