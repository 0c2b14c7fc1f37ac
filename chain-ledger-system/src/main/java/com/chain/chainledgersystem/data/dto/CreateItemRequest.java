package com.chain.chainledgersystem.data.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateItemRequest {
    private String itemId;
    private String description;
    private String actor;
    private String location;
    private String itemType;
    //可选 物品内容摘要
    private String contentHash;
}
