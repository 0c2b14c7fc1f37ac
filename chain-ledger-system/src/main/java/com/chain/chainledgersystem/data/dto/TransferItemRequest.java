package com.chain.chainledgersystem.data.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransferItemRequest {
    private String itemId;
    private String fromActor;
    private String toActor;
    private String reason;
}
