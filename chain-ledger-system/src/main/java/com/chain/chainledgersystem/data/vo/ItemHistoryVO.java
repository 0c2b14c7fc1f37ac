package com.chain.chainledgersystem.data.vo;

import com.chain.chainledgersystem.data.item.HistoryEntry;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ItemHistoryVO {
    private String itemId;
    private List<HistoryEntry> history;
}
