package com.chain.chainledgersystem.data.vo;

import com.chain.chainledgersystem.data.item.ItemRecord;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ItemsVO {
    private List<ItemRecord> items;
    private int count;
}
