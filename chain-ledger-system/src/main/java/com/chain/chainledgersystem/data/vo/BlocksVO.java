package com.chain.chainledgersystem.data.vo;

import com.chain.chainledgersystem.data.block.Block;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BlocksVO {
    private List<Block> blocks;
    private int count;
}
