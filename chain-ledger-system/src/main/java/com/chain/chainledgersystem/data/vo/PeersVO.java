package com.chain.chainledgersystem.data.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PeersVO {
    private List<String> peers;
    private int count;
}
