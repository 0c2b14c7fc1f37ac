package com.chain.chainledgersystem.data.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConnectResult {
    private boolean connected;
    private String message;
    private List<String> peers;
}
