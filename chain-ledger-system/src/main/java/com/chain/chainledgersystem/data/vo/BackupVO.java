package com.chain.chainledgersystem.data.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BackupVO {
    private String status;
    private String backupPath;
}
