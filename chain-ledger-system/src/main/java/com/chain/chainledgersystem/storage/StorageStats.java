package com.chain.chainledgersystem.storage;

import lombok.Data;

@Data
public class StorageStats {
    private long blocks;
    private long items;
    private long transfers;
    private String storagePath;
    //近似占用空间 MB
    private double sizeMb;
}
