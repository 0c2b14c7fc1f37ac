package com.chain.chainledgersystem.data.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一次链同步的结果，未同步时 new_length 与 synced_from 为空
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SyncResult {
    private String message;
    private Long newLength;
    private boolean synced;
    private String syncedFrom;

    public static SyncResult upToDate() {
        return new SyncResult("Chain is up to date", null, false, null);
    }

    public static SyncResult synced(long newLength, String syncedFrom) {
        return new SyncResult("Chain synchronized", newLength, true, syncedFrom);
    }
}
