package com.chain.chainledgersystem.data.block;

import com.chain.chainledgersystem.constant.BlockChainConstants;
import com.chain.chainledgersystem.serialization.gson.GsonFactory;
import com.chain.chainledgersystem.util.CryptoUtil;
import com.google.gson.JsonObject;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 区块。线上传输与持久化使用同一字段集：
 * index, timestamp, payload, previous_hash, nonce, hash
 * 封装后的区块只由账本持有，对外一律交出 {@link #copy()}。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@ToString
public class Block {

    //区块序号 创世区块为0
    private long index;
    //创建时间 Unix 秒（含小数）
    private double timestamp;
    //创世标记或交易列表
    private BlockPayload payload;
    //前一个区块的hash 创世区块为 "0"
    private String previousHash;
    //保留字段 恒为0
    private int nonce;
    //SHA-256 十六进制
    private String hash;

    /**
     * 封装新区块并计算hash
     */
    public static Block seal(long index, double timestamp, BlockPayload payload, String previousHash) {
        Block block = new Block(index, timestamp, payload, previousHash, BlockChainConstants.DEFAULT_NONCE, null);
        block.setHash(block.computeHash());
        return block;
    }

    /**
     * 对 (index, timestamp, payload, previous_hash, nonce) 的规范化JSON（键按字典序）取SHA-256
     */
    public String computeHash() {
        JsonObject content = new JsonObject();
        content.addProperty("index", index);
        content.addProperty("timestamp", timestamp);
        content.add("payload", GsonFactory.getGson().toJsonTree(payload, BlockPayload.class));
        content.addProperty("previous_hash", previousHash);
        content.addProperty("nonce", nonce);
        return CryptoUtil.sha256Hex(GsonFactory.toCanonicalJson(content));
    }

    /**
     * 经JSON往返得到的深拷贝，修改拷贝不影响链上的区块
     */
    public Block copy() {
        return GsonFactory.getGson().fromJson(GsonFactory.getGson().toJson(this), Block.class);
    }

    public boolean isGenesis() {
        return payload != null && payload.isGenesis();
    }
}
