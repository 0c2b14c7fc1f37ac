package com.chain.chainledgersystem.constant;

public class BlockChainConstants {

    //创世区块的前一个区块hash 哨兵值
    public static final String GENESIS_PREVIOUS_HASH = "0";
    //创世区块载荷
    public static final String GENESIS_TYPE = "genesis";
    public static final String GENESIS_MESSAGE = "ChainLedger Genesis Block";

    //nonce 保留字段 不做工作量证明
    public static final int DEFAULT_NONCE = 0;

    //交易类型
    public static final String TX_TYPE_CREATION = "item_creation";
    public static final String TX_TYPE_TRANSFER = "item_transfer";

    //交易动作
    public static final String ACTION_CREATED = "Created";
    public static final String ACTION_TRANSFERRED = "Transferred";

    //远程调用超时 毫秒
    public static final int RPC_TIMEOUT = 5000;

    //自动同步间隔 秒
    public static final long SYNC_INTERVAL_SECONDS = 10;

    //数据库文件名前缀
    public static final String DB_NAME_PREFIX = "chainledger_";

    //备份目录与备份名前缀
    public static final String BACKUP_DIR = "backups";
    public static final String BACKUP_NAME_PREFIX = "chainledger_backup_";

    private BlockChainConstants() {
    }
}
