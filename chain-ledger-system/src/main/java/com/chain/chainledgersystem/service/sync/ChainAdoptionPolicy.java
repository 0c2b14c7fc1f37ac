package com.chain.chainledgersystem.service.sync;

import com.chain.chainledgersystem.data.block.Block;
import com.chain.chainledgersystem.service.blockChain.BlockChainServiceImpl;

import java.util.List;

/**
 * 是否接受一条更长的候选链
 */
public enum ChainAdoptionPolicy {

    //受信网络 更长即接受
    TRUST_LONGEST {
        @Override
        public boolean accept(List<Block> candidate) {
            return true;
        }
    },

    //候选链需通过完整性校验
    VALIDATE_BEFORE_ADOPT {
        @Override
        public boolean accept(List<Block> candidate) {
            return BlockChainServiceImpl.isValidChain(candidate);
        }
    };

    public abstract boolean accept(List<Block> candidate);
}
