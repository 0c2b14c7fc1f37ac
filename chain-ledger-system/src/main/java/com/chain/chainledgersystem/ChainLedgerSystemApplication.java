package com.chain.chainledgersystem;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;

@Slf4j
@SpringBootApplication(scanBasePackages = "com.chain.chainledgersystem")
public class ChainLedgerSystemApplication {
    public static void main(String[] args) {
        ConfigurableApplicationContext application = SpringApplication.run(ChainLedgerSystemApplication.class, args);
        Environment env = application.getEnvironment();
        log.info("ChainLedger 节点已启动：node_id={} port={}",
                env.getProperty("system.node-id"), env.getProperty("server.port"));
    }
}
