package com.chain.chainledgersystem.config;

import com.chain.chainledgersystem.network.client.OkHttpPeerClient;
import com.chain.chainledgersystem.network.client.PeerClient;
import com.chain.chainledgersystem.serialization.gson.GsonFactory;
import com.google.gson.Gson;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Collections;
import java.util.concurrent.TimeUnit;

@Configuration
public class NetworkConfig {

    /**
     * Spring MVC 与节点间调用使用同一份Gson配置
     */
    @Bean
    public Gson gson() {
        return GsonFactory.getGson();
    }

    @Bean
    public OkHttpClient okHttpClient(SystemConfig systemConfig) {
        long timeoutMs = systemConfig.getPeer().getTimeoutMs();
        return new OkHttpClient.Builder()
                .connectTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .writeTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .protocols(Collections.singletonList(Protocol.HTTP_1_1))
                .connectionPool(new ConnectionPool(16, 1, TimeUnit.MINUTES))
                .build();
    }

    @Bean
    public PeerClient peerClient(OkHttpClient okHttpClient, Gson gson) {
        return new OkHttpPeerClient(okHttpClient, gson);
    }
}
