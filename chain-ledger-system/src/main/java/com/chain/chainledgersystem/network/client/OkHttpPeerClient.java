package com.chain.chainledgersystem.network.client;

import com.chain.chainledgersystem.data.dto.PeerRequest;
import com.chain.chainledgersystem.data.dto.ReceiveTransactionRequest;
import com.chain.chainledgersystem.data.transaction.Transaction;
import com.chain.chainledgersystem.data.vo.ChainVO;
import com.chain.chainledgersystem.data.vo.PingVO;
import com.chain.chainledgersystem.exception.PeerUnreachableException;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;

@Slf4j
public class OkHttpPeerClient implements PeerClient {

    public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient client;
    private final Gson gson;

    public OkHttpPeerClient(OkHttpClient client, Gson gson) {
        this.client = client;
        this.gson = gson;
    }

    @Override
    public PingVO ping(String peerUrl) throws PeerUnreachableException {
        Request request = new Request.Builder().url(url(peerUrl, "/ping")).get().build();
        return execute(peerUrl, request, PingVO.class);
    }

    @Override
    public ChainVO fetchChain(String peerUrl) throws PeerUnreachableException {
        Request request = new Request.Builder().url(url(peerUrl, "/chain")).get().build();
        ChainVO chainVO = execute(peerUrl, request, ChainVO.class);
        if (chainVO == null || chainVO.getChain() == null) {
            throw new PeerUnreachableException(peerUrl, "节点返回的链为空");
        }
        return chainVO;
    }

    @Override
    public void sendTransaction(String peerUrl, Transaction transaction) throws PeerUnreachableException {
        post(peerUrl, "/transaction/receive", new ReceiveTransactionRequest(transaction));
    }

    @Override
    public void registerPeer(String peerUrl, String selfUrl) throws PeerUnreachableException {
        post(peerUrl, "/peers/add", new PeerRequest(selfUrl));
    }

    private void post(String peerUrl, String path, Object payload) throws PeerUnreachableException {
        RequestBody body = RequestBody.create(gson.toJson(payload), JSON);
        Request request = new Request.Builder().url(url(peerUrl, path)).post(body).build();
        execute(peerUrl, request, null);
    }

    private static HttpUrl url(String peerUrl, String path) throws PeerUnreachableException {
        HttpUrl url = HttpUrl.parse(peerUrl + path);
        if (url == null) {
            throw new PeerUnreachableException(peerUrl, "非法的节点地址: " + peerUrl);
        }
        return url;
    }

    private <T> T execute(String peerUrl, Request request, Class<T> responseType) throws PeerUnreachableException {
        try (Response response = client.newCall(request).execute()) {
            log.debug("{} {} -> {}", request.method(), request.url(), response.code());
            if (!response.isSuccessful()) {
                throw new PeerUnreachableException(peerUrl,
                        "节点返回状态码 " + response.code() + " : " + request.url());
            }
            if (responseType == null) {
                return null;
            }
            ResponseBody responseBody = response.body();
            if (responseBody == null) {
                throw new PeerUnreachableException(peerUrl, "节点应答为空: " + request.url());
            }
            return gson.fromJson(responseBody.string(), responseType);
        } catch (IOException e) {
            throw new PeerUnreachableException(peerUrl, "请求节点失败: " + request.url(), e);
        } catch (JsonParseException e) {
            throw new PeerUnreachableException(peerUrl, "无法解析节点应答: " + request.url(), e);
        }
    }
}
