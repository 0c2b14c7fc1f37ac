package com.chain.chainledgersystem.util;

import com.chain.chainledgersystem.data.item.ItemRecord;
import com.chain.chainledgersystem.data.item.TransferRecord;
import com.chain.chainledgersystem.network.common.NodeInfo;
import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.esotericsoftware.kryo.util.DefaultInstantiatorStrategy;

import java.util.ArrayList;
import java.util.List;

/**
 * 投影行的二进制序列化（Kryo 5.x，无KryoPool版本）
 */
public class SerializeUtils {

    // 每个线程一个独立Kryo实例
    private static final ThreadLocal<Kryo> kryoThreadLocal = ThreadLocal.withInitial(() -> {
        Kryo kryo = new Kryo();
        kryo.setInstantiatorStrategy(new DefaultInstantiatorStrategy());
        kryo.setRegistrationRequired(false);
        kryo.setReferences(false);

        kryo.register(List.class);
        kryo.register(ArrayList.class);

        kryo.register(ItemRecord.class);
        kryo.register(TransferRecord.class);
        kryo.register(NodeInfo.class);
        return kryo;
    });

    public static Object deSerialize(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return null;
        }
        Kryo kryo = kryoThreadLocal.get();
        try (Input input = new Input(bytes)) {
            return kryo.readClassAndObject(input);
        } catch (Exception e) {
            throw new IllegalStateException("反序列化失败: " + e.getMessage(), e);
        }
    }

    public static byte[] serialize(Object object) {
        if (object == null) {
            return new byte[0];
        }
        Kryo kryo = kryoThreadLocal.get();
        try (Output output = new Output(1024, -1)) {
            kryo.writeClassAndObject(output, object);
            return output.toBytes();
        } catch (Exception e) {
            throw new IllegalStateException("序列化失败: " + e.getMessage(), e);
        }
    }

    private SerializeUtils() {
    }
}
