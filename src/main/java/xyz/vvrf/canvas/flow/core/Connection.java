package xyz.vvrf.canvas.flow.core;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * 有向连接: {@code toId} 可以消费 {@code fromId} 的输出。
 * {@code instruction} 是连接上附带的说明文字，引擎不解释它。
 */
@Value
@Builder
public class Connection {
    @NonNull
    String id;
    @NonNull
    String fromId;
    @NonNull
    String toId;
    String instruction;

    public static Connection of(String id, String fromId, String toId) {
        return Connection.builder().id(id).fromId(fromId).toId(toId).build();
    }
}
