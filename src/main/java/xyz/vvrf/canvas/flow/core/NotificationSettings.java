package xyz.vvrf.canvas.flow.core;

import lombok.Builder;
import lombok.Value;

/**
 * 调用方的通知偏好。未设置的项视为开启。
 */
@Value
@Builder
public class NotificationSettings {

    public static final NotificationSettings ALL = NotificationSettings.builder().build();

    Boolean onProgress;
    Boolean onCompletion;
    Boolean onError;

    public boolean progressEnabled() {
        return onProgress == null || onProgress;
    }

    public boolean completionEnabled() {
        return onCompletion == null || onCompletion;
    }

    public boolean errorEnabled() {
        return onError == null || onError;
    }
}
