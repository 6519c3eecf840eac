package xyz.vvrf.canvas.flow.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 批量输入来源，引擎原样转交给生成调度器。
 */
@Value
@Builder
public class BatchInputSource {

    public enum SourceType {
        FOLDER, FILES
    }

    SourceType type;
    String path;
    @Singular
    List<FileInput> files;
}
