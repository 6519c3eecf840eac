package xyz.vvrf.canvas.flow.core;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FileInput {
    String name;
    String path;
    String type;
    String content;
    long size;
}
