package xyz.vvrf.canvas.flow.core;

/**
 * 生成块的内容类型。
 */
public enum BlockKind {
    TEXT, IMAGE, VIDEO
}
