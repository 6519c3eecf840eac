package xyz.vvrf.canvas.flow.execution;

import reactor.core.publisher.Mono;
import xyz.vvrf.canvas.flow.core.Block;
import xyz.vvrf.canvas.flow.core.BlockResult;

/**
 * 负责执行单个块: 读取上游数据、解析变量、调用生成、发布输出。
 * 实现不应让错误逃逸，失败需转换为 FAILED 的 {@link BlockResult}。
 */
public interface BlockExecutor {

    /**
     * @param block   要执行的块
     * @param context 所属运行的上下文
     * @return 恰好发出一个结果的 Mono
     */
    Mono<BlockResult> execute(Block block, WorkflowExecutionContext context);
}
